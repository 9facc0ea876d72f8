package com.example.refreshingclient.core;

/**
 * Deferred remote operation that can be executed more than once.
 *
 * @param <T> result type
 * @param <E> checked exception type raised by the operation
 */
@FunctionalInterface
public interface RemoteCall<T, E extends Exception> {
  T call() throws E;
}
