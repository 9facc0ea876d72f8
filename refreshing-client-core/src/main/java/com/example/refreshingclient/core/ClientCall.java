package com.example.refreshingclient.core;

/**
 * Remote operation expressed against the wrapped client.
 *
 * <pre>{@code
 * var project = refreshingClient.execute(c -> c.getProject("my-project"));
 * }</pre>
 *
 * @param <C> client type
 * @param <T> result type
 * @param <E> checked exception type raised by the operation
 */
@FunctionalInterface
public interface ClientCall<C, T, E extends Exception> {
  T call(C client) throws E;
}
