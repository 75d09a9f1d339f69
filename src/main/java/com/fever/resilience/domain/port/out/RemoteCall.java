package com.fever.resilience.domain.port.out;

/**
 * An outbound call to an unreliable, latency-variable dependency.
 * Every wrapper in this project takes a {@code RemoteCall} and returns another one
 * with the same input/output contract, so wrappers compose by nesting.
 *
 * @param <I> request type
 * @param <O> response type
 */
@FunctionalInterface
public interface RemoteCall<I, O> {

    O call(I input) throws Exception;
}
