package io.waypost.core.spi;

/**
 * Callback a {@link TransportServer} invokes for every inbound request.
 * Implementations never throw: every failure is converted into a response.
 */
@FunctionalInterface
public interface RequestDispatcher {

    TransportResponse dispatch(TransportRequest request);
}
