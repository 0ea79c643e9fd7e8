package io.waypost.core.spi;

/**
 * Transport server SPI: owns sockets, connections and HTTP wire handling,
 * and calls a {@link RequestDispatcher} for each request. Concurrent request
 * fan-out is the transport's responsibility; the dispatcher is safe to call
 * from many threads.
 */
public interface TransportServer {

    /**
     * Binds {@code address} and starts serving. Returns once the server
     * accepts connections.
     *
     * @throws io.waypost.core.error.TransportBindException if the address cannot be bound
     */
    void start(BindAddress address, RequestDispatcher dispatcher);

    /** The bound port; meaningful after {@link #start}. */
    int port();

    /** Stops accepting requests and releases the listening socket. */
    void stop();
}
