package com.ryuqq.courier.core.spi;

/**
 * Per-type message observer.
 *
 * <p>A logger registered for a message type sees every successful send and every successful
 * receive of that type, tagged with the direction. It is an audit hook for the surrounding
 * application and has no influence on delivery.</p>
 *
 * <p>Loggers are invoked on the sending or receiving thread, after the bus lock has been
 * released.</p>
 *
 * @param <T> message type
 * @author Courier Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageLogger<T> {

    /**
     * Observes one message.
     *
     * @param payload the message payload
     * @param sending {@code true} for a send, {@code false} for a receive
     */
    void log(T payload, boolean sending);
}
