package com.ryuqq.courier.core.spi;

import com.ryuqq.courier.core.handler.HandlerCallbacks;
import com.ryuqq.courier.core.handler.MessageHandler;
import com.ryuqq.courier.core.model.MessageTypeSet;
import com.ryuqq.courier.core.model.TargetId;

import java.time.Duration;
import java.util.Optional;

/**
 * Typed in-process message bus SPI.
 *
 * <p>A bus routes strongly-typed messages between producer and consumer threads. Each bus
 * carries a closed set of message types fixed at construction ({@link #messageTypes()});
 * every type owns an independent FIFO queue of (payload, target) entries.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Sending messages, optionally throttled by a per-call queue capacity (backpressure)</li>
 *   <li>Scheduling delayed sends without blocking the caller</li>
 *   <li>Receiving messages by polling or blocking, optionally filtered by {@link TargetId}</li>
 *   <li>Running background handlers that consume a type through callbacks</li>
 *   <li>Observing traffic through per-type {@link MessageLogger}s</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: every method may be called from any thread</li>
 *   <li>At-most-once delivery: a payload is returned by at most one receive</li>
 *   <li>FIFO per type among entries matching a receive filter</li>
 *   <li>Disposal releases every blocked sender and receiver without raising an exception</li>
 * </ul>
 *
 * <p><strong>Shutdown ordering contract:</strong> a producer throttling on a bounded queue
 * (via {@code maxQueued}) must be stopped before the consumers draining that queue. Disposal
 * releases blocked producers, but the correctness of in-flight work is the caller's
 * responsibility.</p>
 *
 * <p><strong>Sends after disposal</strong> are accepted and enqueued but are never delivered to an
 * active handler. This keeps producers from deadlocking during teardown.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (MessageBus bus = new InMemoryMessageBus(MessageTypeSet.of(Request.class, Reply.class))) {
 *     bus.addHandler(Request.class, request -&gt; bus.send(new Reply(request.id())));
 *
 *     bus.send(new Request(1));
 *     Optional&lt;Reply&gt; reply = bus.receive(Reply.class, true);
 * }
 * </pre>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public interface MessageBus extends AutoCloseable {

    /**
     * Returns the closed set of message types this bus carries.
     *
     * @return registered message types
     */
    MessageTypeSet messageTypes();

    /**
     * Sends a payload using its runtime class as the message type.
     *
     * <p>Never blocks on capacity; delivered to any receiver.</p>
     *
     * @param payload the message
     * @param <T> message type
     * @throws IllegalArgumentException if payload is null
     * @throws com.ryuqq.courier.core.exception.UnregisteredMessageTypeException if the payload's class is not registered
     */
    <T> void send(T payload);

    /**
     * Sends a payload as the given message type without capacity limit.
     *
     * @param type registered message type
     * @param payload the message
     * @param <T> message type
     */
    default <T> void send(Class<T> type, T payload) {
        send(type, payload, 0, TargetId.ANY);
    }

    /**
     * Sends a payload as the given message type, throttled by queue capacity.
     *
     * @param type registered message type
     * @param payload the message
     * @param maxQueued capacity of the destination queue; 0 means unbounded
     * @param <T> message type
     */
    default <T> void send(Class<T> type, T payload, int maxQueued) {
        send(type, payload, maxQueued, TargetId.ANY);
    }

    /**
     * Sends a payload as the given message type.
     *
     * <p><strong>Blocking Behavior:</strong></p>
     * <ul>
     *   <li>maxQueued = 0: never blocks</li>
     *   <li>maxQueued &gt; 0: blocks while the bus is running and the queue holds at least
     *       {@code maxQueued} entries</li>
     *   <li>Disposal releases a blocked sender; the entry is still appended</li>
     * </ul>
     *
     * @param type registered message type
     * @param payload the message
     * @param maxQueued capacity of the destination queue; 0 means unbounded
     * @param target receiver the entry is addressed to, or {@link TargetId#ANY}
     * @param <T> message type
     * @throws IllegalArgumentException if payload or target is null, or maxQueued is negative
     * @throws com.ryuqq.courier.core.exception.UnregisteredMessageTypeException if type is not registered
     */
    <T> void send(Class<T> type, T payload, int maxQueued, TargetId target);

    /**
     * Schedules {@code send(type, payload)} to happen after {@code delay}.
     *
     * <p>This method never blocks. There is no way to cancel a single pending delayed send;
     * pending sends are dropped when the bus is disposed.</p>
     *
     * @param type registered message type
     * @param payload the message
     * @param delay time to wait before sending
     * @param <T> message type
     * @throws IllegalArgumentException if payload or delay is null, or delay is negative
     */
    <T> void sendDelayed(Class<T> type, T payload, Duration delay);

    /**
     * Polls for a message of the given type addressed to anyone.
     *
     * @param type registered message type
     * @param <T> message type
     * @return the oldest message, or empty if the queue is empty
     */
    default <T> Optional<T> receive(Class<T> type) {
        return receive(type, false, TargetId.ANY);
    }

    /**
     * Receives a message of the given type addressed to anyone.
     *
     * @param type registered message type
     * @param waitForMessage {@code true} to block until a message arrives or the bus is disposed
     * @param <T> message type
     * @return the oldest message, or empty
     */
    default <T> Optional<T> receive(Class<T> type, boolean waitForMessage) {
        return receive(type, waitForMessage, TargetId.ANY);
    }

    /**
     * Receives the oldest message of the given type that matches {@code target}.
     *
     * <p>An entry matches when it was sent to {@link TargetId#ANY}, when it was sent to
     * {@code target}, or when {@code target} itself is {@link TargetId#ANY}.</p>
     *
     * @param type registered message type
     * @param waitForMessage {@code true} to block until a matching message arrives or the bus is disposed
     * @param target receiver identity
     * @param <T> message type
     * @return the oldest matching message, or empty when none exists (or on disposal)
     * @throws IllegalArgumentException if target is null
     * @throws com.ryuqq.courier.core.exception.UnregisteredMessageTypeException if type is not registered
     */
    <T> Optional<T> receive(Class<T> type, boolean waitForMessage, TargetId target);

    /**
     * Returns the number of queued entries of one type. Advisory only.
     *
     * @param type registered message type
     * @return queue length
     */
    int size(Class<?> type);

    /**
     * Returns the number of queued entries across all types. Advisory only.
     *
     * @return total queue length
     */
    int totalSize();

    /**
     * Replaces the logger of one message type.
     *
     * @param type registered message type
     * @param logger the new logger, or {@code null} to remove it
     * @param <T> message type
     */
    <T> void setLogger(Class<T> type, MessageLogger<? super T> logger);

    /**
     * Registers a handler that consumes messages of one type on its own thread.
     *
     * @param type registered message type
     * @param onMessage message callback
     * @param <T> message type
     */
    default <T> void addHandler(Class<T> type, MessageHandler<? super T> onMessage) {
        addHandler(type, HandlerCallbacks.onMessage(onMessage), TargetId.ANY);
    }

    /**
     * Registers a handler that consumes messages of one type on its own thread.
     *
     * @param type registered message type
     * @param callbacks handler callbacks
     * @param <T> message type
     */
    default <T> void addHandler(Class<T> type, HandlerCallbacks<T> callbacks) {
        addHandler(type, callbacks, TargetId.ANY);
    }

    /**
     * Registers a handler that consumes messages of one type addressed to {@code target}.
     *
     * <p>The handler thread starts immediately and runs until the bus is disposed or
     * {@link #clearHandlers(Class)} is called for its type. Several handlers may be registered
     * for the same type; they compete for its queue.</p>
     *
     * @param type registered message type
     * @param callbacks handler callbacks
     * @param target receiver identity used by the handler's receive calls
     * @param <T> message type
     * @throws IllegalArgumentException if callbacks or target is null
     * @throws com.ryuqq.courier.core.exception.UnregisteredMessageTypeException if type is not registered
     */
    <T> void addHandler(Class<T> type, HandlerCallbacks<T> callbacks, TargetId target);

    /**
     * Stops every handler of one type and waits for their threads to finish.
     *
     * @param type registered message type
     */
    void clearHandlers(Class<?> type);

    /**
     * Returns the number of registered handlers of one type.
     *
     * @param type registered message type
     * @return handler count
     */
    int handlerCount(Class<?> type);

    /**
     * Returns whether the bus has not been disposed yet.
     *
     * @return {@code true} until {@link #dispose()} is called
     */
    boolean isRunning();

    /**
     * Disposes the bus.
     *
     * <p>Clears loggers, drains every queue, marks the bus as no longer running, wakes every
     * blocked sender and receiver, drops pending delayed sends, then stops and joins every
     * handler. Idempotent.</p>
     */
    void dispose();

    /**
     * Same as {@link #dispose()}.
     */
    @Override
    default void close() {
        dispose();
    }
}
