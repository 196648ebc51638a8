package com.ryuqq.courier.adapter.inmemory.bus;

import com.ryuqq.courier.adapter.inmemory.scheduler.DelayedSendScheduler;
import com.ryuqq.courier.core.contract.Envelope;
import com.ryuqq.courier.core.handler.HandlerCallbacks;
import com.ryuqq.courier.core.model.MessageTypeSet;
import com.ryuqq.courier.core.model.TargetId;
import com.ryuqq.courier.core.spi.MessageBus;
import com.ryuqq.courier.core.spi.MessageLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of the {@link MessageBus} SPI.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Type registry:</strong> one {@code TypeSlot} per registered type (queue, logger,
 *       handlers), built once at construction and never modified</li>
 *   <li><strong>Message lock:</strong> a single {@link ReentrantLock} with one {@link Condition}
 *       guards every queue and logger; every waiter re-checks its own predicate</li>
 *   <li><strong>Handlers:</strong> one {@link HandlerWorker} thread per registration</li>
 *   <li><strong>Delayed sends:</strong> a {@link DelayedSendScheduler} with its own lock</li>
 * </ul>
 *
 * <p>Senders and receivers of different types share the condition, so every state change wakes
 * all waiters. Waits are uninterruptible: disposal is the only way to release them.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (InMemoryMessageBus bus = InMemoryMessageBus.of(PrimeCheckRequest.class, PrimeFound.class)) {
 *     bus.addHandler(PrimeCheckRequest.class, request -&gt; {
 *         if (PrimeNumbers.isPrime(request.candidate())) {
 *             bus.send(new PrimeFound(request.candidate()));
 *         }
 *     });
 *
 *     bus.send(PrimeCheckRequest.class, new PrimeCheckRequest(97), 100);
 *     Optional&lt;PrimeFound&gt; found = bus.receive(PrimeFound.class, true);
 * }
 * </pre>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public class InMemoryMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final MessageTypeSet messageTypes;
    private final MessageBusConfig config;
    private final Map<Class<?>, TypeSlot<?>> slots;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    /**
     * Written only under {@link #lock}; read without it by handler loops.
     */
    private volatile boolean running = true;

    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final AtomicInteger threadSequence = new AtomicInteger();
    private final DelayedSendScheduler scheduler;

    /**
     * Creates a running bus with the default configuration.
     *
     * @param messageTypes the closed set of message types
     * @throws IllegalArgumentException if messageTypes is null
     */
    public InMemoryMessageBus(MessageTypeSet messageTypes) {
        this(messageTypes, new MessageBusConfig());
    }

    /**
     * Creates a running bus.
     *
     * @param messageTypes the closed set of message types
     * @param config thread naming, join timeout and delayed-send settings
     * @throws IllegalArgumentException if messageTypes or config is null
     */
    public InMemoryMessageBus(MessageTypeSet messageTypes, MessageBusConfig config) {
        if (messageTypes == null) {
            throw new IllegalArgumentException("messageTypes cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.messageTypes = messageTypes;
        this.config = config;

        Map<Class<?>, TypeSlot<?>> registry = new LinkedHashMap<>();
        for (Class<?> type : messageTypes.types()) {
            registry.put(type, new TypeSlot<>());
        }
        this.slots = Collections.unmodifiableMap(registry);
        this.scheduler = new DelayedSendScheduler(
            config.delayedSendThreads(), config.threadNamePrefix(), config.daemonThreads()
        );

        log.info("Message bus created: types={}", messageTypes);
    }

    /**
     * Creates a running bus for the given types with the default configuration.
     *
     * @param types message types
     * @return new bus
     */
    public static InMemoryMessageBus of(Class<?>... types) {
        return new InMemoryMessageBus(MessageTypeSet.of(types));
    }

    @Override
    public MessageTypeSet messageTypes() {
        return messageTypes;
    }

    public MessageBusConfig config() {
        return config;
    }

    @Override
    public <T> void send(T payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        sendAsRuntimeType(payload.getClass(), payload);
    }

    private <T> void sendAsRuntimeType(Class<T> type, Object payload) {
        send(type, type.cast(payload), 0, TargetId.ANY);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The capacity check and the append happen under the message lock</li>
     *   <li>The logger is read under the lock and invoked after it is released</li>
     *   <li>A sender released by disposal still appends; the entry is never delivered</li>
     * </ul>
     */
    @Override
    public <T> void send(Class<T> type, T payload, int maxQueued, TargetId target) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (maxQueued < 0) {
            throw new IllegalArgumentException("maxQueued must be non-negative (current: " + maxQueued + ")");
        }
        TypeSlot<T> slot = slot(type);
        if (!type.isInstance(payload)) {
            throw new IllegalArgumentException(
                "payload is not an instance of " + type.getName() + " (actual: " + payload.getClass().getName() + ")"
            );
        }

        MessageLogger<? super T> logger;
        lock.lock();
        try {
            while (running && maxQueued > 0 && slot.queue.size() >= maxQueued) {
                changed.awaitUninterruptibly();
            }
            slot.queue.add(Envelope.of(payload, target));
            logger = slot.logger;
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        notifyLogger(type, logger, payload, true);
    }

    @Override
    public <T> void sendDelayed(Class<T> type, T payload, Duration delay) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        slot(type);
        scheduler.schedule(delay, () -> send(type, payload));
    }

    @Override
    public <T> Optional<T> receive(Class<T> type, boolean waitForMessage, TargetId target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        return doReceive(slot(type), type, waitForMessage, target, null);
    }

    /**
     * Receive performed by a handler loop. Returns empty as soon as the worker is asked to stop.
     */
    <T> Optional<T> receiveFor(HandlerWorker<T> worker) {
        return doReceive(slot(worker.type()), worker.type(), worker.waitsForMessage(), worker.target(), worker);
    }

    private <T> Optional<T> doReceive(
        TypeSlot<T> slot,
        Class<T> type,
        boolean waitForMessage,
        TargetId target,
        HandlerWorker<T> worker
    ) {
        Envelope<T> envelope;
        MessageLogger<? super T> logger;
        lock.lock();
        try {
            while (true) {
                if (!running || (worker != null && worker.isStopRequested())) {
                    return Optional.empty();
                }
                envelope = slot.queue.poll(target);
                if (envelope != null || !waitForMessage) {
                    break;
                }
                changed.awaitUninterruptibly();
            }
            if (envelope == null) {
                return Optional.empty();
            }
            logger = slot.logger;
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        notifyLogger(type, logger, envelope.payload(), false);
        return Optional.of(envelope.payload());
    }

    @Override
    public int size(Class<?> type) {
        TypeSlot<?> slot = slot(type);
        lock.lock();
        try {
            return slot.queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int totalSize() {
        lock.lock();
        try {
            int total = 0;
            for (TypeSlot<?> slot : slots.values()) {
                total += slot.queue.size();
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Ignored once the bus has been disposed.</p>
     */
    @Override
    public <T> void setLogger(Class<T> type, MessageLogger<? super T> logger) {
        TypeSlot<T> slot = slot(type);
        lock.lock();
        try {
            if (!running) {
                log.debug("Logger for {} ignored: bus already disposed", type.getSimpleName());
                return;
            }
            slot.logger = logger;
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Ignored once the bus has been disposed. Thread names follow
     * {@code <prefix>-<type simple name>-<sequence>}.</p>
     */
    @Override
    public <T> void addHandler(Class<T> type, HandlerCallbacks<T> callbacks, TargetId target) {
        if (callbacks == null) {
            throw new IllegalArgumentException("callbacks cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        TypeSlot<T> slot = slot(type);

        // dispose() marks the bus before collecting handler lists, so a worker added here is always joined
        synchronized (slot.handlers) {
            if (disposed.get()) {
                log.debug("Handler for {} ignored: bus already disposed", type.getSimpleName());
                return;
            }
            String threadName = config.threadNamePrefix() + "-" + type.getSimpleName() + "-" + threadSequence.incrementAndGet();
            HandlerWorker<T> worker = new HandlerWorker<>(this, type, callbacks, target, threadName, config.daemonThreads());
            slot.handlers.add(worker);
            worker.start();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Waits up to {@link MessageBusConfig#handlerJoinTimeoutMs()} per handler. A handler that
     * calls this for its own type is not joined.</p>
     */
    @Override
    public void clearHandlers(Class<?> type) {
        TypeSlot<?> slot = slot(type);
        List<HandlerWorker<?>> workers;
        synchronized (slot.handlers) {
            workers = new ArrayList<>(slot.handlers);
            slot.handlers.clear();
        }
        int stopped = stopAndJoin(workers);
        log.debug("Handlers cleared: type={}, stopped={}", type.getSimpleName(), stopped);
    }

    @Override
    public int handlerCount(Class<?> type) {
        TypeSlot<?> slot = slot(type);
        synchronized (slot.handlers) {
            return slot.handlers.size();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Order:</strong></p>
     * <ol>
     *   <li>under the message lock: clear loggers, drain queues, mark not running, wake all waiters</li>
     *   <li>drop pending delayed sends</li>
     *   <li>stop and join every handler</li>
     * </ol>
     */
    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }

        int dropped = 0;
        lock.lock();
        try {
            for (TypeSlot<?> slot : slots.values()) {
                slot.logger = null;
                dropped += slot.queue.clear();
            }
            running = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        scheduler.shutdown();

        List<HandlerWorker<?>> workers = new ArrayList<>();
        for (TypeSlot<?> slot : slots.values()) {
            synchronized (slot.handlers) {
                workers.addAll(slot.handlers);
                slot.handlers.clear();
            }
        }
        int stopped = stopAndJoin(workers);

        log.info("Message bus disposed: types={}, dropped={}, handlersStopped={}", messageTypes, dropped, stopped);
    }

    private int stopAndJoin(List<HandlerWorker<?>> workers) {
        if (workers.isEmpty()) {
            return 0;
        }
        for (HandlerWorker<?> worker : workers) {
            worker.requestStop();
        }
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        int stopped = 0;
        for (HandlerWorker<?> worker : workers) {
            if (worker.join(config.handlerJoinTimeoutMs())) {
                stopped++;
            } else {
                log.warn("Handler thread did not stop within {} ms: {}",
                    config.handlerJoinTimeoutMs(), worker.threadName());
            }
        }
        return stopped;
    }

    private <T> void notifyLogger(Class<T> type, MessageLogger<? super T> logger, T payload, boolean sending) {
        if (logger == null) {
            return;
        }
        try {
            logger.log(payload, sending);
        } catch (RuntimeException e) {
            log.warn("Message logger failed: type={}, sending={}", type.getSimpleName(), sending, e);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> TypeSlot<T> slot(Class<T> type) {
        messageTypes.require(type);
        return (TypeSlot<T>) slots.get(type);
    }

    /**
     * Per-type storage. {@code queue} and {@code logger} are guarded by the message lock,
     * {@code handlers} by its own monitor.
     */
    private static final class TypeSlot<T> {
        private final MessageQueue<T> queue = new MessageQueue<>();
        private final List<HandlerWorker<T>> handlers = new ArrayList<>();
        private MessageLogger<? super T> logger;
    }
}
