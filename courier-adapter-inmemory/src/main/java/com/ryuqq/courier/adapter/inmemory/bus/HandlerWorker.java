package com.ryuqq.courier.adapter.inmemory.bus;

import com.ryuqq.courier.core.exception.UnknownHandlerException;
import com.ryuqq.courier.core.handler.ExceptionHandler;
import com.ryuqq.courier.core.handler.ExitHandler;
import com.ryuqq.courier.core.handler.HandlerCallbacks;
import com.ryuqq.courier.core.model.TargetId;
import com.ryuqq.courier.core.statemachine.HandlerState;
import com.ryuqq.courier.core.statemachine.HandlerStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Background consumer bound to one message type of an {@link InMemoryMessageBus}.
 *
 * <p>Each worker owns exactly one thread, started on registration. The thread loops:</p>
 * <ol>
 *   <li>receive from the bus, waiting only when no {@code onIdle} callback exists</li>
 *   <li>stop if the bus is no longer running, or if a stop was requested and nothing arrived</li>
 *   <li>dispatch to {@code onMessage}, or to {@code onIdle} when nothing arrived</li>
 * </ol>
 *
 * <p>A failure raised by a callback never ends the loop. It is handed to {@code onException} when
 * present and dropped otherwise; a throwable that is not an {@link Exception} is wrapped in
 * {@link UnknownHandlerException} first. {@code onExit} runs once on the worker thread after the
 * loop.</p>
 *
 * <p>The worker keeps a non-owning reference to its bus. The bus stops and joins every worker
 * before disposal completes.</p>
 *
 * @param <T> message type
 * @author Courier Team
 * @since 1.0.0
 */
final class HandlerWorker<T> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HandlerWorker.class);

    private final InMemoryMessageBus bus;
    private final Class<T> type;
    private final HandlerCallbacks<T> callbacks;
    private final TargetId target;
    private final Thread thread;

    private volatile boolean stopRequested;
    private volatile HandlerState state = HandlerState.ACTIVE;

    HandlerWorker(
        InMemoryMessageBus bus,
        Class<T> type,
        HandlerCallbacks<T> callbacks,
        TargetId target,
        String threadName,
        boolean daemon
    ) {
        this.bus = bus;
        this.type = type;
        this.callbacks = callbacks;
        this.target = target;
        this.thread = new Thread(this, threadName);
        this.thread.setDaemon(daemon);
    }

    void start() {
        thread.start();
    }

    @Override
    public void run() {
        log.debug("Handler started: thread={}, type={}, target={}", thread.getName(), type.getSimpleName(), target);
        try {
            while (true) {
                Optional<T> message = bus.receiveFor(this);
                if (!bus.isRunning()) {
                    break;
                }
                if (message.isEmpty() && stopRequested) {
                    break;
                }
                dispatch(message);
            }
        } finally {
            state = HandlerStateTransition.transition(state, HandlerState.STOPPED);
            runExit();
            log.debug("Handler stopped: thread={}", thread.getName());
        }
    }

    private void dispatch(Optional<T> message) {
        state = HandlerStateTransition.transition(state, HandlerState.DISPATCHING);
        try {
            if (message.isPresent()) {
                if (callbacks.onMessage() != null) {
                    callbacks.onMessage().onMessage(message.get());
                }
            } else if (callbacks.onIdle() != null) {
                callbacks.onIdle().onIdle();
            }
        } catch (Exception e) {
            report(e);
        } catch (Throwable t) {
            report(new UnknownHandlerException(t));
        } finally {
            state = HandlerStateTransition.transition(state, HandlerState.ACTIVE);
        }
    }

    private void report(Exception failure) {
        ExceptionHandler onException = callbacks.onException();
        if (onException == null) {
            log.debug("Handler failure ignored (no onException): thread={}", thread.getName(), failure);
            return;
        }
        try {
            onException.onException(failure);
        } catch (RuntimeException e) {
            log.warn("onException callback failed: thread={}", thread.getName(), e);
        }
    }

    private void runExit() {
        ExitHandler onExit = callbacks.onExit();
        if (onExit == null) {
            return;
        }
        try {
            onExit.onExit();
        } catch (RuntimeException e) {
            log.warn("onExit callback failed: thread={}", thread.getName(), e);
        }
    }

    /**
     * Asks the loop to finish after the current iteration. The caller must wake blocked
     * receivers afterwards.
     */
    void requestStop() {
        stopRequested = true;
    }

    boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * Waits for the worker thread to finish.
     *
     * <p>Returns immediately when called from the worker's own thread.</p>
     *
     * @param timeoutMs maximum wait in milliseconds, 0 to wait without limit
     * @return {@code true} if the thread has finished (or the caller is the worker itself)
     */
    boolean join(long timeoutMs) {
        if (Thread.currentThread() == thread) {
            return true;
        }
        try {
            thread.join(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while joining handler thread: {}", thread.getName());
            return false;
        }
        return !thread.isAlive();
    }

    Class<T> type() {
        return type;
    }

    TargetId target() {
        return target;
    }

    boolean waitsForMessage() {
        return callbacks.waitsForMessage();
    }

    String threadName() {
        return thread.getName();
    }

    /**
     * Current lifecycle state of this worker.
     *
     * @return handler state
     */
    HandlerState state() {
        return state;
    }
}
