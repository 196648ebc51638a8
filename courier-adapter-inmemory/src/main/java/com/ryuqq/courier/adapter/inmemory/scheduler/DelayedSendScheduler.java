package com.ryuqq.courier.adapter.inmemory.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reusable pool of pending delayed sends.
 *
 * <p>Each {@link #schedule(Duration, Runnable)} call launches a timer task on a small scheduled
 * executor, so sustained use never costs one thread per call. The pending tasks are tracked in
 * a slot pool that is compacted opportunistically:</p>
 * <ol>
 *   <li>the pool is scanned once for completed slots</li>
 *   <li>the trailing run of completed slots is dropped</li>
 *   <li>an earlier completed slot is reused if one exists, otherwise the pool grows by one</li>
 * </ol>
 *
 * <p>Pool growth is unbounded while many delays are outstanding and self-limiting under steady
 * load. The pool has its own lock, independent of the bus message lock.</p>
 *
 * <p>There is no way to cancel a single pending send. {@link #shutdown()} drops every pending
 * send at once.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public final class DelayedSendScheduler {

    private static final Logger log = LoggerFactory.getLogger(DelayedSendScheduler.class);

    private final ScheduledThreadPoolExecutor executor;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<ScheduledFuture<?>> slots = new ArrayList<>();
    private boolean shutdown;

    /**
     * Creates a scheduler with its own timer threads.
     *
     * @param threads number of timer threads
     * @param threadNamePrefix prefix of the timer thread names
     * @param daemon whether timer threads are daemon threads
     * @throws IllegalArgumentException if threads is not positive or threadNamePrefix is null
     */
    public DelayedSendScheduler(int threads, String threadNamePrefix, boolean daemon) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive (current: " + threads + ")");
        }
        if (threadNamePrefix == null) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null");
        }
        this.executor = new ScheduledThreadPoolExecutor(threads, new TimerThreadFactory(threadNamePrefix, daemon));
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setRemoveOnCancelPolicy(true);
    }

    /**
     * Schedules {@code send} to run after {@code delay}.
     *
     * @param delay time to wait
     * @param send the send to perform
     * @return {@code true} if scheduled, {@code false} if the scheduler was shut down
     * @throws IllegalArgumentException if delay or send is null, or delay is negative
     */
    public boolean schedule(Duration delay, Runnable send) {
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be negative, but was: " + delay);
        }
        if (send == null) {
            throw new IllegalArgumentException("send cannot be null");
        }

        lock.lock();
        try {
            if (shutdown) {
                log.debug("Delayed send dropped: scheduler already shut down");
                return false;
            }

            int freeSlot = reclaimCompletedSlots();
            ScheduledFuture<?> task = executor.schedule(guarded(send), delay.toNanos(), TimeUnit.NANOSECONDS);
            if (freeSlot >= 0) {
                slots.set(freeSlot, task);
            } else {
                slots.add(task);
            }
            log.debug("Delayed send scheduled in {} (slot {}, pool size {})", delay,
                freeSlot >= 0 ? freeSlot : slots.size() - 1, slots.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels every pending send and stops the timer threads. Idempotent.
     *
     * <p>A send that is already running completes.</p>
     */
    public void shutdown() {
        int dropped = 0;
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            for (ScheduledFuture<?> slot : slots) {
                if (slot.cancel(false)) {
                    dropped++;
                }
            }
            slots.clear();
            executor.shutdown();
        } finally {
            lock.unlock();
        }
        log.debug("Delayed send scheduler shut down: {} pending send(s) dropped", dropped);
    }

    /**
     * Returns the current pool size, completed slots included. Used for test assertions.
     *
     * @return slot count
     */
    public int slotCount() {
        lock.lock();
        try {
            return slots.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of sends that have not run yet.
     *
     * @return pending count
     */
    public int pendingCount() {
        lock.lock();
        try {
            int pending = 0;
            for (ScheduledFuture<?> slot : slots) {
                if (!slot.isDone()) {
                    pending++;
                }
            }
            return pending;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether {@link #shutdown()} has been called.
     *
     * @return shut down flag
     */
    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Scans the pool once, drops the trailing run of completed slots and returns the index of
     * a reusable completed slot before that run.
     *
     * @return reusable slot index, or -1 if the pool must grow
     */
    private int reclaimCompletedSlots() {
        int firstCompleted = -1;
        int trailingStart = 0;
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).isDone()) {
                if (firstCompleted < 0) {
                    firstCompleted = i;
                }
            } else {
                trailingStart = i + 1;
            }
        }

        if (trailingStart < slots.size()) {
            slots.subList(trailingStart, slots.size()).clear();
        }
        return firstCompleted >= 0 && firstCompleted < trailingStart ? firstCompleted : -1;
    }

    private static Runnable guarded(Runnable send) {
        return () -> {
            try {
                send.run();
            } catch (RuntimeException e) {
                log.warn("Delayed send failed", e);
            }
        };
    }

    private static final class TimerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final boolean daemon;
        private final AtomicInteger sequence = new AtomicInteger();

        private TimerThreadFactory(String prefix, boolean daemon) {
            this.prefix = prefix;
            this.daemon = daemon;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, prefix + "-delayed-send-" + sequence.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        }
    }
}
