package com.ryuqq.courier.testkit.contract;

import com.ryuqq.courier.core.exception.UnregisteredMessageTypeException;
import com.ryuqq.courier.core.handler.HandlerCallbacks;
import com.ryuqq.courier.core.model.MessageTypeSet;
import com.ryuqq.courier.core.model.TargetId;
import com.ryuqq.courier.core.spi.MessageBus;
import com.ryuqq.courier.testkit.support.Ping;
import com.ryuqq.courier.testkit.support.Pong;
import com.ryuqq.courier.testkit.support.RecordingMessageLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract contract test suite for {@link MessageBus} implementations.
 *
 * <p>Every adapter extends this class and supplies a fresh bus through
 * {@link #createBus(MessageTypeSet)}. The bus under test carries {@link Ping} and {@link Pong}.</p>
 *
 * <p><strong>Contract Scenarios:</strong></p>
 * <ul>
 *   <li>FIFO order within a type</li>
 *   <li>Backpressure: the (N+1)-th send blocks until a receive frees capacity</li>
 *   <li>At-most-once delivery under concurrent receivers</li>
 *   <li>Disposal releases blocked senders and receivers</li>
 *   <li>Targeted delivery</li>
 *   <li>Competing handlers deliver N messages exactly once in aggregate</li>
 *   <li>Delayed send is invisible at first, then arrives</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyBusContractTest extends AbstractMessageBusContractTest {
 *     {@literal @}Override
 *     protected MessageBus createBus(MessageTypeSet types) {
 *         return new MyBus(types);
 *     }
 * }
 * </pre>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public abstract class AbstractMessageBusContractTest {

    /**
     * Upper bound for any wait on another thread in this suite.
     */
    protected static final long TIMEOUT_MS = 5_000L;

    protected MessageBus bus;

    /**
     * Creates the bus under test.
     *
     * @param types message types the bus must carry
     * @return a running bus
     */
    protected abstract MessageBus createBus(MessageTypeSet types);

    @BeforeEach
    void setUpBus() {
        bus = createBus(MessageTypeSet.of(Ping.class, Pong.class));
    }

    @AfterEach
    void tearDownBus() {
        if (bus != null) {
            bus.dispose();
        }
    }

    // ============================================================
    // Send / Receive
    // ============================================================

    @Test
    void testFifo_SingleType_ReceivesInSendOrder() {
        // Given
        for (int i = 1; i <= 5; i++) {
            bus.send(new Ping(i));
        }

        // When
        List<Integer> received = new ArrayList<>();
        Optional<Ping> ping;
        while ((ping = bus.receive(Ping.class)).isPresent()) {
            received.add(ping.get().sequence());
        }

        // Then
        assertEquals(List.of(1, 2, 3, 4, 5), received, "Messages must be received in send order");
        assertEquals(0, bus.size(Ping.class));
    }

    @Test
    void testReceive_EmptyQueueWithoutWait_ReturnsEmpty() {
        assertTrue(bus.receive(Ping.class).isEmpty(), "Polling an empty queue must return empty");
    }

    @Test
    void testTypes_AreIndependentQueues() {
        // Given
        bus.send(new Ping(1));
        bus.send(new Pong("a"));
        bus.send(new Pong("b"));

        // Then
        assertEquals(1, bus.size(Ping.class));
        assertEquals(2, bus.size(Pong.class));
        assertEquals(3, bus.totalSize());
        assertEquals(new Pong("a"), bus.receive(Pong.class).orElseThrow());
        assertEquals(new Ping(1), bus.receive(Ping.class).orElseThrow());
    }

    @Test
    void testReceive_WaitingReceiver_WakesOnSend() throws InterruptedException {
        // Given
        AtomicReference<Optional<Ping>> result = new AtomicReference<>();
        Thread receiver = new Thread(() -> result.set(bus.receive(Ping.class, true)));
        receiver.start();
        sleep(100);
        assertTrue(receiver.isAlive(), "Receiver must block while the queue is empty");

        // When
        bus.send(new Ping(7));
        receiver.join(TIMEOUT_MS);

        // Then
        assertFalse(receiver.isAlive());
        assertEquals(Optional.of(new Ping(7)), result.get());
    }

    @Test
    void testUnregisteredType_IsRejected() {
        assertThrows(UnregisteredMessageTypeException.class, () -> bus.send("not registered"));
        assertThrows(UnregisteredMessageTypeException.class, () -> bus.receive(String.class));
    }

    // ============================================================
    // Backpressure
    // ============================================================

    @Test
    void testBackpressure_SendBeyondCapacity_BlocksUntilReceive() throws InterruptedException {
        // Given: queue filled to capacity
        int capacity = 3;
        for (int i = 1; i <= capacity; i++) {
            bus.send(Ping.class, new Ping(i), capacity);
        }

        // When: one more send
        Thread sender = new Thread(() -> bus.send(Ping.class, new Ping(capacity + 1), capacity));
        sender.start();
        sleep(200);

        // Then: blocked until a receive frees a slot
        assertTrue(sender.isAlive(), "Send beyond capacity must block");
        assertEquals(capacity, bus.size(Ping.class));

        assertEquals(new Ping(1), bus.receive(Ping.class).orElseThrow());
        sender.join(TIMEOUT_MS);

        assertFalse(sender.isAlive(), "Send must complete once capacity is available");
        assertEquals(capacity, bus.size(Ping.class));
    }

    @Test
    void testBackpressure_ZeroCapacity_NeverBlocks() {
        for (int i = 0; i < 1_000; i++) {
            bus.send(Ping.class, new Ping(i), 0);
        }
        assertEquals(1_000, bus.size(Ping.class));
    }

    // ============================================================
    // At-most-once
    // ============================================================

    @Test
    void testAtMostOnce_ConcurrentReceivers_EachPayloadDeliveredOnce() throws InterruptedException {
        // Given
        int messageCount = 2_000;
        for (int i = 0; i < messageCount; i++) {
            bus.send(new Ping(i));
        }

        // When
        Queue<Integer> received = new ConcurrentLinkedQueue<>();
        List<Thread> receivers = new ArrayList<>();
        for (int r = 0; r < 4; r++) {
            Thread receiver = new Thread(() -> {
                Optional<Ping> ping;
                while ((ping = bus.receive(Ping.class)).isPresent()) {
                    received.add(ping.get().sequence());
                }
            });
            receivers.add(receiver);
            receiver.start();
        }
        for (Thread receiver : receivers) {
            receiver.join(TIMEOUT_MS);
        }

        // Then
        assertEquals(messageCount, received.size(), "Every message must be received exactly once");
        assertEquals(messageCount, new HashSet<>(received).size(), "No message may be received twice");
    }

    // ============================================================
    // Disposal
    // ============================================================

    @Test
    void testDispose_ReleasesBlockedReceiver() throws InterruptedException {
        // Given
        AtomicReference<Optional<Ping>> result = new AtomicReference<>();
        Thread receiver = new Thread(() -> result.set(bus.receive(Ping.class, true)));
        receiver.start();
        sleep(100);

        // When
        bus.dispose();
        receiver.join(TIMEOUT_MS);

        // Then
        assertFalse(receiver.isAlive(), "Disposal must release a blocked receiver");
        assertEquals(Optional.empty(), result.get());
    }

    @Test
    void testDispose_ReleasesBlockedSender() throws InterruptedException {
        // Given
        bus.send(Ping.class, new Ping(1), 1);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread sender = new Thread(() -> {
            try {
                bus.send(Ping.class, new Ping(2), 1);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        sender.start();
        sleep(100);
        assertTrue(sender.isAlive());

        // When
        bus.dispose();
        sender.join(TIMEOUT_MS);

        // Then
        assertFalse(sender.isAlive(), "Disposal must release a blocked sender");
        assertNull(failure.get(), "A released sender must not fail");
    }

    @Test
    void testDispose_IsIdempotentAndStopsDelivery() {
        // Given
        bus.send(new Ping(1));

        // When
        bus.dispose();
        bus.dispose();

        // Then
        assertFalse(bus.isRunning());
        assertEquals(0, bus.size(Ping.class), "Disposal drains every queue");
        assertTrue(bus.receive(Ping.class).isEmpty());
    }

    @Test
    void testSendAfterDispose_IsAcceptedButNeverDelivered() {
        // Given
        bus.dispose();

        // When
        assertDoesNotThrow(() -> bus.send(new Ping(1)));

        // Then
        assertTrue(bus.receive(Ping.class, true).isEmpty(), "Nothing is delivered after disposal");
    }

    // ============================================================
    // Targeting
    // ============================================================

    @Test
    void testTargetedDelivery_SkipsEntriesForOtherTargets() {
        // Given
        bus.send(Ping.class, new Ping(1), 0, TargetId.of(1));
        bus.send(Ping.class, new Ping(2), 0, TargetId.of(2));

        // When / Then
        assertEquals(new Ping(2), bus.receive(Ping.class, false, TargetId.of(2)).orElseThrow(),
            "Target 2 must skip the older target 1 entry");
        assertEquals(new Ping(1), bus.receive(Ping.class).orElseThrow(),
            "An unfiltered receive returns the remaining target 1 entry");
        assertTrue(bus.receive(Ping.class).isEmpty());
    }

    @Test
    void testTargetedDelivery_WildcardEntryMatchesAnyTarget() {
        // Given
        bus.send(new Ping(1));

        // When / Then
        assertTrue(bus.receive(Ping.class, false, TargetId.of(9)).isPresent());
    }

    @Test
    void testTargetedDelivery_NoMatch_ReturnsEmptyAndKeepsEntry() {
        // Given
        bus.send(Ping.class, new Ping(1), 0, TargetId.of(1));

        // When / Then
        assertTrue(bus.receive(Ping.class, false, TargetId.of(2)).isEmpty());
        assertEquals(1, bus.size(Ping.class));
    }

    // ============================================================
    // Handlers
    // ============================================================

    @Test
    void testCompetingHandlers_DeliverEachMessageExactlyOnce() throws InterruptedException {
        // Given
        int messageCount = 300;
        Queue<Integer> handled = new ConcurrentLinkedQueue<>();
        CountDownLatch latch = new CountDownLatch(messageCount);
        for (int h = 0; h < 3; h++) {
            bus.addHandler(Ping.class, ping -> {
                handled.add(ping.sequence());
                latch.countDown();
            });
        }
        assertEquals(3, bus.handlerCount(Ping.class));

        // When
        for (int i = 0; i < messageCount; i++) {
            bus.send(new Ping(i));
        }

        // Then
        assertTrue(latch.await(TIMEOUT_MS, TimeUnit.MILLISECONDS), "All messages must be handled");
        sleep(100);
        assertEquals(messageCount, handled.size(), "No message may be handled twice");
        assertEquals(messageCount, new HashSet<>(handled).size());
    }

    @Test
    void testHandler_FailureGoesToOnExceptionAndLoopContinues() throws InterruptedException {
        // Given
        Queue<Exception> failures = new ConcurrentLinkedQueue<>();
        CountDownLatch handled = new CountDownLatch(2);
        bus.addHandler(Ping.class, HandlerCallbacks.<Ping>onMessage(ping -> {
            handled.countDown();
            if (ping.sequence() == 1) {
                throw new IllegalStateException("boom");
            }
        }).withOnException(failures::add));

        // When
        bus.send(new Ping(1));
        bus.send(new Ping(2));

        // Then
        assertTrue(handled.await(TIMEOUT_MS, TimeUnit.MILLISECONDS), "Handler must keep running after a failure");
        assertEquals(1, failures.size());
        assertEquals("boom", failures.peek().getMessage());
    }

    @Test
    void testHandler_OnExitRunsOnceWhenBusIsDisposed() throws InterruptedException {
        // Given
        CountDownLatch exited = new CountDownLatch(1);
        bus.addHandler(Ping.class, HandlerCallbacks.<Ping>onMessage(ping -> { })
            .withOnExit(exited::countDown));

        // When
        bus.dispose();

        // Then
        assertTrue(exited.await(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertEquals(0, bus.handlerCount(Ping.class));
    }

    @Test
    void testClearHandlers_StopsOnlyThatType() throws InterruptedException {
        // Given
        CountDownLatch pingExited = new CountDownLatch(2);
        bus.addHandler(Ping.class, HandlerCallbacks.<Ping>onMessage(ping -> { }).withOnExit(pingExited::countDown));
        bus.addHandler(Ping.class, HandlerCallbacks.<Ping>onMessage(ping -> { }).withOnExit(pingExited::countDown));
        bus.addHandler(Pong.class, pong -> { });

        // When
        bus.clearHandlers(Ping.class);

        // Then: clearHandlers joins, so onExit has already run
        assertEquals(0, pingExited.getCount());
        assertEquals(0, bus.handlerCount(Ping.class));
        assertEquals(1, bus.handlerCount(Pong.class));
        assertTrue(bus.isRunning());
    }

    // ============================================================
    // Delayed send and loggers
    // ============================================================

    @Test
    void testDelayedSend_NotImmediatelyAvailable_ArrivesAfterDelay() {
        // When
        bus.sendDelayed(Ping.class, new Ping(1), Duration.ofMillis(200));

        // Then
        assertTrue(bus.receive(Ping.class).isEmpty(), "Delayed message must not be available immediately");
        Optional<Ping> arrived = awaitMessage(Ping.class, TIMEOUT_MS);
        assertEquals(Optional.of(new Ping(1)), arrived);
    }

    @Test
    void testDelayedSend_DroppedOnDispose() {
        // Given
        bus.sendDelayed(Ping.class, new Ping(1), Duration.ofMillis(300));

        // When
        bus.dispose();
        sleep(500);

        // Then
        assertEquals(0, bus.size(Ping.class), "Pending delayed sends must be dropped on disposal");
    }

    @Test
    void testLogger_ObservesSendAndReceive() {
        // Given
        RecordingMessageLogger<Ping> logger = new RecordingMessageLogger<>();
        bus.setLogger(Ping.class, logger);

        // When
        bus.send(new Ping(1));
        bus.receive(Ping.class);
        bus.receive(Ping.class);

        // Then
        assertEquals(List.of(
            new RecordingMessageLogger.Entry<>(new Ping(1), true),
            new RecordingMessageLogger.Entry<>(new Ping(1), false)
        ), logger.entries(), "Logger sees one send and one non-empty receive");
    }

    @Test
    void testLogger_RemovedWithNull() {
        // Given
        RecordingMessageLogger<Ping> logger = new RecordingMessageLogger<>();
        bus.setLogger(Ping.class, logger);
        bus.setLogger(Ping.class, null);

        // When
        bus.send(new Ping(1));

        // Then
        assertTrue(logger.entries().isEmpty());
    }

    // ============================================================
    // Helpers
    // ============================================================

    /**
     * Polls the bus until a message of {@code type} arrives or the timeout elapses.
     *
     * @param type message type
     * @param timeoutMs maximum wait in milliseconds
     * @param <T> message type
     * @return the message, or empty on timeout
     */
    protected <T> Optional<T> awaitMessage(Class<T> type, long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            Optional<T> message = bus.receive(type);
            if (message.isPresent()) {
                return message;
            }
            sleep(10);
        }
        return Optional.empty();
    }

    /**
     * Sleeps without a checked exception. Restores the interrupt flag if interrupted.
     *
     * @param millis time to sleep
     */
    protected static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while sleeping", e);
        }
    }
}
