package com.ryuqq.courier.adapter.runner;

import com.ryuqq.courier.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.courier.adapter.inmemory.bus.MessageBusConfig;
import com.ryuqq.courier.core.handler.HandlerCallbacks;
import com.ryuqq.courier.core.model.MessageTypeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 메시지 버스 위에 구성된 단일 값 Future.
 *
 * <p>내부 전용 버스 하나({@code StartSignal}, {@code Result} 두 타입)를 소유합니다.
 * 바인딩된 작업은 {@code StartSignal} Handler 스레드에서 실행되고, 그 결과는 {@code Result}
 * 메시지로 전달되어 저장됩니다.</p>
 *
 * <p><strong>단일 기록 규칙:</strong></p>
 * <ul>
 *   <li>바인딩된 작업의 완료 또는 {@link #set(Object)} 중 먼저 도착한 값만 저장</li>
 *   <li>이후의 기록은 모두 무시 (set은 false 반환)</li>
 *   <li>재바인딩은 결과를 초기화하지 않음</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. bind(operation)
 *    a. 이전 StartSignal Handler 제거 (실행 중인 작업이 끝날 때까지 대기)
 *    b. 소비되지 않은 StartSignal 폐기
 *    c. 새 StartSignal Handler 등록
 *    d. StartSignal 1건 송신
 * 2. StartSignal Handler: operation.call() → Result 송신
 * 3. Result Handler: 결과가 없을 때만 저장 → 대기 중인 get() 깨움
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (MessageFuture&lt;Boolean&gt; future = new MessageFuture&lt;&gt;(() -&gt; PrimeNumbers.isPrime(candidate))) {
 *     Boolean prime = future.get();
 * }
 * </pre>
 *
 * @param <T> 결과 타입
 * @author Courier Team
 * @since 1.0.0
 */
public final class MessageFuture<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MessageFuture.class);
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final InMemoryMessageBus bus;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition completed = lock.newCondition();

    private boolean hasResult;
    private Object value;
    private boolean pending;
    private boolean bound;
    private Exception failure;

    /**
     * 바인딩되지 않은 Future 생성.
     *
     * <p>값은 {@link #set(Object)} 또는 이후의 {@link #bind(Callable)}로만 채워집니다.</p>
     */
    public MessageFuture() {
        this.bus = new InMemoryMessageBus(
            MessageTypeSet.of(StartSignal.class, Result.class),
            new MessageBusConfig().withThreadNamePrefix("future-" + SEQUENCE.incrementAndGet())
        );
        this.bus.addHandler(Result.class, this::onResult);
    }

    /**
     * 작업이 바인딩된 Future 생성. 작업은 즉시 백그라운드에서 시작됩니다.
     *
     * @param operation 값을 계산하는 작업
     * @throws IllegalArgumentException operation이 null인 경우
     */
    public MessageFuture(Callable<? extends T> operation) {
        this();
        bind(operation);
    }

    /**
     * 작업 바인딩.
     *
     * <p>이전에 바인딩된 작업이 실행 중이면 끝날 때까지 기다린 뒤 새 작업을 시작합니다.
     * 이미 결과가 있으면 새 작업의 값은 무시됩니다.</p>
     *
     * @param operation 값을 계산하는 작업
     * @throws IllegalArgumentException operation이 null인 경우
     */
    public void bind(Callable<? extends T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        bus.clearHandlers(StartSignal.class);
        discardStaleSignals();

        lock.lock();
        try {
            pending = true;
            bound = true;
        } finally {
            lock.unlock();
        }

        bus.addHandler(StartSignal.class, HandlerCallbacks.<StartSignal>onMessage(
            signal -> bus.send(new Result(operation.call()))
        ).withOnException(this::onOperationFailed));
        bus.send(new StartSignal());
    }

    /**
     * 값 직접 설정.
     *
     * @param value 저장할 값
     * @return 이 호출로 값이 저장된 경우 true, 이미 결과가 있던 경우 false
     */
    public boolean set(T value) {
        lock.lock();
        try {
            if (hasResult) {
                return false;
            }
            this.value = value;
            this.hasResult = true;
            completed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 결과 조회 (블로킹).
     *
     * <p>실행 중인 작업이 없거나 결과가 생길 때까지 대기합니다.</p>
     *
     * @return 저장된 값, 결과가 없으면 null
     * @throws IllegalStateException 대기 중 인터럽트된 경우
     */
    public T get() {
        return getOrDefault(null);
    }

    /**
     * 결과 조회 (블로킹, 기본값 지정).
     *
     * @param defaultValue 결과가 없을 때 반환할 값
     * @return 저장된 값 또는 defaultValue
     * @throws IllegalStateException 대기 중 인터럽트된 경우
     */
    public T getOrDefault(T defaultValue) {
        lock.lock();
        try {
            while (!hasResult && pending && bus.isRunning()) {
                completed.await();
            }
            return hasResult ? (T) value : defaultValue;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for future result", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 결과 존재 여부 (논블로킹).
     *
     * @return 값이 저장된 경우 true
     */
    public boolean isReady() {
        lock.lock();
        try {
            return hasResult;
        } finally {
            lock.unlock();
        }
    }

    public boolean isBound() {
        lock.lock();
        try {
            return bound;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 마지막으로 실패한 바인딩 작업의 예외.
     *
     * @return 실패 원인, 실패가 없으면 empty
     */
    public Optional<Exception> failure() {
        lock.lock();
        try {
            return Optional.ofNullable(failure);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 내부 버스 종료. 실행 중인 작업이 끝날 때까지 대기하며, 대기 중인 get()은 즉시 반환됩니다.
     */
    @Override
    public void close() {
        bus.dispose();
        lock.lock();
        try {
            pending = false;
            completed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 이전 Handler가 소비하지 못한 StartSignal 제거. 새 작업은 정확히 한 번만 시작됩니다.
     */
    private void discardStaleSignals() {
        int discarded = 0;
        while (bus.receive(StartSignal.class).isPresent()) {
            discarded++;
        }
        if (discarded > 0) {
            log.debug("Discarded {} stale start signal(s) before rebinding", discarded);
        }
    }

    private void onResult(Result result) {
        lock.lock();
        try {
            if (!hasResult) {
                value = result.value();
                hasResult = true;
            }
            pending = false;
            completed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void onOperationFailed(Exception e) {
        log.warn("Bound operation failed", e);
        lock.lock();
        try {
            failure = e;
            pending = false;
            completed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private record StartSignal() {
    }

    private record Result(Object value) {
    }
}
