package com.ryuqq.courier.adapter.runner;

import com.ryuqq.courier.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.courier.adapter.inmemory.bus.MessageBusConfig;
import com.ryuqq.courier.core.handler.ExceptionHandler;
import com.ryuqq.courier.core.handler.HandlerCallbacks;
import com.ryuqq.courier.core.handler.IdleHandler;
import com.ryuqq.courier.core.model.MessageTypeSet;

/**
 * 백그라운드 루프 스레드 하나를 관리하는 컴포넌트.
 *
 * <p>메시지를 소비하지 않는 Handler 하나로 구성됩니다. 내부 전용 버스는 송신되지 않는
 * {@code Filler} 타입만 운반하므로, 스레드는 {@code onIdle}을 종료될 때까지 반복 호출합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>생성 즉시 스레드 시작</li>
 *   <li>onIdle 실패를 onException으로 전달 (없으면 무시) 후 계속 진행</li>
 *   <li>close() 시 스레드 종료까지 대기</li>
 * </ul>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public final class ThreadManager implements AutoCloseable {

    private static final String DEFAULT_THREAD_NAME_PREFIX = "thread-manager";

    private final InMemoryMessageBus bus;

    /**
     * 생성자.
     *
     * @param onIdle 반복 실행할 작업
     * @throws IllegalArgumentException onIdle이 null인 경우
     */
    public ThreadManager(IdleHandler onIdle) {
        this(onIdle, null);
    }

    /**
     * 생성자.
     *
     * @param onIdle 반복 실행할 작업
     * @param onException onIdle 실패 콜백 (null 가능)
     * @throws IllegalArgumentException onIdle이 null인 경우
     */
    public ThreadManager(IdleHandler onIdle, ExceptionHandler onException) {
        this(onIdle, onException, DEFAULT_THREAD_NAME_PREFIX);
    }

    /**
     * 생성자.
     *
     * @param onIdle 반복 실행할 작업
     * @param onException onIdle 실패 콜백 (null 가능)
     * @param threadNamePrefix 스레드 이름 접두사
     * @throws IllegalArgumentException onIdle이 null이거나 threadNamePrefix가 비어 있는 경우
     */
    public ThreadManager(IdleHandler onIdle, ExceptionHandler onException, String threadNamePrefix) {
        if (onIdle == null) {
            throw new IllegalArgumentException("onIdle cannot be null");
        }
        this.bus = new InMemoryMessageBus(
            MessageTypeSet.of(Filler.class),
            new MessageBusConfig().withThreadNamePrefix(threadNamePrefix)
        );
        this.bus.addHandler(Filler.class, HandlerCallbacks.<Filler>onIdle(onIdle).withOnException(onException));
    }

    /**
     * 스레드 실행 여부.
     *
     * @return close() 호출 전이면 true
     */
    public boolean isRunning() {
        return bus.isRunning();
    }

    /**
     * 스레드 종료 및 대기. 진행 중인 onIdle 호출은 끝까지 실행됩니다.
     */
    @Override
    public void close() {
        bus.dispose();
    }

    private record Filler() {
    }
}
