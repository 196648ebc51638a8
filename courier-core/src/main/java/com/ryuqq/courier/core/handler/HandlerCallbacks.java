package com.ryuqq.courier.core.handler;

/**
 * Handler 콜백 묶음 (불변 record).
 *
 * <p>Handler 하나는 정확히 하나의 콜백 묶음에 바인딩됩니다. 모든 콜백은 선택 사항(null 허용)이지만,
 * 최소한 {@code onMessage} 또는 {@code onIdle} 중 하나는 있어야 합니다.</p>
 *
 * <p><strong>콜백 항목:</strong></p>
 * <ul>
 *   <li>onMessage: 메시지 수신 시 호출</li>
 *   <li>onException: onMessage/onIdle 실패 시 호출 (없으면 실패는 조용히 무시됨)</li>
 *   <li>onIdle: 큐가 비어 있을 때 호출 (있으면 receive가 대기하지 않음)</li>
 *   <li>onExit: 루프 종료 후 한 번 호출</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * HandlerCallbacks&lt;PrimeFound&gt; callbacks = HandlerCallbacks.onMessage(printer::print)
 *     .withOnIdle(producer::produceNext)
 *     .withOnException(e -&gt; log.warn("printer failed", e));
 * </pre>
 *
 * @param onMessage 메시지 처리 콜백 (null 가능)
 * @param onException 실패 콜백 (null 가능)
 * @param onIdle 유휴 콜백 (null 가능)
 * @param onExit 종료 콜백 (null 가능)
 * @param <T> 메시지 타입
 *
 * @author Courier Team
 * @since 1.0.0
 */
public record HandlerCallbacks<T>(
    MessageHandler<? super T> onMessage,
    ExceptionHandler onException,
    IdleHandler onIdle,
    ExitHandler onExit
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException onMessage와 onIdle이 모두 null인 경우
     */
    public HandlerCallbacks {
        if (onMessage == null && onIdle == null) {
            throw new IllegalArgumentException("onMessage and onIdle cannot both be null");
        }
    }

    /**
     * onMessage만 가진 콜백 묶음 생성.
     *
     * @param onMessage 메시지 처리 콜백
     * @param <T> 메시지 타입
     * @return HandlerCallbacks 인스턴스
     * @throws IllegalArgumentException onMessage가 null인 경우
     */
    public static <T> HandlerCallbacks<T> onMessage(MessageHandler<? super T> onMessage) {
        if (onMessage == null) {
            throw new IllegalArgumentException("onMessage cannot be null");
        }
        return new HandlerCallbacks<>(onMessage, null, null, null);
    }

    /**
     * onIdle만 가진 콜백 묶음 생성 (메시지를 소비하지 않는 백그라운드 루프).
     *
     * @param onIdle 유휴 콜백
     * @param <T> 메시지 타입
     * @return HandlerCallbacks 인스턴스
     * @throws IllegalArgumentException onIdle이 null인 경우
     */
    public static <T> HandlerCallbacks<T> onIdle(IdleHandler onIdle) {
        if (onIdle == null) {
            throw new IllegalArgumentException("onIdle cannot be null");
        }
        return new HandlerCallbacks<>(null, null, onIdle, null);
    }

    /**
     * onException만 변경한 새 인스턴스 생성.
     */
    public HandlerCallbacks<T> withOnException(ExceptionHandler onException) {
        return new HandlerCallbacks<>(onMessage, onException, onIdle, onExit);
    }

    /**
     * onIdle만 변경한 새 인스턴스 생성.
     */
    public HandlerCallbacks<T> withOnIdle(IdleHandler onIdle) {
        return new HandlerCallbacks<>(onMessage, onException, onIdle, onExit);
    }

    /**
     * onExit만 변경한 새 인스턴스 생성.
     */
    public HandlerCallbacks<T> withOnExit(ExitHandler onExit) {
        return new HandlerCallbacks<>(onMessage, onException, onIdle, onExit);
    }

    /**
     * Handler가 receive 시 메시지를 기다려야 하는지 확인.
     *
     * @return onIdle이 없는 경우 true
     */
    public boolean waitsForMessage() {
        return onIdle == null;
    }
}
