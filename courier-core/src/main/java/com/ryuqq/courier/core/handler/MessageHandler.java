package com.ryuqq.courier.core.handler;

/**
 * 메시지 처리 콜백 ({@code on_message}).
 *
 * <p>Handler 스레드에서 메시지 하나당 한 번 호출됩니다.
 * 던져진 예외는 Handler 루프가 잡아 {@link ExceptionHandler}로 전달하며, 스레드는 계속 동작합니다.</p>
 *
 * @param <T> 메시지 타입
 * @author Courier Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageHandler<T> {

    /**
     * 메시지 처리.
     *
     * @param message 수신한 메시지 (non-null)
     * @throws Exception 처리 실패 시
     */
    void onMessage(T message) throws Exception;
}
