package com.ryuqq.courier.core.handler;

/**
 * 실패 콜백 ({@code on_exception}).
 *
 * <p>{@link MessageHandler} 또는 {@link IdleHandler}가 실패하면 Handler 스레드에서 호출됩니다.
 * {@link Exception}이 아닌 Throwable은
 * {@link com.ryuqq.courier.core.exception.UnknownHandlerException}으로 정규화되어 전달됩니다.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExceptionHandler {

    /**
     * 실패 처리.
     *
     * @param exception 발생한 예외 (non-null)
     */
    void onException(Exception exception);
}
