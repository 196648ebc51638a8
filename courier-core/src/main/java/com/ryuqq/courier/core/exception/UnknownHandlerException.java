package com.ryuqq.courier.core.exception;

/**
 * Handler 콜백에서 {@link Exception}이 아닌 Throwable이 발생한 경우의 정규화된 예외.
 *
 * <p>{@code on_exception} 콜백이 항상 {@link Exception} 형태를 받도록
 * 원본 Throwable을 cause로 감쌉니다.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public class UnknownHandlerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param cause 원본 Throwable
     */
    public UnknownHandlerException(Throwable cause) {
        super("unknown exception", cause);
    }
}
