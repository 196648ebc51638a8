package com.ryuqq.courier.core.handler;

/**
 * 종료 콜백 ({@code on_exit}).
 *
 * <p>Handler 루프가 끝난 뒤 Handler 자신의 스레드에서 정확히 한 번 호출됩니다.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExitHandler {

    /**
     * 종료 처리.
     */
    void onExit();
}
