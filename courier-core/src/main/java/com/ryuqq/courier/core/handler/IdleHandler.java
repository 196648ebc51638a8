package com.ryuqq.courier.core.handler;

/**
 * 유휴 콜백 ({@code on_idle}).
 *
 * <p>Handler의 큐가 비어 있을 때마다 호출됩니다. 이 콜백이 등록되면 Handler는 메시지를
 * 기다리지 않고 polling하므로, 주기적인 producer나 poller로 동작할 수 있습니다.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface IdleHandler {

    /**
     * 유휴 상태 처리.
     *
     * @throws Exception 처리 실패 시
     */
    void onIdle() throws Exception;
}
