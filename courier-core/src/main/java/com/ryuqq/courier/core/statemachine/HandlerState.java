package com.ryuqq.courier.core.statemachine;

/**
 * Handler 스레드의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>ACTIVE → DISPATCHING (메시지 수신 또는 유휴 콜백 호출)</li>
 *   <li>DISPATCHING → ACTIVE (콜백 종료, 실패 포함)</li>
 *   <li>ACTIVE → STOPPED (버스 dispose 또는 Handler 제거)</li>
 *   <li><strong>STOPPED에서는 어떤 전이도 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * ACTIVE ◄──────────┐
 *    │              │ (콜백 종료)
 *    ├─► DISPATCHING┘
 *    │
 *    └─► STOPPED (dispose / clearHandlers)
 * </pre>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public enum HandlerState {

    /**
     * 수신 대기 또는 polling 중.
     */
    ACTIVE,

    /**
     * 콜백 실행 중.
     */
    DISPATCHING,

    /**
     * 종료됨.
     */
    STOPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return STOPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == STOPPED;
    }
}
