/**
 * Handler 콜백 계약.
 *
 * <p>Handler는 메시지 타입 하나에 바인딩된 콜백 묶음과 전용 스레드입니다.
 * 이 패키지는 콜백 인터페이스와 그 묶음만 정의하며, 스레드 구현은 어댑터가 제공합니다.</p>
 *
 * <h2>콜백</h2>
 * <ul>
 *   <li>{@link com.ryuqq.courier.core.handler.MessageHandler} - on_message</li>
 *   <li>{@link com.ryuqq.courier.core.handler.ExceptionHandler} - on_exception</li>
 *   <li>{@link com.ryuqq.courier.core.handler.IdleHandler} - on_idle</li>
 *   <li>{@link com.ryuqq.courier.core.handler.ExitHandler} - on_exit</li>
 * </ul>
 *
 * <h2>실패 처리 정책</h2>
 * <p>콜백 실패는 Handler 루프 경계에서 잡혀 on_exception으로 전달됩니다.
 * on_exception이 없으면 실패는 조용히 무시되며, 어떤 경우에도 Handler 스레드는 종료되지 않습니다.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
package com.ryuqq.courier.core.handler;
