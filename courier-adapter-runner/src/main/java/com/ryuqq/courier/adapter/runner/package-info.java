/**
 * Runner Adapter Layer - 메시지 버스 위에 구성된 실행 도구.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.courier.adapter.runner.MessageFuture} - 백그라운드 작업 결과를 담는 단일 값 Future</li>
 *   <li>{@link com.ryuqq.courier.adapter.runner.ThreadManager} - onIdle을 반복 실행하는 백그라운드 스레드</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (MessageFuture, ThreadManager)
 *   ↓ owns private
 * adapter-inmemory (InMemoryMessageBus)
 *   ↓ implements
 * core (MessageBus SPI, HandlerCallbacks)
 * </pre>
 *
 * @author Courier Team
 * @since 1.0.0
 */
package com.ryuqq.courier.adapter.runner;
