package com.ryuqq.courier.adapter.inmemory.bus;

/**
 * InMemoryMessageBus 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threadNamePrefix: Handler 및 지연 송신 스레드 이름 접두사 (기본 "courier")</li>
 *   <li>daemonThreads: Handler 스레드를 daemon으로 생성할지 여부 (기본 true)</li>
 *   <li>handlerJoinTimeoutMs: Handler 종료 대기 시간, 0이면 무제한 (기본 0)</li>
 *   <li>delayedSendThreads: 지연 송신 타이머 스레드 수 (기본 1)</li>
 * </ul>
 *
 * <p>스레드 이름은 디버거/프로파일러 표시용이며 동작에는 영향이 없습니다.
 * Handler 스레드 이름 형식: {@code <prefix>-<메시지 타입 simple name>-<순번>}</p>
 *
 * @author Courier Team
 * @since 1.0.0
 * @param threadNamePrefix 스레드 이름 접두사 (blank 불가)
 * @param daemonThreads daemon 스레드 여부
 * @param handlerJoinTimeoutMs Handler 종료 대기 시간 (밀리초, 0 이상)
 * @param delayedSendThreads 지연 송신 스레드 수 (1 이상)
 */
public record MessageBusConfig(
    String threadNamePrefix,
    boolean daemonThreads,
    long handlerJoinTimeoutMs,
    int delayedSendThreads
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threadNamePrefix="courier", daemonThreads=true,
     * handlerJoinTimeoutMs=0 (무제한), delayedSendThreads=1</p>
     */
    public MessageBusConfig() {
        this("courier", true, 0, 1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MessageBusConfig {
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (handlerJoinTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "handlerJoinTimeoutMs must be non-negative (current: " + handlerJoinTimeoutMs + ")"
            );
        }
        if (delayedSendThreads <= 0) {
            throw new IllegalArgumentException(
                "delayedSendThreads must be positive (current: " + delayedSendThreads + ")"
            );
        }
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public MessageBusConfig withThreadNamePrefix(String threadNamePrefix) {
        return new MessageBusConfig(threadNamePrefix, daemonThreads, handlerJoinTimeoutMs, delayedSendThreads);
    }

    /**
     * daemonThreads만 변경한 새 인스턴스 생성.
     */
    public MessageBusConfig withDaemonThreads(boolean daemonThreads) {
        return new MessageBusConfig(threadNamePrefix, daemonThreads, handlerJoinTimeoutMs, delayedSendThreads);
    }

    /**
     * handlerJoinTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public MessageBusConfig withHandlerJoinTimeoutMs(long handlerJoinTimeoutMs) {
        return new MessageBusConfig(threadNamePrefix, daemonThreads, handlerJoinTimeoutMs, delayedSendThreads);
    }

    /**
     * delayedSendThreads만 변경한 새 인스턴스 생성.
     */
    public MessageBusConfig withDelayedSendThreads(int delayedSendThreads) {
        return new MessageBusConfig(threadNamePrefix, daemonThreads, handlerJoinTimeoutMs, delayedSendThreads);
    }
}
