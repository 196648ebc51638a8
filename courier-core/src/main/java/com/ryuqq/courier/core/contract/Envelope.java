package com.ryuqq.courier.core.contract;

import com.ryuqq.courier.core.model.TargetId;

/**
 * 큐에 저장되는 메시지 봉투 (Queue Entry).
 *
 * <p>Envelope은 payload와 수신 대상(TargetId)을 묶은 단위입니다.
 * 송신 측은 payload의 소유권을 버스에 넘기고, 버스는 정확히 하나의 수신자에게 전달합니다.
 * payload는 복사되거나 여러 수신자에게 중복 전달되지 않습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>payload:</strong> 메시지 본문 (null 불가)</li>
 *   <li><strong>target:</strong> 수신 대상 (기본값 {@link TargetId#ANY})</li>
 * </ul>
 *
 * @param payload 메시지 본문
 * @param target 수신 대상
 * @param <T> 메시지 타입
 *
 * @author Courier Team
 * @since 1.0.0
 */
public record Envelope<T>(
    T payload,
    TargetId target
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException payload 또는 target이 null인 경우
     */
    public Envelope {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
    }

    /**
     * Wildcard 대상 Envelope 생성.
     *
     * @param payload 메시지 본문
     * @param <T> 메시지 타입
     * @return 생성된 Envelope
     */
    public static <T> Envelope<T> of(T payload) {
        return new Envelope<>(payload, TargetId.ANY);
    }

    /**
     * 대상 지정 Envelope 생성.
     *
     * @param payload 메시지 본문
     * @param target 수신 대상
     * @param <T> 메시지 타입
     * @return 생성된 Envelope
     */
    public static <T> Envelope<T> of(T payload, TargetId target) {
        return new Envelope<>(payload, target);
    }

    /**
     * 주어진 수신 요청이 이 Envelope을 소비할 수 있는지 확인.
     *
     * @param requested 수신 요청 대상
     * @return 매칭되는 경우 true
     */
    public boolean isDeliverableTo(TargetId requested) {
        return requested.accepts(target);
    }
}
