package com.ryuqq.courier.core.model;

/**
 * 메시지 수신 대상 식별자.
 *
 * <p>송신 측은 TargetId를 지정하여 특정 수신자만 메시지를 소비하도록 제한할 수 있습니다.
 * {@link #ANY}(wildcard)는 모든 수신자와 매칭됩니다.</p>
 *
 * <p><strong>매칭 규칙:</strong></p>
 * <ul>
 *   <li>수신 요청이 ANY → 모든 Envelope과 매칭</li>
 *   <li>Envelope의 target이 ANY → 모든 수신 요청과 매칭</li>
 *   <li>그 외 → 값이 동일한 경우에만 매칭</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public final class TargetId {

    /**
     * Wildcard 값.
     */
    public static final long WILDCARD_VALUE = -1L;

    /**
     * Wildcard TargetId (모든 대상과 매칭).
     */
    public static final TargetId ANY = new TargetId(WILDCARD_VALUE);

    private final long value;

    private TargetId(long value) {
        this.value = value;
    }

    /**
     * TargetId 생성.
     *
     * @param value 대상 식별 값 (0 이상)
     * @return TargetId 인스턴스
     * @throws IllegalArgumentException value가 음수인 경우
     */
    public static TargetId of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("TargetId must be non-negative (current: " + value + ")");
        }
        return new TargetId(value);
    }

    /**
     * TargetId 값 조회.
     *
     * @return 대상 식별 값 (wildcard인 경우 {@link #WILDCARD_VALUE})
     */
    public long getValue() {
        return value;
    }

    /**
     * Wildcard 여부 확인.
     *
     * @return ANY인 경우 true
     */
    public boolean isWildcard() {
        return value == WILDCARD_VALUE;
    }

    /**
     * 이 수신 요청이 주어진 Envelope target을 소비할 수 있는지 확인.
     *
     * @param entryTarget Envelope에 지정된 target
     * @return 매칭되는 경우 true
     * @throws IllegalArgumentException entryTarget이 null인 경우
     */
    public boolean accepts(TargetId entryTarget) {
        if (entryTarget == null) {
            throw new IllegalArgumentException("entryTarget cannot be null");
        }
        return isWildcard() || entryTarget.isWildcard() || value == entryTarget.value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TargetId targetId = (TargetId) o;
        return value == targetId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isWildcard() ? "TargetId{ANY}" : "TargetId{" + value + '}';
    }
}
