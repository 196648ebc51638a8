package com.ryuqq.courier.core.model;

import com.ryuqq.courier.core.exception.UnregisteredMessageTypeException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 버스가 운반할 수 있는 메시지 타입의 닫힌 집합.
 *
 * <p>버스 생성 시점에 한 번 결정되며 이후 변경할 수 없습니다.
 * 집합에 없는 타입으로 send/receive를 시도하면
 * {@link UnregisteredMessageTypeException}이 발생합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>최소 1개 이상의 타입</li>
 *   <li>null 타입 불가</li>
 *   <li>중복 타입 불가</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MessageTypeSet types = MessageTypeSet.of(PrimeCheckRequest.class, PrimeFound.class);
 * MessageBus bus = new InMemoryMessageBus(types);
 * </pre>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public final class MessageTypeSet {

    private final Set<Class<?>> types;

    private MessageTypeSet(Set<Class<?>> types) {
        this.types = Collections.unmodifiableSet(types);
    }

    /**
     * MessageTypeSet 생성.
     *
     * @param types 등록할 메시지 타입 (등록 순서 유지)
     * @return MessageTypeSet 인스턴스
     * @throws IllegalArgumentException 타입이 비어 있거나, null 또는 중복이 포함된 경우
     */
    public static MessageTypeSet of(Class<?>... types) {
        if (types == null || types.length == 0) {
            throw new IllegalArgumentException("types cannot be null or empty");
        }
        Set<Class<?>> registered = new LinkedHashSet<>();
        for (Class<?> type : types) {
            if (type == null) {
                throw new IllegalArgumentException("message type cannot be null (types: " + Arrays.toString(types) + ")");
            }
            if (!registered.add(type)) {
                throw new IllegalArgumentException("duplicate message type: " + type.getName());
            }
        }
        return new MessageTypeSet(registered);
    }

    /**
     * 타입 등록 여부 확인.
     *
     * @param type 메시지 타입
     * @return 등록된 경우 true
     */
    public boolean contains(Class<?> type) {
        return type != null && types.contains(type);
    }

    /**
     * 등록된 타입인지 검증.
     *
     * @param type 메시지 타입
     * @throws IllegalArgumentException type이 null인 경우
     * @throws UnregisteredMessageTypeException 등록되지 않은 타입인 경우
     */
    public void require(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (!types.contains(type)) {
            throw new UnregisteredMessageTypeException(type, this);
        }
    }

    /**
     * 등록된 타입 목록 (등록 순서, 읽기 전용).
     *
     * @return 메시지 타입 집합
     */
    public Set<Class<?>> types() {
        return types;
    }

    /**
     * 등록된 타입 수.
     *
     * @return 타입 수
     */
    public int size() {
        return types.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return types.equals(((MessageTypeSet) o).types);
    }

    @Override
    public int hashCode() {
        return types.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("MessageTypeSet{");
        boolean first = true;
        for (Class<?> type : types) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(type.getSimpleName());
            first = false;
        }
        return sb.append('}').toString();
    }
}
