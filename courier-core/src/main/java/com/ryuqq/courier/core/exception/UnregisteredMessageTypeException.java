package com.ryuqq.courier.core.exception;

import com.ryuqq.courier.core.model.MessageTypeSet;

/**
 * 버스에 등록되지 않은 메시지 타입을 사용한 경우 발생.
 *
 * <p>메시지 타입 집합은 버스 생성 시점에 고정되므로 이 예외는 호출 측의 프로그래밍 오류를 의미합니다.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public class UnregisteredMessageTypeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final transient Class<?> messageType;

    /**
     * 생성자.
     *
     * @param messageType 등록되지 않은 타입
     * @param registered 버스에 등록된 타입 집합
     */
    public UnregisteredMessageTypeException(Class<?> messageType, MessageTypeSet registered) {
        super("message type " + messageType.getName() + " is not registered on this bus (registered: " + registered + ")");
        this.messageType = messageType;
    }

    /**
     * 등록되지 않은 타입 조회.
     *
     * @return 메시지 타입
     */
    public Class<?> getMessageType() {
        return messageType;
    }
}
