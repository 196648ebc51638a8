/**
 * Courier 도메인 값 객체.
 *
 * <p>버스 계약 전반에서 사용하는 불변 값 객체를 포함합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.courier.core.model.TargetId} - 메시지 수신 대상 (wildcard 포함)</li>
 *   <li>{@link com.ryuqq.courier.core.model.MessageTypeSet} - 버스가 운반하는 메시지 타입의 닫힌 집합</li>
 * </ul>
 *
 * @author Courier Team
 * @since 1.0.0
 */
package com.ryuqq.courier.core.model;
