package com.ryuqq.courier.testkit.support;

/**
 * Test message carrying a sequence number.
 *
 * @param sequence sequence number
 * @author Courier Team
 * @since 1.0.0
 */
public record Ping(int sequence) {
}
