package com.ryuqq.courier.testkit.support;

/**
 * Test message carrying text. Used as the second registered type in contract tests.
 *
 * @param text message text
 * @author Courier Team
 * @since 1.0.0
 */
public record Pong(String text) {
}
