package com.ryuqq.courier.example;

/**
 * Asks a checker whether {@code candidate} is prime.
 *
 * @param candidate number to check
 * @author Courier Team
 * @since 1.0.0
 */
public record PrimeCheckRequest(long candidate) {
}
