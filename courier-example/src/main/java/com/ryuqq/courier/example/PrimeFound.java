package com.ryuqq.courier.example;

/**
 * Tells the printer that {@code prime} is prime.
 *
 * @param prime the prime number
 * @author Courier Team
 * @since 1.0.0
 */
public record PrimeFound(long prime) {
}
