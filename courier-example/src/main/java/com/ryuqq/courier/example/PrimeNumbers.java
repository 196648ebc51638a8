package com.ryuqq.courier.example;

/**
 * Trial-division primality test.
 *
 * @author Courier Team
 * @since 1.0.0
 */
public final class PrimeNumbers {

    private PrimeNumbers() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * @param candidate number to test
     * @return {@code true} if candidate is prime
     */
    public static boolean isPrime(long candidate) {
        if (candidate < 2) {
            return false;
        }
        if (candidate % 2 == 0) {
            return candidate == 2;
        }
        long stop = (long) Math.sqrt((double) candidate);
        for (long divisor = 3; divisor <= stop; divisor += 2) {
            if (candidate % divisor == 0) {
                return false;
            }
        }
        return true;
    }
}
