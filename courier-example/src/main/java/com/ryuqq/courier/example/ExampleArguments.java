package com.ryuqq.courier.example;

/**
 * Command-line arguments of the prime checker (불변 record).
 *
 * @param startNumber first number to check
 * @param secondsToRun how long the checkers run
 * @param workerThreads number of checker handlers
 * @author Courier Team
 * @since 1.0.0
 */
public record ExampleArguments(long startNumber, int secondsToRun, int workerThreads) {

    static final int EXPECTED_ARGUMENT_COUNT = 3;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExampleArguments {
        if (startNumber < 0) {
            throw new IllegalArgumentException("startNumber must be non-negative (current: " + startNumber + ")");
        }
        if (secondsToRun < 0) {
            throw new IllegalArgumentException("secondsToRun must be non-negative (current: " + secondsToRun + ")");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive (current: " + workerThreads + ")");
        }
    }

    /**
     * Parses {@code <start number> <seconds to run> <number of worker threads>}.
     *
     * @param args command-line arguments
     * @return parsed arguments
     * @throws IllegalArgumentException if the count is wrong or a value is not a valid number
     */
    public static ExampleArguments parse(String[] args) {
        if (args == null || args.length != EXPECTED_ARGUMENT_COUNT) {
            throw new IllegalArgumentException("expected " + EXPECTED_ARGUMENT_COUNT + " arguments");
        }
        try {
            return new ExampleArguments(
                Long.parseLong(args[0].trim()),
                Integer.parseInt(args[1].trim()),
                Integer.parseInt(args[2].trim())
            );
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("arguments must be numbers: " + e.getMessage(), e);
        }
    }

    /**
     * Candidates advance in steps of two, so an even start moves to the next odd number.
     *
     * @return first odd candidate at or after startNumber
     */
    public long firstOddCandidate() {
        return startNumber % 2 == 0 ? startNumber + 1 : startNumber;
    }
}
