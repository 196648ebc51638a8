package com.ryuqq.courier.example;

import com.ryuqq.courier.adapter.runner.MessageFuture;

import java.util.List;
import java.util.StringJoiner;

/**
 * Runs a large primality test in the background through seven differently wired futures.
 *
 * <ol>
 *   <li>bound at construction with a method reference</li>
 *   <li>bound at construction with a lambda</li>
 *   <li>created empty, bound later with a method reference</li>
 *   <li>created empty, bound later with a lambda</li>
 *   <li>bound, then rebound</li>
 *   <li>never bound</li>
 *   <li>bound, then overridden by direct assignment</li>
 * </ol>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public final class FutureShowcase implements AutoCloseable {

    static final long LARGE_PRIME_CANDIDATE = 1_000_000_000_000_873L;

    private final List<MessageFuture<Boolean>> futures;

    private FutureShowcase(List<MessageFuture<Boolean>> futures) {
        this.futures = futures;
    }

    /**
     * Starts all seven futures.
     *
     * @return the running showcase
     */
    public static FutureShowcase start() {
        MessageFuture<Boolean> boundByReference = new MessageFuture<>(FutureShowcase::checkLargeCandidate);
        MessageFuture<Boolean> boundByLambda = new MessageFuture<>(() -> PrimeNumbers.isPrime(LARGE_PRIME_CANDIDATE));

        MessageFuture<Boolean> boundLaterByReference = new MessageFuture<>();
        boundLaterByReference.bind(FutureShowcase::checkLargeCandidate);

        MessageFuture<Boolean> boundLaterByLambda = new MessageFuture<>();
        boundLaterByLambda.bind(() -> PrimeNumbers.isPrime(LARGE_PRIME_CANDIDATE));

        MessageFuture<Boolean> rebound = new MessageFuture<>(() -> PrimeNumbers.isPrime(LARGE_PRIME_CANDIDATE + 2));
        rebound.bind(FutureShowcase::checkLargeCandidate);

        MessageFuture<Boolean> neverBound = new MessageFuture<>();

        MessageFuture<Boolean> overridden = new MessageFuture<>(FutureShowcase::checkLargeCandidate);
        overridden.set(false);

        return new FutureShowcase(List.of(
            boundByReference, boundByLambda, boundLaterByReference, boundLaterByLambda,
            rebound, neverBound, overridden
        ));
    }

    static boolean checkLargeCandidate() {
        return PrimeNumbers.isPrime(LARGE_PRIME_CANDIDATE);
    }

    /**
     * Waits for every future and formats the results as {@code yes}/{@code no}.
     *
     * @return comma separated results in showcase order
     */
    public String results() {
        StringJoiner joiner = new StringJoiner(", ");
        for (MessageFuture<Boolean> future : futures) {
            joiner.add(Boolean.TRUE.equals(future.getOrDefault(false)) ? "yes" : "no");
        }
        return joiner.toString();
    }

    @Override
    public void close() {
        for (MessageFuture<Boolean> future : futures) {
            future.close();
        }
    }
}
