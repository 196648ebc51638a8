package com.ryuqq.courier.example;

import com.ryuqq.courier.core.handler.IdleHandler;
import com.ryuqq.courier.core.spi.MessageBus;

/**
 * Idle callback that feeds the checkers with the next odd candidate.
 *
 * <p>Each call sends one {@link PrimeCheckRequest} throttled at {@link #CHECKER_QUEUE_LIMIT}
 * queued requests, so the producer waits while the checkers are behind. Runs on a single
 * handler thread.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public final class CandidateProducer implements IdleHandler {

    public static final int CHECKER_QUEUE_LIMIT = 100;

    private final MessageBus bus;
    private long nextCandidate;

    public CandidateProducer(MessageBus bus, long firstCandidate) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        this.bus = bus;
        this.nextCandidate = firstCandidate;
    }

    @Override
    public void onIdle() {
        bus.send(PrimeCheckRequest.class, new PrimeCheckRequest(nextCandidate), CHECKER_QUEUE_LIMIT);
        nextCandidate += 2;
    }

    long nextCandidate() {
        return nextCandidate;
    }
}
