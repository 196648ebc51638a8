package com.ryuqq.courier.example;

import com.ryuqq.courier.core.handler.HandlerCallbacks;
import com.ryuqq.courier.core.spi.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongConsumer;

/**
 * Wires the prime checker onto a bus carrying {@link PrimeCheckRequest} and {@link PrimeFound}.
 *
 * <p><strong>Handlers:</strong></p>
 * <ul>
 *   <li>N checkers compete for {@link PrimeCheckRequest} and send {@link PrimeFound} for primes</li>
 *   <li>one printer consumes {@link PrimeFound}; when it has nothing to print it produces the next
 *       request through {@link CandidateProducer}</li>
 * </ul>
 *
 * <p>The producer throttles on the checkers' queue, so the bus must be disposed as a whole:
 * disposal releases the producer before the checkers stop.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public final class PrimeWorkload {

    private static final Logger log = LoggerFactory.getLogger(PrimeWorkload.class);

    private final MessageBus bus;
    private final LongConsumer printer;

    /**
     * @param bus bus carrying {@link PrimeCheckRequest} and {@link PrimeFound}
     * @param printer receives every prime found
     * @throws IllegalArgumentException if bus or printer is null
     */
    public PrimeWorkload(MessageBus bus, LongConsumer printer) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (printer == null) {
            throw new IllegalArgumentException("printer cannot be null");
        }
        this.bus = bus;
        this.printer = printer;
    }

    /**
     * Registers the request logger, the checkers and the printer. Work starts immediately.
     *
     * @param firstCandidate first number to check
     * @param checkers number of checker handlers
     * @throws IllegalArgumentException if checkers is not positive
     */
    public void start(long firstCandidate, int checkers) {
        if (checkers <= 0) {
            throw new IllegalArgumentException("checkers must be positive (current: " + checkers + ")");
        }

        bus.setLogger(PrimeCheckRequest.class, (request, sending) ->
            log.trace("{} {}", sending ? "sent" : "received", request));

        for (int i = 0; i < checkers; i++) {
            bus.addHandler(PrimeCheckRequest.class, this::check);
        }
        bus.addHandler(PrimeFound.class, HandlerCallbacks.<PrimeFound>onMessage(found -> printer.accept(found.prime()))
            .withOnIdle(new CandidateProducer(bus, firstCandidate)));

        log.info("Prime workload started: checkers={}, firstCandidate={}", checkers, firstCandidate);
    }

    void check(PrimeCheckRequest request) {
        if (PrimeNumbers.isPrime(request.candidate())) {
            bus.send(new PrimeFound(request.candidate()));
        }
    }
}
