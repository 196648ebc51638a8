package com.ryuqq.courier.example;

import com.ryuqq.courier.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.courier.adapter.inmemory.bus.MessageBusConfig;
import com.ryuqq.courier.core.model.MessageTypeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Duration;

/**
 * Command-line entry point of the prime checker.
 *
 * <p>Usage: {@code prime-checker <start number> <seconds to run> <number of worker threads>}</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
public final class PrimeCheckerApplication {

    private static final Logger log = LoggerFactory.getLogger(PrimeCheckerApplication.class);

    private PrimeCheckerApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs the workload and reports to {@code out}.
     *
     * @param args command-line arguments
     * @param out destination of the program output
     * @return process exit status
     */
    static int run(String[] args, PrintStream out) {
        ExampleArguments arguments;
        try {
            arguments = ExampleArguments.parse(args);
        } catch (IllegalArgumentException e) {
            log.debug("Invalid arguments: {}", e.getMessage());
            printUsage(out);
            return 1;
        }

        try (FutureShowcase futures = FutureShowcase.start()) {
            runWorkload(arguments, out);

            out.println();
            out.println("In addition, we calculated other prime numbers in parallel. Results were: " + futures.results());
        }
        return 0;
    }

    private static void runWorkload(ExampleArguments arguments, PrintStream out) {
        MessageTypeSet types = MessageTypeSet.of(PrimeCheckRequest.class, PrimeFound.class);
        try (InMemoryMessageBus bus = new InMemoryMessageBus(types, new MessageBusConfig().withThreadNamePrefix("prime"))) {
            long firstCandidate = arguments.firstOddCandidate();
            out.println("Calculating prime numbers in " + arguments.workerThreads() + " thread(s) for "
                + arguments.secondsToRun() + " seconds, starting from " + firstCandidate + "...");

            new PrimeWorkload(bus, prime -> out.print(prime + " ")).start(firstCandidate, arguments.workerThreads());
            sleep(Duration.ofSeconds(arguments.secondsToRun()));
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: prime-checker <start number> <seconds to run> <number of worker threads>");
        out.println();
        out.println("This demo calculates prime numbers using worker threads.");
        out.println("To calculate prime numbers starting from 2 for 2 seconds in 2 threads: prime-checker 2 2 2");
        out.println("To calculate prime numbers starting from 1 trillion for 1 second in 2 threads: prime-checker 1000000000000 1 2");
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted before the run time elapsed, stopping early");
        }
    }
}
