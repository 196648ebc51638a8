package com.ryuqq.courier.testkit.support;

import com.ryuqq.courier.core.spi.MessageLogger;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link MessageLogger} that records every observation in order, for assertions.
 *
 * <p>Thread-safe.</p>
 *
 * @param <T> message type
 * @author Courier Team
 * @since 1.0.0
 */
public class RecordingMessageLogger<T> implements MessageLogger<T> {

    /**
     * One recorded observation.
     *
     * @param payload observed payload
     * @param sending {@code true} for a send, {@code false} for a receive
     * @param <T> message type
     */
    public record Entry<T>(T payload, boolean sending) {
    }

    private final List<Entry<T>> entries = new ArrayList<>();

    @Override
    public synchronized void log(T payload, boolean sending) {
        entries.add(new Entry<>(payload, sending));
    }

    /**
     * Returns a snapshot of every observation in order.
     *
     * @return recorded entries
     */
    public synchronized List<Entry<T>> entries() {
        return List.copyOf(entries);
    }

    public synchronized List<T> sent() {
        return payloads(true);
    }

    public synchronized List<T> received() {
        return payloads(false);
    }

    public synchronized void clear() {
        entries.clear();
    }

    private List<T> payloads(boolean sending) {
        List<T> result = new ArrayList<>();
        for (Entry<T> entry : entries) {
            if (entry.sending() == sending) {
                result.add(entry.payload());
            }
        }
        return result;
    }
}
