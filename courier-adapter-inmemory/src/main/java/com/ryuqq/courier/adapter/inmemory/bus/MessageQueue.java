package com.ryuqq.courier.adapter.inmemory.bus;

import com.ryuqq.courier.core.contract.Envelope;
import com.ryuqq.courier.core.model.TargetId;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * FIFO queue of envelopes for one message type.
 *
 * <p>Insertion order is preserved for every entry regardless of its target. A poll removes the
 * earliest entry that matches the requested target, so targeting never reorders matching
 * entries relative to each other.</p>
 *
 * <p><strong>Not thread-safe.</strong> Every access is guarded by the owning bus lock.</p>
 *
 * @param <T> message type
 * @author Courier Team
 * @since 1.0.0
 */
final class MessageQueue<T> {

    private final Deque<Envelope<T>> entries = new ArrayDeque<>();

    void add(Envelope<T> envelope) {
        entries.addLast(envelope);
    }

    /**
     * Removes and returns the earliest entry deliverable to {@code requested}.
     *
     * @param requested receiver identity
     * @return the removed entry, or {@code null} if none matches
     */
    Envelope<T> poll(TargetId requested) {
        Iterator<Envelope<T>> iterator = entries.iterator();
        while (iterator.hasNext()) {
            Envelope<T> envelope = iterator.next();
            if (envelope.isDeliverableTo(requested)) {
                iterator.remove();
                return envelope;
            }
        }
        return null;
    }

    int size() {
        return entries.size();
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Drops every entry.
     *
     * @return number of dropped entries
     */
    int clear() {
        int dropped = entries.size();
        entries.clear();
        return dropped;
    }
}
