package io.staking.core.protocol;

import io.staking.core.events.LedgerEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of a state transition together with the events it emitted, in order.
 */
public record Receipt<T>(T value, List<LedgerEvent> events) {

    public Receipt {
        events = List.copyOf(Objects.requireNonNull(events, "events"));
    }

    public static <T> Receipt<T> of(T value, LedgerEvent... events) {
        return new Receipt<>(value, List.of(events));
    }

    /** Same value, with {@code more} appended after this receipt's events. */
    public Receipt<T> followedBy(List<LedgerEvent> more) {
        List<LedgerEvent> all = new ArrayList<>(events);
        all.addAll(more);
        return new Receipt<>(value, all);
    }
}
