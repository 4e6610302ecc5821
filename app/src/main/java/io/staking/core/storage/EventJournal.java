package io.staking.core.storage;

import io.staking.core.events.EventSink;
import io.staking.core.events.LedgerEvent;

import java.util.List;

/**
 * Append-only event log, addressed by a sequence number starting at 1.
 * The indexer pages through it with {@link #readFrom(long, int)}.
 *
 * Only events are journaled; ledger state itself is never written here.
 */
public interface EventJournal extends EventSink {

    /** Append events in order (atomic per call). Returns the sequence of the last one. */
    long append(List<LedgerEvent> events);

    /** Up to {@code limit} entries with sequence >= {@code fromSequence}, ascending. */
    List<JournalEntry> readFrom(long fromSequence, int limit);

    /** Sequence of the newest entry, 0 when empty. */
    long lastSequence();

    @Override
    default void publish(List<LedgerEvent> events) {
        if (events != null && !events.isEmpty()) {
            append(events);
        }
    }

    record JournalEntry(long sequence, LedgerEvent event) {}
}
