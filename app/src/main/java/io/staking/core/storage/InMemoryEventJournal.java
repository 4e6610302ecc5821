package io.staking.core.storage;

import io.staking.core.events.LedgerEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Simple in-memory journal. Good for tests and nodes started without a journal directory.
 * Not persistent: resets every process run.
 */
public final class InMemoryEventJournal implements EventJournal {

    private final List<LedgerEvent> entries = new ArrayList<>();

    @Override
    public synchronized long append(List<LedgerEvent> events) {
        if (events != null) {
            entries.addAll(events);
        }
        return entries.size();
    }

    @Override
    public synchronized List<JournalEntry> readFrom(long fromSequence, int limit) {
        if (limit <= 0 || fromSequence > entries.size()) {
            return Collections.emptyList();
        }
        int start = (int) Math.max(0L, fromSequence - 1);
        int end = (int) Math.min(entries.size(), (long) start + limit);
        List<JournalEntry> out = new ArrayList<>(end - start);
        for (int i = start; i < end; i++) {
            out.add(new JournalEntry(i + 1L, entries.get(i)));
        }
        return out;
    }

    @Override
    public synchronized long lastSequence() {
        return entries.size();
    }
}
