package io.staking.core.events;

import java.util.List;

/**
 * Receives the events of each committed operation, in emission order.
 * This is the only channel toward the external indexer.
 */
public interface EventSink {
    void publish(List<LedgerEvent> events);
}
