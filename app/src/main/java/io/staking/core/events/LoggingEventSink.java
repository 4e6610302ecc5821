package io.staking.core.events;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Writes each event as a JSON line to the {@code io.staking.events} logger. */
public final class LoggingEventSink implements EventSink {
    private static final Logger LOG = Logger.getLogger("io.staking.events");

    private final Level level;

    public LoggingEventSink() {
        this(Level.INFO);
    }

    public LoggingEventSink(Level level) {
        this.level = level;
    }

    @Override
    public void publish(List<LedgerEvent> events) {
        if (!LOG.isLoggable(level)) {
            return;
        }
        for (LedgerEvent event : events) {
            LOG.log(level, EventCodec.toJson(event).toString());
        }
    }
}
