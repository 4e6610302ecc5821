package io.staking.core.clock;

import java.util.function.LongSupplier;

/**
 * Wall clock in epoch seconds, clamped so that a step back of the system
 * clock is observed as time standing still.
 */
public final class SystemLedgerClock implements LedgerClock {

    private final LongSupplier millis;
    private long last;

    public SystemLedgerClock() {
        this(System::currentTimeMillis);
    }

    SystemLedgerClock(LongSupplier millis) {
        this.millis = millis;
    }

    @Override
    public synchronized long now() {
        long current = millis.getAsLong() / 1000L;
        if (current > last) {
            last = current;
        }
        return last;
    }
}
