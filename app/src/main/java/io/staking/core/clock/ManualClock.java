package io.staking.core.clock;

/** Clock that only moves when told to. Used by tests and the demo flow. */
public final class ManualClock implements LedgerClock {

    private long now;

    public ManualClock(long start) {
        if (start < 0) throw new IllegalArgumentException("start must be >= 0");
        this.now = start;
    }

    @Override
    public synchronized long now() {
        return now;
    }

    public synchronized long advance(long seconds) {
        if (seconds < 0) throw new IllegalArgumentException("Clock cannot move backwards");
        now = Math.addExact(now, seconds);
        return now;
    }
}
