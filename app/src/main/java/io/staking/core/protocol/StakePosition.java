package io.staking.core.protocol;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * One staker's balance and timers within one pool.
 * {@code amount} is strictly positive for as long as the position exists.
 */
public record StakePosition(
        long amount,
        long stakedAt,
        long lastClaim,
        long totalEarned,
        long unlockTime,
        OptionalLong cooldownStart
) {

    public StakePosition {
        Objects.requireNonNull(cooldownStart, "cooldownStart");
        if (amount <= 0) throw new IllegalStateException("position amount must be > 0");
    }

    public static StakePosition open(long amount, long now, long lockPeriod) {
        return new StakePosition(amount, now, now, 0L, Math.addExact(now, lockPeriod), OptionalLong.empty());
    }

    public boolean isLocked(long now) {
        return now < unlockTime;
    }

    /** Top-up: the lock period and staking duration restart, a running cooldown is dropped. */
    public StakePosition toppedUp(long added, long now, long lockPeriod) {
        return new StakePosition(Math.addExact(amount, added), now, lastClaim, totalEarned,
                Math.addExact(now, lockPeriod), OptionalLong.empty());
    }

    /** Partial withdrawal; cooldown never survives it. */
    public StakePosition reduced(long removed) {
        return new StakePosition(amount - removed, stakedAt, lastClaim, totalEarned, unlockTime,
                OptionalLong.empty());
    }

    public StakePosition claimed(long now, long netRewards) {
        return new StakePosition(amount, stakedAt, now, Math.addExact(totalEarned, netRewards),
                unlockTime, cooldownStart);
    }

    public StakePosition compounded(long now, long netRewards) {
        return new StakePosition(Math.addExact(amount, netRewards), stakedAt, now,
                Math.addExact(totalEarned, netRewards), unlockTime, cooldownStart);
    }

    public StakePosition coolingFrom(long now) {
        return new StakePosition(amount, stakedAt, lastClaim, totalEarned, unlockTime, OptionalLong.of(now));
    }
}
