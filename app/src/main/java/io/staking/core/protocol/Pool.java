package io.staking.core.protocol;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Immutable snapshot of a staking pool. Every mutation produces a new
 * snapshot which the registry stores in place of the old one.
 *
 * Times and periods are in seconds; amounts are in minor units.
 */
public record Pool(
        long id,
        String name,
        long dailyRateBps,
        long minStake,
        long lockPeriod,
        long cooldownPeriod,
        long totalStaked,
        long totalRewardsPaid,
        long stakerCount,
        long createdAt,
        OptionalLong endsAt,
        PoolStatus status,
        long rewardPoolBalance
) {

    public Pool {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(endsAt, "endsAt");
        Objects.requireNonNull(status, "status");
        if (totalStaked < 0) throw new IllegalStateException("totalStaked must be >= 0");
        if (stakerCount < 0) throw new IllegalStateException("stakerCount must be >= 0");
        if (rewardPoolBalance < 0) throw new IllegalStateException("rewardPoolBalance must be >= 0");
    }

    public static Pool create(long id, String name, long dailyRateBps, long minStake,
                              long lockPeriod, long cooldownPeriod, long createdAt, OptionalLong endsAt) {
        return new Pool(id, name, dailyRateBps, minStake, lockPeriod, cooldownPeriod,
                0L, 0L, 0L, createdAt, endsAt, PoolStatus.ACTIVE, 0L);
    }

    /** Active and not past its end time. */
    public boolean isAcceptingStake(long now) {
        return status == PoolStatus.ACTIVE && (endsAt.isEmpty() || now < endsAt.getAsLong());
    }

    public Pool withStatus(PoolStatus next) {
        return new Pool(id, name, dailyRateBps, minStake, lockPeriod, cooldownPeriod, totalStaked,
                totalRewardsPaid, stakerCount, createdAt, endsAt, next, rewardPoolBalance);
    }

    public Pool funded(long amount) {
        return new Pool(id, name, dailyRateBps, minStake, lockPeriod, cooldownPeriod, totalStaked,
                totalRewardsPaid, stakerCount, createdAt, endsAt, status,
                Math.addExact(rewardPoolBalance, amount));
    }

    public Pool deposited(long amount, boolean newStaker) {
        return new Pool(id, name, dailyRateBps, minStake, lockPeriod, cooldownPeriod,
                Math.addExact(totalStaked, amount), totalRewardsPaid,
                newStaker ? stakerCount + 1 : stakerCount,
                createdAt, endsAt, status, rewardPoolBalance);
    }

    public Pool withdrawn(long amount, boolean positionClosed) {
        return new Pool(id, name, dailyRateBps, minStake, lockPeriod, cooldownPeriod,
                totalStaked - amount, totalRewardsPaid,
                positionClosed ? stakerCount - 1 : stakerCount,
                createdAt, endsAt, status, rewardPoolBalance);
    }

    /**
     * Pays {@code grossRewards} out of the reward balance. {@code netRewards} counts
     * toward rewards paid; {@code compounded} is re-staked into the pool.
     */
    public Pool paidOut(long grossRewards, long netRewards, long compounded) {
        return new Pool(id, name, dailyRateBps, minStake, lockPeriod, cooldownPeriod,
                Math.addExact(totalStaked, compounded),
                Math.addExact(totalRewardsPaid, netRewards),
                stakerCount, createdAt, endsAt, status,
                rewardPoolBalance - grossRewards);
    }
}
