package io.staking.core.protocol;

/** Per-staker running totals across all pools. */
public record UserStats(
        long totalStaked,
        long totalRewardsEarned,
        long totalFeesPaid,
        long poolsJoined,
        long firstStakeAt,
        long lastActivityAt
) {

    public static UserStats firstStake(long now) {
        return new UserStats(0L, 0L, 0L, 0L, now, now);
    }

    public UserStats staked(long amount, boolean joinedPool, long now) {
        return new UserStats(Math.addExact(totalStaked, amount), totalRewardsEarned, totalFeesPaid,
                joinedPool ? poolsJoined + 1 : poolsJoined, firstStakeAt, now);
    }

    public UserStats unstaked(long amount, long penalty, long now) {
        return new UserStats(totalStaked - amount, totalRewardsEarned,
                Math.addExact(totalFeesPaid, penalty), poolsJoined, firstStakeAt, now);
    }

    public UserStats rewarded(long netRewards, long fee, long compounded, long now) {
        return new UserStats(Math.addExact(totalStaked, compounded),
                Math.addExact(totalRewardsEarned, netRewards),
                Math.addExact(totalFeesPaid, fee), poolsJoined, firstStakeAt, now);
    }
}
