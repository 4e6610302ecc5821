package io.staking.core.protocol;

/** Protocol-wide aggregates, as exposed to external consumers. */
public record ProtocolStats(
        long totalPools,
        long activePools,
        long totalStaked,
        long totalStakers,
        long totalRewardsPaid,
        long totalFeesCollected,
        long tierUpgrades
) {
}
