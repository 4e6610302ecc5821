package io.staking.core.events;

import io.staking.core.protocol.Tier;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factories for every event the ledger emits. The field sets here are the
 * contract with the external indexer; change them only together with it.
 */
public final class LedgerEvents {
    private LedgerEvents() {}

    public static final String POOL_CREATED = "pool-created";
    public static final String POOL_FUNDED = "pool-funded";
    public static final String POOL_PAUSED = "pool-paused";
    public static final String POOL_RESUMED = "pool-resumed";
    public static final String POOL_ENDED = "pool-ended";
    public static final String STAKE_DEPOSITED = "stake-deposited";
    public static final String STAKE_WITHDRAWN = "stake-withdrawn";
    public static final String REWARDS_CLAIMED = "rewards-claimed";
    public static final String REWARDS_COMPOUNDED = "rewards-compounded";
    public static final String FEE_COLLECTED = "fee-collected";
    public static final String COOLDOWN_STARTED = "cooldown-started";
    public static final String TIER_UPGRADED = "tier-upgraded";
    public static final String TIER_INITIALIZED = "tier-initialized";
    public static final String TIER_BONUS_APPLIED = "tier-bonus-applied";
    public static final String LOYALTY_TOGGLED = "loyalty-toggled";

    public static final String FEE_TYPE_REWARD = "reward-fee";
    public static final String FEE_TYPE_EARLY_WITHDRAWAL = "early-withdrawal";

    public static LedgerEvent poolCreated(long poolId, String name, long rewardRate, long minStake,
                                          long lockPeriod, long timestamp) {
        return new Builder(POOL_CREATED)
                .put("pool-id", poolId)
                .put("name", name)
                .put("reward-rate", rewardRate)
                .put("min-stake", minStake)
                .put("lock-period", lockPeriod)
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent poolFunded(long poolId, long amount, long newBalance, long timestamp) {
        return new Builder(POOL_FUNDED)
                .put("pool-id", poolId)
                .put("amount", amount)
                .put("new-balance", newBalance)
                .put("timestamp", timestamp)
                .build();
    }

    /** {@code pool-paused}, {@code pool-resumed} and {@code pool-ended} share one shape. */
    public static LedgerEvent poolStatusChanged(String type, long poolId, long timestamp) {
        return new Builder(type)
                .put("pool-id", poolId)
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent stakeDeposited(long poolId, String staker, long amount, long totalStake,
                                             long unlockTime, boolean newStaker, long timestamp) {
        return new Builder(STAKE_DEPOSITED)
                .put("pool-id", poolId)
                .put("staker", staker)
                .put("amount", amount)
                .put("total-stake", totalStake)
                .put("unlock-time", unlockTime)
                .put("is-new-staker", newStaker)
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent stakeWithdrawn(long poolId, String staker, long amount, long penalty,
                                             long netAmount, boolean early, long remainingStake, long timestamp) {
        return new Builder(STAKE_WITHDRAWN)
                .put("pool-id", poolId)
                .put("staker", staker)
                .put("amount", amount)
                .put("penalty", penalty)
                .put("net-amount", netAmount)
                .put("is-early-withdrawal", early)
                .put("remaining-stake", remainingStake)
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent rewardsClaimed(long poolId, String staker, long grossRewards, long fee,
                                             long netRewards, long timestamp) {
        return new Builder(REWARDS_CLAIMED)
                .put("pool-id", poolId)
                .put("staker", staker)
                .put("gross-rewards", grossRewards)
                .put("fee", fee)
                .put("net-rewards", netRewards)
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent rewardsCompounded(long poolId, String staker, long compounded, long fee,
                                                long newStakeAmount, long timestamp) {
        return new Builder(REWARDS_COMPOUNDED)
                .put("pool-id", poolId)
                .put("staker", staker)
                .put("rewards-compounded", compounded)
                .put("fee", fee)
                .put("new-stake-amount", newStakeAmount)
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent feeCollected(long poolId, String feeType, long amount, String staker, long timestamp) {
        return new Builder(FEE_COLLECTED)
                .put("pool-id", poolId)
                .put("fee-type", feeType)
                .put("amount", amount)
                .put("staker", staker)
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent cooldownStarted(long poolId, String staker, long cooldownEnds, long timestamp) {
        return new Builder(COOLDOWN_STARTED)
                .put("pool-id", poolId)
                .put("staker", staker)
                .put("cooldown-ends", cooldownEnds)
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent tierUpgraded(long poolId, String staker, Tier oldTier, Tier newTier, long timestamp) {
        return new Builder(TIER_UPGRADED)
                .put("pool-id", poolId)
                .put("staker", staker)
                .put("old-tier", (long) oldTier.level())
                .put("new-tier", (long) newTier.level())
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent tierInitialized(long poolId, String staker, Tier tier, long timestamp) {
        return new Builder(TIER_INITIALIZED)
                .put("pool-id", poolId)
                .put("staker", staker)
                .put("tier", (long) tier.level())
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent tierBonusApplied(long poolId, String staker, Tier tier, long bonus,
                                               long feeDiscount, long timestamp) {
        return new Builder(TIER_BONUS_APPLIED)
                .put("pool-id", poolId)
                .put("staker", staker)
                .put("tier", (long) tier.level())
                .put("tier-bonus", bonus)
                .put("fee-discount", feeDiscount)
                .put("timestamp", timestamp)
                .build();
    }

    public static LedgerEvent loyaltyToggled(boolean enabled, long timestamp) {
        return new Builder(LOYALTY_TOGGLED)
                .put("enabled", enabled)
                .put("timestamp", timestamp)
                .build();
    }

    private static final class Builder {
        private final String type;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        Builder(String type) { this.type = type; }

        Builder put(String key, long value) { fields.put(key, value); return this; }
        Builder put(String key, boolean value) { fields.put(key, value); return this; }
        Builder put(String key, String value) { fields.put(key, value); return this; }

        LedgerEvent build() { return new LedgerEvent(type, fields); }
    }
}
