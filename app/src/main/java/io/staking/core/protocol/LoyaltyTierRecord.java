package io.staking.core.protocol;

import java.util.Objects;

/**
 * Persisted loyalty state of a position. {@code currentTier} only ever moves up.
 */
public record LoyaltyTierRecord(
        Tier currentTier,
        long achievedAt,
        long totalBonusEarned,
        long totalFeeDiscount,
        long lastCheckedAt
) {

    public LoyaltyTierRecord {
        Objects.requireNonNull(currentTier, "currentTier");
    }

    public static LoyaltyTierRecord initial(Tier tier, long now) {
        return new LoyaltyTierRecord(tier, now, 0L, 0L, now);
    }

    public LoyaltyTierRecord upgradedTo(Tier tier, long now) {
        if (!tier.isAbove(currentTier)) {
            throw new IllegalStateException("Tier " + tier + " is not above " + currentTier);
        }
        return new LoyaltyTierRecord(tier, now, totalBonusEarned, totalFeeDiscount, now);
    }

    public LoyaltyTierRecord checkedAt(long now) {
        return new LoyaltyTierRecord(currentTier, achievedAt, totalBonusEarned, totalFeeDiscount, now);
    }

    public LoyaltyTierRecord withBenefits(long bonus, long feeDiscount, long now) {
        return new LoyaltyTierRecord(currentTier, achievedAt,
                Math.addExact(totalBonusEarned, bonus),
                Math.addExact(totalFeeDiscount, feeDiscount), now);
    }
}
