package io.staking.core.protocol;

import java.util.Objects;

/** Per-tier configuration: reward bonus and fee discount in basis points. */
public record TierBenefit(String displayName, long rewardBonusBps, long feeDiscountBps, long minDaysStaked) {

    public TierBenefit {
        Objects.requireNonNull(displayName, "displayName");
        if (rewardBonusBps < 0 || rewardBonusBps > 10_000) {
            throw new StakingException(StakingError.INVALID_PARAMETER, "rewardBonusBps must be within [0, 10000]");
        }
        if (feeDiscountBps < 0 || feeDiscountBps > 10_000) {
            throw new StakingException(StakingError.INVALID_PARAMETER, "feeDiscountBps must be within [0, 10000]");
        }
        if (minDaysStaked < 0) {
            throw new StakingException(StakingError.INVALID_PARAMETER, "minDaysStaked must be >= 0");
        }
    }
}
