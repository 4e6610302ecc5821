package io.staking.core.fee;

import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;
import io.staking.core.protocol.TierBenefit;

/**
 * Basis-point fee arithmetic. All divisions truncate, so rounding always
 * favours the staker by at most one minor unit.
 */
public final class FeeEngine {
    private FeeEngine() {}

    public static final long BPS_DENOMINATOR = 10_000L;
    public static final long REWARD_FEE_BPS = 1_000L;
    public static final long EARLY_WITHDRAWAL_PENALTY_BPS = 500L;

    /** 10% of gross rewards. */
    public static long rewardFee(long grossRewards) {
        return applyBps(grossRewards, REWARD_FEE_BPS);
    }

    /** 5% of the withdrawn principal. */
    public static long earlyWithdrawalPenalty(long amount) {
        return applyBps(amount, EARLY_WITHDRAWAL_PENALTY_BPS);
    }

    /** {@code baseFee} reduced by the tier's fee discount. */
    public static long tierDiscountedFee(long baseFee, TierBenefit benefit) {
        return baseFee - applyBps(baseFee, benefit.feeDiscountBps());
    }

    /**
     * floor(amount * bps / 10000), rejecting negative input and overflow.
     * The amount is split by the denominator so the intermediate product never exceeds the result.
     */
    public static long applyBps(long amount, long bps) {
        if (amount < 0) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "amount must be >= 0");
        }
        if (bps < 0) {
            throw new StakingException(StakingError.INVALID_PARAMETER, "bps must be >= 0");
        }
        try {
            long whole = Math.multiplyExact(amount / BPS_DENOMINATOR, bps);
            long part = Math.multiplyExact(amount % BPS_DENOMINATOR, bps) / BPS_DENOMINATOR;
            return Math.addExact(whole, part);
        } catch (ArithmeticException e) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "Fee computation overflow for " + amount, e);
        }
    }
}
