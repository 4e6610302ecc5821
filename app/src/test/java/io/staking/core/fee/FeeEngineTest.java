package io.staking.core.fee;

import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeeEngineTest {

    @Test
    void rewardFeeAndPenaltyOnRoundAmounts() {
        assertEquals(10_000_000L, FeeEngine.rewardFee(100_000_000L));
        assertEquals(5_000_000L, FeeEngine.earlyWithdrawalPenalty(100_000_000L));
        assertEquals(0L, FeeEngine.rewardFee(0L));
    }

    @Test
    void divisionTruncatesInStakersFavour() {
        assertEquals(1L, FeeEngine.rewardFee(19L));
        assertEquals(0L, FeeEngine.rewardFee(9L));
        assertEquals(0L, FeeEngine.earlyWithdrawalPenalty(19L));
        assertEquals(1L, FeeEngine.earlyWithdrawalPenalty(20L));
    }

    @Test
    void tierDiscountComesOffTheBaseFee() {
        assertEquals(1_417_500L, FeeEngine.tierDiscountedFee(1_575_000L, Tier.SILVER.defaultBenefit()));
        assertEquals(1_575_000L, FeeEngine.tierDiscountedFee(1_575_000L, Tier.BRONZE.defaultBenefit()));
        // discount truncates, so the fee keeps the odd unit
        assertEquals(51L, FeeEngine.tierDiscountedFee(101L, Tier.PLATINUM.defaultBenefit()));
        assertEquals(0L, FeeEngine.tierDiscountedFee(1_000L, new TierBenefit("Free", 0, 10_000, 0)));
    }

    @Test
    void rejectsNegativeInput() {
        StakingException amount = assertThrows(StakingException.class, () -> FeeEngine.rewardFee(-1L));
        assertEquals(StakingError.INVALID_AMOUNT, amount.error());

        StakingException bps = assertThrows(StakingException.class, () -> FeeEngine.applyBps(100L, -1L));
        assertEquals(StakingError.INVALID_PARAMETER, bps.error());
    }

    @Test
    void largeAmountsDoNotOverflowWhenTheResultFits() {
        assertEquals(1_000_000_000_000_000L, FeeEngine.earlyWithdrawalPenalty(20_000_000_000_000_000L));
        assertEquals(922_337_203_685_477_580L, FeeEngine.rewardFee(Long.MAX_VALUE));
        assertEquals(Long.MAX_VALUE / 20, FeeEngine.earlyWithdrawalPenalty(Long.MAX_VALUE));
    }

    @Test
    void overflowIsAnInvalidAmount() {
        StakingException e = assertThrows(StakingException.class,
                () -> FeeEngine.applyBps(Long.MAX_VALUE, 20_000L));
        assertEquals(StakingError.INVALID_AMOUNT, e.error());
        assertTrue(e.getCause() instanceof ArithmeticException);
    }
}
