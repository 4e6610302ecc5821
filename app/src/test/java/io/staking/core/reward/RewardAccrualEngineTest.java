package io.staking.core.reward;

import io.staking.core.events.LedgerEvent;
import io.staking.core.events.LedgerEvents;
import io.staking.core.pool.PoolRegistry;
import io.staking.core.protocol.LoyaltyTierRecord;
import io.staking.core.protocol.Pool;
import io.staking.core.protocol.Receipt;
import io.staking.core.protocol.StakePosition;
import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierClaim;
import io.staking.core.stake.StakeLedger;
import io.staking.core.state.InMemoryValueTransfer;
import io.staking.core.state.LedgerState;
import io.staking.core.tier.TierEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class RewardAccrualEngineTest {

    private static final long DAY = Tier.SECONDS_PER_DAY;
    private static final long T0 = 1_700_000_000L;
    private static final long FUNDING = 10_000_000_000L;

    private final LedgerState state = new LedgerState("operator", "staking-custody", true);
    private final InMemoryValueTransfer transfers = new InMemoryValueTransfer();
    private final PoolRegistry pools = new PoolRegistry(state, transfers);
    private final TierEngine tiers = new TierEngine(state);
    private final StakeLedger stakes = new StakeLedger(state, pools, tiers, transfers);
    private final RewardAccrualEngine rewards = new RewardAccrualEngine(state, pools, tiers, transfers);
    private long poolId;

    @BeforeEach
    void setUp() {
        transfers.setBalance("operator", 1_000_000_000_000L);
        transfers.setBalance("alice", 1_000_000_000L);
        poolId = pools.createPool("operator", "Core", 500, 1_000_000, 7 * DAY, DAY, OptionalLong.empty(), T0).value();
        pools.fundRewardPool("operator", poolId, FUNDING, T0);
        stakes.deposit("alice", poolId, 10_000_000L, T0);
    }

    @Test
    void pendingAccruesLinearly() {
        assertEquals(0L, rewards.pendingRewards("alice", poolId, T0));
        assertEquals(500_000L, rewards.pendingRewards("alice", poolId, T0 + DAY));
        assertEquals(250_000L, rewards.pendingRewards("alice", poolId, T0 + DAY / 2));
        // 10M * 500 / (10000 * 86400) per second truncates to 5
        assertEquals(5L, rewards.pendingRewards("alice", poolId, T0 + 1));
    }

    @Test
    void pendingRejectsClockGoingBackwards() {
        Pool pool = pools.requirePool(poolId);
        StakePosition position = stakes.getPosition(poolId, "alice").orElseThrow();
        assertThrows(IllegalStateException.class, () -> RewardAccrualEngine.pendingRewards(pool, position, T0 - 1));
    }

    @Test
    void claimPaysNetAndFee() {
        long operatorBefore = transfers.getBalance("operator");
        long aliceBefore = transfers.getBalance("alice");

        Receipt<Long> r = rewards.claim("alice", poolId, T0 + DAY);

        assertEquals(450_000L, r.value());
        assertEquals(List.of(LedgerEvents.REWARDS_CLAIMED, LedgerEvents.FEE_COLLECTED), types(r.events()));
        LedgerEvent claimed = r.events().get(0);
        assertEquals(500_000L, claimed.getLong("gross-rewards"));
        assertEquals(50_000L, claimed.getLong("fee"));
        assertEquals(LedgerEvents.FEE_TYPE_REWARD, r.events().get(1).getString("fee-type"));

        assertEquals(aliceBefore + 450_000L, transfers.getBalance("alice"));
        assertEquals(operatorBefore + 50_000L, transfers.getBalance("operator"));
        Pool pool = pools.requirePool(poolId);
        assertEquals(FUNDING - 500_000L, pool.rewardPoolBalance());
        assertEquals(450_000L, pool.totalRewardsPaid());
        StakePosition position = stakes.getPosition(poolId, "alice").orElseThrow();
        assertEquals(T0 + DAY, position.lastClaim());
        assertEquals(450_000L, position.totalEarned());
        assertEquals(450_000L, state.totalRewardsPaid());
        assertEquals(50_000L, state.totalFeesCollected());
    }

    @Test
    void secondClaimInSameInstantHasNothing() {
        rewards.claim("alice", poolId, T0 + DAY);
        StakingException e = assertThrows(StakingException.class, () -> rewards.claim("alice", poolId, T0 + DAY));
        assertEquals(StakingError.NO_REWARDS, e.error());
    }

    @Test
    void claimCannotExceedRewardBalance() {
        long thin = pools.createPool("operator", "Thin", 500, 0, 0, 0, OptionalLong.empty(), T0).value();
        pools.fundRewardPool("operator", thin, 100_000L, T0);
        stakes.deposit("alice", thin, 10_000_000L, T0);
        long aliceBefore = transfers.getBalance("alice");

        StakingException e = assertThrows(StakingException.class, () -> rewards.claim("alice", thin, T0 + DAY));

        assertEquals(StakingError.NO_REWARDS, e.error());
        assertEquals(aliceBefore, transfers.getBalance("alice"));
        assertEquals(T0, stakes.getPosition(thin, "alice").orElseThrow().lastClaim());
    }

    @Test
    void claimWorksAfterPoolEnds() {
        pools.endPool("operator", poolId, T0);
        assertEquals(450_000L, rewards.claim("alice", poolId, T0 + DAY).value());
    }

    @Test
    void claimWithoutPositionFails() {
        StakingException e = assertThrows(StakingException.class, () -> rewards.claim("bob", poolId, T0 + DAY));
        assertEquals(StakingError.POSITION_NOT_FOUND, e.error());
    }

    @Test
    void compoundRestakesNetRewards() {
        long aliceBefore = transfers.getBalance("alice");
        long custodyBefore = transfers.getBalance("staking-custody");

        Receipt<Long> r = rewards.compound("alice", poolId, T0 + DAY);

        assertEquals(450_000L, r.value());
        assertEquals(10_450_000L, r.events().get(0).getLong("new-stake-amount"));
        assertEquals(10_450_000L, stakes.getPosition(poolId, "alice").orElseThrow().amount());
        Pool pool = pools.requirePool(poolId);
        assertEquals(10_450_000L, pool.totalStaked());
        assertEquals(450_000L, pool.totalRewardsPaid());
        assertEquals(10_450_000L, state.totalStaked());
        assertEquals(10_450_000L, stakes.votingPower("alice"));
        assertEquals(aliceBefore, transfers.getBalance("alice"));
        assertEquals(custodyBefore - 50_000L, transfers.getBalance("staking-custody"));
        assertEquals(pool.totalStaked() + pool.rewardPoolBalance(), transfers.getBalance("staking-custody"));
    }

    @Test
    void compoundNeedsAcceptingPool() {
        pools.pausePool("operator", poolId, T0);
        StakingException e = assertThrows(StakingException.class, () -> rewards.compound("alice", poolId, T0 + DAY));
        assertEquals(StakingError.POOL_INACTIVE, e.error());
    }

    @Test
    void tierClaimAtSilverAppliesBonusAndDiscount() {
        Receipt<TierClaim> r = rewards.claimWithTierBonus("alice", poolId, T0 + 30 * DAY);

        TierClaim claim = r.value();
        assertEquals(Tier.SILVER, claim.tier());
        assertEquals(750_000L, claim.tierBonus());
        assertEquals(157_500L, claim.feeDiscount());
        assertEquals(14_332_500L, claim.netRewards());
        assertEquals(List.of(LedgerEvents.TIER_INITIALIZED, LedgerEvents.REWARDS_CLAIMED,
                LedgerEvents.FEE_COLLECTED, LedgerEvents.TIER_BONUS_APPLIED), types(r.events()));
        assertEquals(15_750_000L, r.events().get(1).getLong("gross-rewards"));
        assertEquals(1_417_500L, r.events().get(1).getLong("fee"));

        LoyaltyTierRecord record = tiers.record(poolId, "alice").orElseThrow();
        assertEquals(Tier.SILVER, record.currentTier());
        assertEquals(750_000L, record.totalBonusEarned());
        assertEquals(157_500L, record.totalFeeDiscount());
        assertEquals(FUNDING - 15_750_000L, pools.requirePool(poolId).rewardPoolBalance());
    }

    @Test
    void tierClaimAtBronzeMatchesPlainClaim() {
        Receipt<TierClaim> r = rewards.claimWithTierBonus("alice", poolId, T0 + DAY);

        assertEquals(Tier.BRONZE, r.value().tier());
        assertEquals(0L, r.value().tierBonus());
        assertEquals(0L, r.value().feeDiscount());
        assertEquals(450_000L, r.value().netRewards());
    }

    @Test
    void tierClaimNeedsLoyaltyProgram() {
        state.setLoyaltyEnabled(false);
        StakingException e = assertThrows(StakingException.class,
                () -> rewards.claimWithTierBonus("alice", poolId, T0 + 30 * DAY));
        assertEquals(StakingError.LOYALTY_DISABLED, e.error());
        assertTrue(tiers.record(poolId, "alice").isEmpty());
    }

    @Test
    void tierClaimWithNothingAccrued() {
        StakingException e = assertThrows(StakingException.class,
                () -> rewards.claimWithTierBonus("alice", poolId, T0));
        assertEquals(StakingError.NO_REWARDS, e.error());
    }

    private static List<String> types(List<LedgerEvent> events) {
        return events.stream().map(LedgerEvent::type).toList();
    }
}
