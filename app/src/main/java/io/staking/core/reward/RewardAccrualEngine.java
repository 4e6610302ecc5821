package io.staking.core.reward;

import io.staking.core.events.LedgerEvent;
import io.staking.core.events.LedgerEvents;
import io.staking.core.fee.FeeEngine;
import io.staking.core.pool.PoolRegistry;
import io.staking.core.protocol.Pool;
import io.staking.core.protocol.PositionKey;
import io.staking.core.protocol.Receipt;
import io.staking.core.protocol.StakePosition;
import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;
import io.staking.core.protocol.TierClaim;
import io.staking.core.protocol.UserStats;
import io.staking.core.state.LedgerState;
import io.staking.core.state.ValueTransfer;
import io.staking.core.state.ValueTransfer.Transfer;
import io.staking.core.tier.TierEngine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Simple-interest yield on staked principal, re-based at every claim.
 *
 * pending = floor(amount * dailyRateBps * (now - lastClaim) / (10000 * 86400))
 *
 * Payouts come out of the pool's reward balance and never exceed it. The
 * reward fee goes to the operator.
 */
public final class RewardAccrualEngine {

    static final BigInteger RATE_DENOMINATOR =
            BigInteger.valueOf(FeeEngine.BPS_DENOMINATOR * Tier.SECONDS_PER_DAY);

    private final LedgerState state;
    private final PoolRegistry pools;
    private final TierEngine tiers;
    private final ValueTransfer transfers;

    public RewardAccrualEngine(LedgerState state, PoolRegistry pools, TierEngine tiers, ValueTransfer transfers) {
        this.state = state;
        this.pools = pools;
        this.tiers = tiers;
        this.transfers = transfers;
    }

    public static long pendingRewards(Pool pool, StakePosition position, long now) {
        long elapsed = now - position.lastClaim();
        if (elapsed < 0) {
            throw new IllegalStateException("Clock went backwards: now=" + now + " lastClaim=" + position.lastClaim());
        }
        BigInteger accrued = BigInteger.valueOf(position.amount())
                .multiply(BigInteger.valueOf(pool.dailyRateBps()))
                .multiply(BigInteger.valueOf(elapsed))
                .divide(RATE_DENOMINATOR);
        try {
            return accrued.longValueExact();
        } catch (ArithmeticException e) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "Pending rewards exceed 64 bits", e);
        }
    }

    public long pendingRewards(String staker, long poolId, long now) {
        Pool pool = pools.requirePool(poolId);
        return pendingRewards(pool, requirePosition(poolId, staker), now);
    }

    /** Pays pending rewards minus the reward fee. Works in any pool status. */
    public Receipt<Long> claim(String staker, long poolId, long now) {
        Pool pool = pools.requirePool(poolId);
        PositionKey key = new PositionKey(poolId, staker);
        StakePosition position = requirePosition(poolId, staker);

        long gross = requirePayable(pool, pendingRewards(pool, position, now));
        long fee = FeeEngine.rewardFee(gross);
        long net = gross - fee;

        Payout payout = prepare(pool, position, staker, gross, net, fee, false, now);
        transfers.applyBatch(List.of(
                new Transfer(state.custodyAccount(), staker, net),
                new Transfer(state.custodyAccount(), state.operator(), fee)));
        payout.commit(key);

        List<LedgerEvent> events = new ArrayList<>(2);
        events.add(LedgerEvents.rewardsClaimed(poolId, staker, gross, fee, net, now));
        addFeeEvent(events, poolId, staker, fee, now);
        return new Receipt<>(net, events);
    }

    /**
     * Claim with the loyalty bonus on top of the base reward and the tier's
     * discount off the fee. The tier is the live one, from the current
     * continuous staking duration. The position's tier record is ratcheted
     * first and then credited with the bonus and discount.
     */
    public Receipt<TierClaim> claimWithTierBonus(String staker, long poolId, long now) {
        if (!tiers.loyaltyEnabled()) {
            throw new StakingException(StakingError.LOYALTY_DISABLED, "Loyalty program is disabled");
        }
        Pool pool = pools.requirePool(poolId);
        PositionKey key = new PositionKey(poolId, staker);
        StakePosition position = requirePosition(poolId, staker);

        long base = pendingRewards(pool, position, now);
        if (base == 0) {
            throw new StakingException(StakingError.NO_REWARDS, "Nothing accrued for " + key);
        }
        Tier tier = TierEngine.liveTier(position, now);
        TierBenefit benefit = tiers.benefitFor(tier);
        long bonus = tiers.calculateTierBonus(base, tier);
        long gross;
        try {
            gross = Math.addExact(base, bonus);
        } catch (ArithmeticException e) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "Reward plus bonus overflows", e);
        }
        requirePayable(pool, gross);

        long baseFee = FeeEngine.rewardFee(gross);
        long fee = FeeEngine.tierDiscountedFee(baseFee, benefit);
        long discount = baseFee - fee;
        long net = gross - fee;

        Payout payout = prepare(pool, position, staker, gross, net, fee, false, now);
        transfers.applyBatch(List.of(
                new Transfer(state.custodyAccount(), staker, net),
                new Transfer(state.custodyAccount(), state.operator(), fee)));
        payout.commit(key);
        Receipt<Tier> ratchet = tiers.ratchet(key, tier, now);
        tiers.accrueBenefits(key, bonus, discount, now);

        List<LedgerEvent> events = new ArrayList<>(ratchet.events());
        events.add(LedgerEvents.rewardsClaimed(poolId, staker, gross, fee, net, now));
        addFeeEvent(events, poolId, staker, fee, now);
        events.add(LedgerEvents.tierBonusApplied(poolId, staker, tier, bonus, discount, now));
        return new Receipt<>(new TierClaim(net, bonus, discount, tier), events);
    }

    /** Re-stakes net rewards into the position. Only the fee leaves custody. */
    public Receipt<Long> compound(String staker, long poolId, long now) {
        Pool pool = pools.requireAcceptingPool(poolId, now);
        PositionKey key = new PositionKey(poolId, staker);
        StakePosition position = requirePosition(poolId, staker);

        long gross = requirePayable(pool, pendingRewards(pool, position, now));
        long fee = FeeEngine.rewardFee(gross);
        long net = gross - fee;

        Payout payout = prepare(pool, position, staker, gross, net, fee, true, now);
        transfers.applyBatch(List.of(new Transfer(state.custodyAccount(), state.operator(), fee)));
        payout.commit(key);

        List<LedgerEvent> events = new ArrayList<>(2);
        events.add(LedgerEvents.rewardsCompounded(poolId, staker, net, fee, payout.position.amount(), now));
        addFeeEvent(events, poolId, staker, fee, now);
        return new Receipt<>(net, events);
    }

    private StakePosition requirePosition(long poolId, String staker) {
        PositionKey key = new PositionKey(poolId, staker);
        return state.position(key)
                .orElseThrow(() -> new StakingException(StakingError.POSITION_NOT_FOUND, "No position for " + key));
    }

    private static long requirePayable(Pool pool, long gross) {
        if (gross <= 0) {
            throw new StakingException(StakingError.NO_REWARDS, "Nothing accrued in pool " + pool.id());
        }
        if (gross > pool.rewardPoolBalance()) {
            throw new StakingException(StakingError.NO_REWARDS,
                    "Pool " + pool.id() + " reward balance " + pool.rewardPoolBalance() + " cannot cover " + gross);
        }
        return gross;
    }

    private Payout prepare(Pool pool, StakePosition position, String staker, long gross, long net, long fee,
                           boolean compound, long now) {
        long restaked = compound ? net : 0L;
        try {
            Math.addExact(state.totalRewardsPaid(), net);
            Math.addExact(state.totalFeesCollected(), fee);
            Math.addExact(state.totalStaked(), restaked);
            return new Payout(
                    pool.paidOut(gross, net, restaked),
                    compound ? position.compounded(now, net) : position.claimed(now, net),
                    state.user(staker)
                            .orElseThrow(() -> new IllegalStateException("No user stats for staker " + staker))
                            .rewarded(net, fee, restaked, now),
                    staker, net, fee, restaked);
        } catch (ArithmeticException e) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "Payout overflows ledger totals", e);
        }
    }

    private static void addFeeEvent(List<LedgerEvent> events, long poolId, String staker, long fee, long now) {
        if (fee > 0) {
            events.add(LedgerEvents.feeCollected(poolId, LedgerEvents.FEE_TYPE_REWARD, fee, staker, now));
        }
    }

    /** Snapshots computed before any value moves; stored only after the transfers succeed. */
    private final class Payout {
        final Pool pool;
        final StakePosition position;
        final UserStats stats;
        final String staker;
        final long net;
        final long fee;
        final long restaked;

        Payout(Pool pool, StakePosition position, UserStats stats, String staker, long net, long fee, long restaked) {
            this.pool = pool;
            this.position = position;
            this.stats = stats;
            this.staker = staker;
            this.net = net;
            this.fee = fee;
            this.restaked = restaked;
        }

        void commit(PositionKey key) {
            state.putPool(pool);
            state.putPosition(key, position);
            state.putUser(staker, stats);
            state.addRewardsPaid(net);
            state.addFeesCollected(fee);
            state.addStaked(restaked);
        }
    }
}
