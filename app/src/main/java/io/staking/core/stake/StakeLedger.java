package io.staking.core.stake;

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
import io.staking.core.protocol.UserStats;
import io.staking.core.state.LedgerState;
import io.staking.core.state.ValueTransfer;
import io.staking.core.state.ValueTransfer.Transfer;
import io.staking.core.tier.TierEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deposits and withdrawals of principal.
 *
 * Each operation first computes every new snapshot (pool, position, user),
 * then moves value, then stores the snapshots. A failed precondition or a
 * failed transfer leaves the ledger untouched.
 */
public final class StakeLedger {

    private final LedgerState state;
    private final PoolRegistry pools;
    private final TierEngine tiers;
    private final ValueTransfer transfers;

    public StakeLedger(LedgerState state, PoolRegistry pools, TierEngine tiers, ValueTransfer transfers) {
        this.state = state;
        this.pools = pools;
        this.tiers = tiers;
        this.transfers = transfers;
    }

    /** Returns the position total after the deposit. */
    public Receipt<Long> deposit(String staker, long poolId, long amount, long now) {
        requireStaker(staker);
        Pool pool = pools.requireAcceptingPool(poolId, now);
        if (amount <= 0 || amount < pool.minStake()) {
            throw new StakingException(StakingError.INVALID_AMOUNT,
                    "Deposit " + amount + " below minimum " + pool.minStake());
        }

        PositionKey key = new PositionKey(poolId, staker);
        Optional<StakePosition> existing = state.position(key);
        boolean newStaker = existing.isEmpty();

        StakePosition position;
        Pool updatedPool;
        UserStats stats;
        try {
            position = newStaker
                    ? StakePosition.open(amount, now, pool.lockPeriod())
                    : existing.get().toppedUp(amount, now, pool.lockPeriod());
            updatedPool = pool.deposited(amount, newStaker);
            stats = state.user(staker).orElseGet(() -> UserStats.firstStake(now))
                    .staked(amount, newStaker, now);
            // protocol total is only bumped after the transfer, check it up front
            Math.addExact(state.totalStaked(), amount);
        } catch (ArithmeticException e) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "Deposit overflows ledger totals", e);
        }

        transfers.applyBatch(List.of(new Transfer(staker, state.custodyAccount(), amount)));

        state.putPosition(key, position);
        state.putPool(updatedPool);
        state.putUser(staker, stats);
        state.addStaked(amount);

        return Receipt.of(position.amount(), LedgerEvents.stakeDeposited(poolId, staker, amount,
                position.amount(), position.unlockTime(), newStaker, now));
    }

    /**
     * Withdraws principal. Before unlock this is an early exit carrying the
     * early-withdrawal penalty; after unlock the cooldown must be complete.
     * Returns the net amount paid to the staker.
     */
    public Receipt<Long> withdraw(String staker, long poolId, long amount, long now) {
        requireStaker(staker);
        Pool pool = pools.requirePool(poolId);
        if (amount <= 0) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "Withdrawal amount must be > 0");
        }
        PositionKey key = new PositionKey(poolId, staker);
        StakePosition position = state.position(key)
                .orElseThrow(() -> new StakingException(StakingError.INSUFFICIENT_STAKE, "No position for " + key));
        if (amount > position.amount()) {
            throw new StakingException(StakingError.INSUFFICIENT_STAKE,
                    "Requested " + amount + " but position holds " + position.amount());
        }

        CooldownState cooldown = CooldownStateMachine.stateOf(pool, position, now);
        boolean early = cooldown == CooldownState.LOCKED;
        if (!early && cooldown != CooldownState.WITHDRAWABLE) {
            throw new StakingException(StakingError.COOLDOWN_ACTIVE,
                    "Position " + key + " is " + cooldown + "; cooldown must complete first");
        }

        long penalty = early ? FeeEngine.earlyWithdrawalPenalty(amount) : 0L;
        long net = amount - penalty;
        boolean closed = amount == position.amount();
        long remaining = position.amount() - amount;

        Pool updatedPool = pool.withdrawn(amount, closed);
        UserStats stats = state.user(staker)
                .orElseThrow(() -> new IllegalStateException("No user stats for staker " + staker))
                .unstaked(amount, penalty, now);

        transfers.applyBatch(List.of(
                new Transfer(state.custodyAccount(), staker, net),
                new Transfer(state.custodyAccount(), state.operator(), penalty)));

        if (closed) {
            state.removePosition(key);
            tiers.forget(key);
        } else {
            state.putPosition(key, position.reduced(amount));
        }
        state.putPool(updatedPool);
        state.putUser(staker, stats);
        state.addStaked(-amount);
        state.addFeesCollected(penalty);

        List<LedgerEvent> events = new ArrayList<>(2);
        events.add(LedgerEvents.stakeWithdrawn(poolId, staker, amount, penalty, net, early, remaining, now));
        if (penalty > 0) {
            events.add(LedgerEvents.feeCollected(poolId, LedgerEvents.FEE_TYPE_EARLY_WITHDRAWAL, penalty, staker, now));
        }
        return new Receipt<>(net, events);
    }

    public Optional<StakePosition> getPosition(long poolId, String staker) {
        return state.position(new PositionKey(poolId, staker));
    }

    /** Live positions in one pool; their amounts sum to the pool's total staked. */
    public List<StakePosition> positionsInPool(long poolId) {
        pools.requirePool(poolId);
        return state.positionsInPool(poolId);
    }

    public StakePosition requirePosition(long poolId, String staker) {
        PositionKey key = new PositionKey(poolId, staker);
        return state.position(key)
                .orElseThrow(() -> new StakingException(StakingError.POSITION_NOT_FOUND, "No position for " + key));
    }

    public Optional<UserStats> getUserStats(String staker) {
        return state.user(staker);
    }

    /** Stake-weighted voting power read by governance: principal across all pools. */
    public long votingPower(String staker) {
        return state.user(staker).map(UserStats::totalStaked).orElse(0L);
    }

    private static void requireStaker(String staker) {
        if (staker == null || staker.isBlank()) {
            throw new StakingException(StakingError.INVALID_PARAMETER, "Staker identity required");
        }
    }
}
