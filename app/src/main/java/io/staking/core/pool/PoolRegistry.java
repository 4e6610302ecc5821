package io.staking.core.pool;

import io.staking.core.events.LedgerEvents;
import io.staking.core.protocol.Pool;
import io.staking.core.protocol.PoolStatus;
import io.staking.core.protocol.Receipt;
import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;
import io.staking.core.state.LedgerState;
import io.staking.core.state.ValueTransfer;
import io.staking.core.state.ValueTransfer.Transfer;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Pool definitions and their lifecycle: Active, Paused (reversible) and
 * Ended (terminal). Pools are never deleted.
 */
public final class PoolRegistry {

    private final LedgerState state;
    private final ValueTransfer transfers;

    public PoolRegistry(LedgerState state, ValueTransfer transfers) {
        this.state = state;
        this.transfers = transfers;
    }

    public Receipt<Long> createPool(String caller, String name, long dailyRateBps, long minStake,
                                    long lockPeriod, long cooldownPeriod, OptionalLong duration, long now) {
        requireOperator(caller);
        if (name == null || name.isBlank()) {
            throw new StakingException(StakingError.INVALID_PARAMETER, "Pool name required");
        }
        if (dailyRateBps <= 0) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "dailyRateBps must be > 0");
        }
        if (minStake < 0) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "minStake must be >= 0");
        }
        if (lockPeriod < 0 || cooldownPeriod < 0) {
            throw new StakingException(StakingError.INVALID_PARAMETER, "Periods must be >= 0");
        }
        OptionalLong endsAt = OptionalLong.empty();
        if (duration.isPresent()) {
            long d = duration.getAsLong();
            if (d <= 0) {
                throw new StakingException(StakingError.INVALID_PARAMETER, "duration must be > 0");
            }
            try {
                endsAt = OptionalLong.of(Math.addExact(now, d));
            } catch (ArithmeticException e) {
                throw new StakingException(StakingError.INVALID_PARAMETER, "duration overflow", e);
            }
        }

        long id = state.nextPoolId();
        Pool pool = Pool.create(id, name.trim(), dailyRateBps, minStake, lockPeriod, cooldownPeriod, now, endsAt);
        state.putPool(pool);
        return Receipt.of(id, LedgerEvents.poolCreated(id, pool.name(), dailyRateBps, minStake, lockPeriod, now));
    }

    /** Moves {@code amount} from the operator into custody and credits the pool's reward balance. */
    public Receipt<Long> fundRewardPool(String caller, long poolId, long amount, long now) {
        requireOperator(caller);
        Pool pool = requirePool(poolId);
        if (amount <= 0) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "Funding amount must be > 0");
        }
        Pool funded;
        try {
            funded = pool.funded(amount);
        } catch (ArithmeticException e) {
            throw new StakingException(StakingError.INVALID_AMOUNT, "Reward balance overflow", e);
        }

        transfers.applyBatch(List.of(new Transfer(caller, state.custodyAccount(), amount)));

        state.putPool(funded);
        return Receipt.of(funded.rewardPoolBalance(),
                LedgerEvents.poolFunded(poolId, amount, funded.rewardPoolBalance(), now));
    }

    public Receipt<PoolStatus> pausePool(String caller, long poolId, long now) {
        return transition(caller, poolId, PoolStatus.ACTIVE, PoolStatus.PAUSED, LedgerEvents.POOL_PAUSED, now);
    }

    public Receipt<PoolStatus> resumePool(String caller, long poolId, long now) {
        return transition(caller, poolId, PoolStatus.PAUSED, PoolStatus.ACTIVE, LedgerEvents.POOL_RESUMED, now);
    }

    /** Terminal. Existing stakers may still claim and withdraw. */
    public Receipt<PoolStatus> endPool(String caller, long poolId, long now) {
        requireOperator(caller);
        Pool pool = requirePool(poolId);
        if (pool.status() == PoolStatus.ENDED) {
            throw new StakingException(StakingError.POOL_INACTIVE, "Pool " + poolId + " already ended");
        }
        state.putPool(pool.withStatus(PoolStatus.ENDED));
        return Receipt.of(PoolStatus.ENDED, LedgerEvents.poolStatusChanged(LedgerEvents.POOL_ENDED, poolId, now));
    }

    private Receipt<PoolStatus> transition(String caller, long poolId, PoolStatus from, PoolStatus to,
                                           String eventType, long now) {
        requireOperator(caller);
        Pool pool = requirePool(poolId);
        if (pool.status() != from) {
            throw new StakingException(StakingError.POOL_INACTIVE,
                    "Pool " + poolId + " is " + pool.status() + ", expected " + from);
        }
        state.putPool(pool.withStatus(to));
        return Receipt.of(to, LedgerEvents.poolStatusChanged(eventType, poolId, now));
    }

    public Pool requirePool(long poolId) {
        return state.pool(poolId)
                .orElseThrow(() -> new StakingException(StakingError.POOL_NOT_FOUND, "Unknown pool " + poolId));
    }

    /** Pool that currently takes deposits and compounds, or {@code PoolInactive}. */
    public Pool requireAcceptingPool(long poolId, long now) {
        Pool pool = requirePool(poolId);
        if (!pool.isAcceptingStake(now)) {
            throw new StakingException(StakingError.POOL_INACTIVE,
                    "Pool " + poolId + " is not accepting stake (" + pool.status() + ")");
        }
        return pool;
    }

    public Optional<Pool> getPool(long poolId) {
        return state.pool(poolId);
    }

    public List<Pool> listPools() {
        return state.pools();
    }

    public void requireOperator(String caller) {
        if (caller == null || !state.operator().equals(caller)) {
            throw new StakingException(StakingError.NOT_AUTHORIZED, "Caller " + caller + " is not the operator");
        }
    }
}
