package io.staking.core.stake;

import io.staking.core.events.LedgerEvents;
import io.staking.core.pool.PoolRegistry;
import io.staking.core.protocol.Pool;
import io.staking.core.protocol.PositionKey;
import io.staking.core.protocol.Receipt;
import io.staking.core.protocol.StakePosition;
import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;
import io.staking.core.state.LedgerState;

/**
 * Locked -> Unlocked -> CooldownPending -> Withdrawable.
 * Top-ups and partial withdrawals drop back to Locked or Unlocked by clearing
 * the cooldown start; early exits never pass through here.
 */
public final class CooldownStateMachine {

    private final LedgerState state;
    private final PoolRegistry pools;

    public CooldownStateMachine(LedgerState state, PoolRegistry pools) {
        this.state = state;
        this.pools = pools;
    }

    public static CooldownState stateOf(Pool pool, StakePosition position, long now) {
        if (position.isLocked(now)) {
            return CooldownState.LOCKED;
        }
        if (position.cooldownStart().isEmpty()) {
            return CooldownState.UNLOCKED;
        }
        long ends = cooldownEnds(pool, position.cooldownStart().getAsLong());
        return now < ends ? CooldownState.COOLDOWN_PENDING : CooldownState.WITHDRAWABLE;
    }

    /** Legal only from UNLOCKED. Returns the time the cooldown completes. */
    public Receipt<Long> startCooldown(String staker, long poolId, long now) {
        Pool pool = pools.requirePool(poolId);
        PositionKey key = new PositionKey(poolId, staker);
        StakePosition position = state.position(key)
                .orElseThrow(() -> new StakingException(StakingError.POSITION_NOT_FOUND, "No position for " + key));

        CooldownState current = stateOf(pool, position, now);
        switch (current) {
            case LOCKED:
                throw new StakingException(StakingError.COOLDOWN_ACTIVE,
                        "Position " + key + " is locked until " + position.unlockTime());
            case COOLDOWN_PENDING:
            case WITHDRAWABLE:
                throw new StakingException(StakingError.COOLDOWN_ACTIVE,
                        "Cooldown already started for " + key);
            default:
                break;
        }

        long ends = cooldownEnds(pool, now);
        state.putPosition(key, position.coolingFrom(now));
        return Receipt.of(ends, LedgerEvents.cooldownStarted(poolId, staker, ends, now));
    }

    public CooldownState cooldownState(String staker, long poolId, long now) {
        Pool pool = pools.requirePool(poolId);
        PositionKey key = new PositionKey(poolId, staker);
        StakePosition position = state.position(key)
                .orElseThrow(() -> new StakingException(StakingError.POSITION_NOT_FOUND, "No position for " + key));
        return stateOf(pool, position, now);
    }

    private static long cooldownEnds(Pool pool, long start) {
        long period = pool.cooldownPeriod();
        return period > Long.MAX_VALUE - start ? Long.MAX_VALUE : start + period;
    }
}
