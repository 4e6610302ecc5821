package io.staking.core.stake;

import io.staking.core.events.LedgerEvents;
import io.staking.core.pool.PoolRegistry;
import io.staking.core.protocol.Receipt;
import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;
import io.staking.core.protocol.Tier;
import io.staking.core.state.InMemoryValueTransfer;
import io.staking.core.state.LedgerState;
import io.staking.core.tier.TierEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class CooldownStateMachineTest {

    private static final long DAY = Tier.SECONDS_PER_DAY;
    private static final long T0 = 1_700_000_000L;

    private final LedgerState state = new LedgerState("operator", "staking-custody", true);
    private final InMemoryValueTransfer transfers = new InMemoryValueTransfer();
    private final PoolRegistry pools = new PoolRegistry(state, transfers);
    private final StakeLedger stakes = new StakeLedger(state, pools, new TierEngine(state), transfers);
    private final CooldownStateMachine cooldowns = new CooldownStateMachine(state, pools);
    private long poolId;

    @BeforeEach
    void setUp() {
        transfers.setBalance("alice", 100_000_000L);
        poolId = pools.createPool("operator", "Core", 500, 1_000_000, 7 * DAY, DAY, OptionalLong.empty(), T0).value();
        stakes.deposit("alice", poolId, 10_000_000L, T0);
    }

    @Test
    void walksLockedUnlockedPendingWithdrawable() {
        assertEquals(CooldownState.LOCKED, cooldowns.cooldownState("alice", poolId, T0 + 7 * DAY - 1));
        assertEquals(CooldownState.UNLOCKED, cooldowns.cooldownState("alice", poolId, T0 + 7 * DAY));

        Receipt<Long> r = cooldowns.startCooldown("alice", poolId, T0 + 7 * DAY);
        assertEquals(T0 + 8 * DAY, r.value());
        assertEquals(LedgerEvents.COOLDOWN_STARTED, r.events().get(0).type());
        assertEquals(T0 + 8 * DAY, r.events().get(0).getLong("cooldown-ends"));

        assertEquals(CooldownState.COOLDOWN_PENDING, cooldowns.cooldownState("alice", poolId, T0 + 8 * DAY - 1));
        assertEquals(CooldownState.WITHDRAWABLE, cooldowns.cooldownState("alice", poolId, T0 + 8 * DAY));
    }

    @Test
    void cooldownCannotStartWhileLocked() {
        StakingException e = assertThrows(StakingException.class,
                () -> cooldowns.startCooldown("alice", poolId, T0 + DAY));
        assertEquals(StakingError.COOLDOWN_ACTIVE, e.error());
        assertTrue(stakes.getPosition(poolId, "alice").orElseThrow().cooldownStart().isEmpty());
    }

    @Test
    void cooldownCannotRestart() {
        cooldowns.startCooldown("alice", poolId, T0 + 7 * DAY);

        StakingException pending = assertThrows(StakingException.class,
                () -> cooldowns.startCooldown("alice", poolId, T0 + 7 * DAY + 5));
        assertEquals(StakingError.COOLDOWN_ACTIVE, pending.error());

        StakingException done = assertThrows(StakingException.class,
                () -> cooldowns.startCooldown("alice", poolId, T0 + 9 * DAY));
        assertEquals(StakingError.COOLDOWN_ACTIVE, done.error());
    }

    @Test
    void partialWithdrawalClearsCooldown() {
        cooldowns.startCooldown("alice", poolId, T0 + 7 * DAY);
        stakes.withdraw("alice", poolId, 4_000_000L, T0 + 8 * DAY);

        assertTrue(stakes.getPosition(poolId, "alice").orElseThrow().cooldownStart().isEmpty());
        assertEquals(CooldownState.UNLOCKED, cooldowns.cooldownState("alice", poolId, T0 + 8 * DAY));
    }

    @Test
    void topUpRelocksAndClearsCooldown() {
        cooldowns.startCooldown("alice", poolId, T0 + 7 * DAY);
        stakes.deposit("alice", poolId, 1_000_000L, T0 + 7 * DAY + 60);

        assertEquals(CooldownState.LOCKED, cooldowns.cooldownState("alice", poolId, T0 + 8 * DAY));
        assertTrue(stakes.getPosition(poolId, "alice").orElseThrow().cooldownStart().isEmpty());
    }

    @Test
    void zeroCooldownIsImmediatelyWithdrawable() {
        long instant = pools.createPool("operator", "Instant", 500, 0, 0, 0, OptionalLong.empty(), T0).value();
        stakes.deposit("alice", instant, 1_000L, T0);

        assertEquals(T0 + 10, cooldowns.startCooldown("alice", instant, T0 + 10).value());
        assertEquals(CooldownState.WITHDRAWABLE, cooldowns.cooldownState("alice", instant, T0 + 10));
    }

    @Test
    void cooldownEndSaturates() {
        long forever = pools.createPool("operator", "Forever", 500, 0, 0, Long.MAX_VALUE,
                OptionalLong.empty(), T0).value();
        stakes.deposit("alice", forever, 1_000L, T0);

        assertEquals(Long.MAX_VALUE, cooldowns.startCooldown("alice", forever, T0).value());
        assertEquals(CooldownState.COOLDOWN_PENDING, cooldowns.cooldownState("alice", forever, T0 + 365 * DAY));
    }

    @Test
    void unknownPositionOrPool() {
        StakingException position = assertThrows(StakingException.class,
                () -> cooldowns.startCooldown("bob", poolId, T0 + 7 * DAY));
        assertEquals(StakingError.POSITION_NOT_FOUND, position.error());

        StakingException pool = assertThrows(StakingException.class,
                () -> cooldowns.cooldownState("alice", 42L, T0));
        assertEquals(StakingError.POOL_NOT_FOUND, pool.error());
    }
}
