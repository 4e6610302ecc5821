package io.staking.core.stake;

/** Withdrawal readiness of a position. */
public enum CooldownState {
    /** Before unlock time. Only an early exit (penalised) is possible. */
    LOCKED,
    /** Lock elapsed, no cooldown running. */
    UNLOCKED,
    COOLDOWN_PENDING,
    WITHDRAWABLE
}
