package io.staking.core.protocol;

import java.util.Locale;

/**
 * Error kinds surfaced by ledger operations.
 * Numeric codes start at 23001 and are stable on the wire.
 */
public enum StakingError {
    NOT_AUTHORIZED(23001),
    POOL_NOT_FOUND(23002),
    INVALID_AMOUNT(23003),
    INSUFFICIENT_STAKE(23004),
    COOLDOWN_ACTIVE(23005),
    POOL_INACTIVE(23006),
    NO_REWARDS(23007),
    POSITION_NOT_FOUND(23008),
    INVALID_PARAMETER(23009),
    TRANSFER_FAILED(23010),
    LOYALTY_DISABLED(23011),
    ALREADY_INITIALIZED(23012);

    private final int code;

    StakingError(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Lower-case wire name, e.g. {@code cooldown_active}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
