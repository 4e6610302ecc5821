package io.staking.core.protocol;

import java.util.Objects;

/**
 * Raised when an operation fails a precondition. Thrown before any state is
 * mutated, so a caught exception always means "nothing happened".
 */
public final class StakingException extends RuntimeException {

    private final StakingError error;

    public StakingException(StakingError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public StakingException(StakingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public StakingError error() {
        return error;
    }

    @Override
    public String toString() {
        return "ERR[" + error + "/" + error.code() + "]: " + getMessage();
    }
}
