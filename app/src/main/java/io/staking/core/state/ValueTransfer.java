package io.staking.core.state;

import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;

import java.util.List;
import java.util.Objects;

/**
 * External value movement between accounts. The ledger never mutates its own
 * state before the transfers of an operation have gone through.
 */
public interface ValueTransfer {

    record Transfer(String from, String to, long amount) {
        public Transfer {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            if (amount < 0) throw new IllegalArgumentException("amount must be >= 0");
        }

        Transfer reversed() {
            return new Transfer(to, from, amount);
        }
    }

    long getBalance(String account);

    /** Move value; throws {@link StakingException} with {@code TRANSFER_FAILED} when it cannot. */
    void applyTransfer(Transfer transfer);

    /** Undo a transfer previously applied (inverse of applyTransfer). */
    void revertTransfer(Transfer transfer);

    /** Credit an account out of thin air (bootstrap funding only). */
    void credit(String account, long amount);

    /**
     * Apply all transfers or none: when one leg fails the legs already applied
     * are reverted in reverse order and the original failure is rethrown.
     */
    default void applyBatch(List<Transfer> transfers) {
        int applied = 0;
        try {
            for (Transfer t : transfers) {
                if (t.amount() == 0) {
                    applied++;
                    continue;
                }
                applyTransfer(t);
                applied++;
            }
        } catch (RuntimeException e) {
            for (int i = applied - 1; i >= 0; i--) {
                Transfer t = transfers.get(i);
                if (t.amount() == 0) {
                    continue;
                }
                try {
                    revertTransfer(t);
                } catch (RuntimeException revertFailure) {
                    e.addSuppressed(revertFailure);
                }
            }
            if (e instanceof StakingException) {
                throw e;
            }
            throw new StakingException(StakingError.TRANSFER_FAILED, "Value transfer aborted: " + e.getMessage(), e);
        }
    }
}
