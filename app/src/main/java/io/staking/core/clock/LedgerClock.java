package io.staking.core.clock;

/**
 * Time source for the ledger, in seconds. Implementations never go backwards.
 */
public interface LedgerClock {
    long now();
}
