package io.staking.core.protocol;

import java.util.Objects;

/** Identifies one staker's position within one pool. */
public record PositionKey(long poolId, String staker) {
    public PositionKey {
        Objects.requireNonNull(staker, "staker");
    }

    @Override
    public String toString() {
        return "pool#" + poolId + "/" + staker;
    }
}
