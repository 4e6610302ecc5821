package io.staking.core.protocol;

public enum PoolStatus {
    ACTIVE,
    PAUSED,
    ENDED
}
