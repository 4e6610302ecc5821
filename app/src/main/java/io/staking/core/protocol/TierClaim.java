package io.staking.core.protocol;

/** Outcome of a loyalty-aware claim. */
public record TierClaim(long netRewards, long tierBonus, long feeDiscount, Tier tier) {
}
