package io.staking.core.tier;

import io.staking.core.events.LedgerEvents;
import io.staking.core.fee.FeeEngine;
import io.staking.core.protocol.LoyaltyTierRecord;
import io.staking.core.protocol.PositionKey;
import io.staking.core.protocol.Receipt;
import io.staking.core.protocol.StakePosition;
import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;
import io.staking.core.state.LedgerState;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loyalty tiers: duration to tier mapping, per-position tier records and the
 * benefit table.
 *
 * Two notions of tier coexist. The live tier is recomputed from
 * {@code now - stakedAt} on every read and is what reward bonuses and fee
 * discounts use. The recorded tier is ratcheted by {@link #checkAndUpgradeTier}
 * and never goes down, even after a top-up restarts {@code stakedAt}.
 */
public final class TierEngine {

    private final LedgerState state;

    public TierEngine(LedgerState state) {
        this.state = state;
    }

    public static Tier tierForDuration(long elapsedDays) {
        return Tier.forDays(elapsedDays);
    }

    public static Tier liveTier(StakePosition position, long now) {
        return Tier.forDuration(now - position.stakedAt());
    }

    public TierBenefit benefitFor(Tier tier) {
        return state.tierBenefit(tier);
    }

    public long calculateTierBonus(long baseReward, Tier tier) {
        return FeeEngine.applyBps(baseReward, benefitFor(tier).rewardBonusBps());
    }

    public Optional<LoyaltyTierRecord> record(long poolId, String staker) {
        return state.tierRecord(new PositionKey(poolId, staker));
    }

    public TierInfo tierInfo(long poolId, String staker, long now) {
        PositionKey key = new PositionKey(poolId, staker);
        StakePosition position = state.position(key)
                .orElseThrow(() -> new StakingException(StakingError.POSITION_NOT_FOUND, "No position for " + key));
        Tier live = liveTier(position, now);
        return new TierInfo(live, benefitFor(live), state.tierRecord(key));
    }

    /**
     * Creates the record at the live tier, or raises it when the live tier is
     * higher. Never lowers it.
     */
    public Receipt<Tier> checkAndUpgradeTier(String staker, long poolId, long now) {
        PositionKey key = new PositionKey(poolId, staker);
        StakePosition position = state.position(key)
                .orElseThrow(() -> new StakingException(StakingError.POSITION_NOT_FOUND, "No position for " + key));
        return ratchet(key, liveTier(position, now), now);
    }

    /** Ratchet without re-validating; the caller has already resolved the position. */
    public Receipt<Tier> ratchet(PositionKey key, Tier live, long now) {
        Optional<LoyaltyTierRecord> existing = state.tierRecord(key);
        if (existing.isEmpty()) {
            state.putTierRecord(key, LoyaltyTierRecord.initial(live, now));
            return Receipt.of(live, LedgerEvents.tierInitialized(key.poolId(), key.staker(), live, now));
        }
        LoyaltyTierRecord record = existing.get();
        if (!live.isAbove(record.currentTier())) {
            state.putTierRecord(key, record.checkedAt(now));
            return Receipt.of(record.currentTier());
        }
        state.putTierRecord(key, record.upgradedTo(live, now));
        state.incrementTierUpgrades();
        return Receipt.of(live, LedgerEvents.tierUpgraded(key.poolId(), key.staker(), record.currentTier(), live, now));
    }

    /** Adds bonus and discount totals to an existing record. */
    public void accrueBenefits(PositionKey key, long bonus, long feeDiscount, long now) {
        LoyaltyTierRecord record = state.tierRecord(key)
                .orElseThrow(() -> new IllegalStateException("No tier record for " + key));
        state.putTierRecord(key, record.withBenefits(bonus, feeDiscount, now));
    }

    public void forget(PositionKey key) {
        state.removeTierRecord(key);
    }

    /** Operator bootstrap of the benefit table; allowed once. Every tier must be present. */
    public Receipt<Map<Tier, TierBenefit>> initializeBenefits(String caller, Map<Tier, TierBenefit> benefits) {
        requireOperator(caller);
        if (state.tierBenefitsInitialized()) {
            throw new StakingException(StakingError.ALREADY_INITIALIZED, "Tier benefits already initialized");
        }
        if (benefits == null) {
            throw new StakingException(StakingError.INVALID_PARAMETER, "Benefit table required");
        }
        EnumMap<Tier, TierBenefit> table = new EnumMap<>(Tier.class);
        List<Tier> missing = new ArrayList<>();
        for (Tier tier : Tier.values()) {
            TierBenefit b = benefits.get(tier);
            if (b == null) {
                missing.add(tier);
            } else {
                table.put(tier, b);
            }
        }
        if (!missing.isEmpty()) {
            throw new StakingException(StakingError.INVALID_PARAMETER, "Missing benefits for " + missing);
        }
        state.installTierBenefits(table);
        return Receipt.of(state.tierBenefits());
    }

    public Receipt<Boolean> setLoyaltyEnabled(String caller, boolean enabled, long now) {
        requireOperator(caller);
        state.setLoyaltyEnabled(enabled);
        return Receipt.of(enabled, LedgerEvents.loyaltyToggled(enabled, now));
    }

    public boolean loyaltyEnabled() {
        return state.loyaltyEnabled();
    }

    private void requireOperator(String caller) {
        if (!state.operator().equals(caller)) {
            throw new StakingException(StakingError.NOT_AUTHORIZED, "Caller " + caller + " is not the operator");
        }
    }

    /** Live tier and its benefits, plus the recorded tier if one exists. */
    public record TierInfo(Tier liveTier, TierBenefit benefit, Optional<LoyaltyTierRecord> record) {}
}
