package io.staking.core.state;

import io.staking.core.protocol.LoyaltyTierRecord;
import io.staking.core.protocol.Pool;
import io.staking.core.protocol.PositionKey;
import io.staking.core.protocol.StakePosition;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;
import io.staking.core.protocol.UserStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * All mutable ledger state in one place: pools, positions, per-user totals,
 * loyalty records and protocol counters. One instance is created per node and
 * handed to each component; nothing is kept in static fields.
 *
 * Not thread-safe. Callers serialize access (see StakingNode).
 */
public final class LedgerState {

    private final String operator;
    private final String custodyAccount;

    private final Map<Long, Pool> pools = new TreeMap<>();
    private final Map<PositionKey, StakePosition> positions = new HashMap<>();
    private final Map<String, UserStats> users = new HashMap<>();
    private final Map<PositionKey, LoyaltyTierRecord> tierRecords = new HashMap<>();
    private final EnumMap<Tier, TierBenefit> tierBenefits = new EnumMap<>(Tier.class);

    private boolean tierBenefitsInitialized;
    private boolean loyaltyEnabled;
    private long lastPoolId;
    private long totalStaked;
    private long totalRewardsPaid;
    private long totalFeesCollected;
    private long tierUpgrades;

    public LedgerState(String operator, String custodyAccount, boolean loyaltyEnabled) {
        if (operator == null || operator.isBlank()) throw new IllegalArgumentException("operator required");
        if (custodyAccount == null || custodyAccount.isBlank()) throw new IllegalArgumentException("custody account required");
        if (operator.equals(custodyAccount)) throw new IllegalArgumentException("operator == custody account");
        this.operator = operator;
        this.custodyAccount = custodyAccount;
        this.loyaltyEnabled = loyaltyEnabled;
        for (Tier tier : Tier.values()) {
            tierBenefits.put(tier, tier.defaultBenefit());
        }
    }

    public String operator() { return operator; }
    public String custodyAccount() { return custodyAccount; }

    // -------------------- pools --------------------

    public long nextPoolId() {
        return ++lastPoolId;
    }

    public long poolCount() {
        return lastPoolId;
    }

    public Optional<Pool> pool(long poolId) {
        return Optional.ofNullable(pools.get(poolId));
    }

    public void putPool(Pool pool) {
        pools.put(pool.id(), pool);
    }

    public List<Pool> pools() {
        return List.copyOf(pools.values());
    }

    // -------------------- positions --------------------

    public Optional<StakePosition> position(PositionKey key) {
        return Optional.ofNullable(positions.get(key));
    }

    public void putPosition(PositionKey key, StakePosition position) {
        positions.put(key, Objects.requireNonNull(position, "position"));
    }

    public void removePosition(PositionKey key) {
        positions.remove(key);
    }

    public List<StakePosition> positionsInPool(long poolId) {
        List<StakePosition> out = new ArrayList<>();
        for (Map.Entry<PositionKey, StakePosition> e : positions.entrySet()) {
            if (e.getKey().poolId() == poolId) {
                out.add(e.getValue());
            }
        }
        return out;
    }

    /** Distinct stakers holding at least one live position. */
    public long activeStakerCount() {
        Set<String> stakers = new HashSet<>();
        for (PositionKey key : positions.keySet()) {
            stakers.add(key.staker());
        }
        return stakers.size();
    }

    // -------------------- users --------------------

    public Optional<UserStats> user(String staker) {
        return Optional.ofNullable(users.get(staker));
    }

    public void putUser(String staker, UserStats stats) {
        users.put(staker, Objects.requireNonNull(stats, "stats"));
    }

    // -------------------- loyalty --------------------

    public Optional<LoyaltyTierRecord> tierRecord(PositionKey key) {
        return Optional.ofNullable(tierRecords.get(key));
    }

    public void putTierRecord(PositionKey key, LoyaltyTierRecord record) {
        tierRecords.put(key, Objects.requireNonNull(record, "record"));
    }

    public void removeTierRecord(PositionKey key) {
        tierRecords.remove(key);
    }

    public TierBenefit tierBenefit(Tier tier) {
        return tierBenefits.get(tier);
    }

    public Map<Tier, TierBenefit> tierBenefits() {
        return Collections.unmodifiableMap(new EnumMap<>(tierBenefits));
    }

    public void installTierBenefits(Map<Tier, TierBenefit> benefits) {
        tierBenefits.putAll(benefits);
        tierBenefitsInitialized = true;
    }

    public boolean tierBenefitsInitialized() { return tierBenefitsInitialized; }

    public boolean loyaltyEnabled() { return loyaltyEnabled; }
    public void setLoyaltyEnabled(boolean enabled) { this.loyaltyEnabled = enabled; }

    // -------------------- protocol counters --------------------

    public long totalStaked() { return totalStaked; }
    public long totalRewardsPaid() { return totalRewardsPaid; }
    public long totalFeesCollected() { return totalFeesCollected; }
    public long tierUpgrades() { return tierUpgrades; }

    public void addStaked(long delta) {
        totalStaked = Math.addExact(totalStaked, delta);
    }

    public void addRewardsPaid(long amount) {
        totalRewardsPaid = Math.addExact(totalRewardsPaid, amount);
    }

    public void addFeesCollected(long amount) {
        totalFeesCollected = Math.addExact(totalFeesCollected, amount);
    }

    public void incrementTierUpgrades() {
        tierUpgrades++;
    }
}
