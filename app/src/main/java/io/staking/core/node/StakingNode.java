package io.staking.core.node;

import io.staking.core.clock.LedgerClock;
import io.staking.core.events.EventSink;
import io.staking.core.events.LedgerEvent;
import io.staking.core.events.LedgerEvents;
import io.staking.core.events.LoggingEventSink;
import io.staking.core.metrics.FeeMetrics;
import io.staking.core.metrics.LedgerMetrics;
import io.staking.core.pool.PoolRegistry;
import io.staking.core.protocol.Pool;
import io.staking.core.protocol.PoolStatus;
import io.staking.core.protocol.ProtocolStats;
import io.staking.core.protocol.Receipt;
import io.staking.core.protocol.StakePosition;
import io.staking.core.protocol.StakingException;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;
import io.staking.core.protocol.TierClaim;
import io.staking.core.protocol.UserStats;
import io.staking.core.reward.RewardAccrualEngine;
import io.staking.core.stake.CooldownState;
import io.staking.core.stake.CooldownStateMachine;
import io.staking.core.stake.StakeLedger;
import io.staking.core.state.InMemoryValueTransfer;
import io.staking.core.state.LedgerState;
import io.staking.core.state.ValueTransfer;
import io.staking.core.storage.EventJournal;
import io.staking.core.storage.InMemoryEventJournal;
import io.staking.core.storage.RocksDBEventJournal;
import io.staking.core.tier.TierEngine;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.LongFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires ledger state, value transfer, the engines and the event sinks, and is
 * the single writer in front of them: every operation runs under the node's
 * monitor, reads the clock once, and publishes its events after it commits.
 */
public final class StakingNode implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(StakingNode.class.getName());

    private final NodeConfig config;
    private final LedgerClock clock;
    private final LedgerState state;
    private final ValueTransfer transfers;
    private final EventJournal journal;
    private final List<EventSink> sinks;

    private final PoolRegistry pools;
    private final TierEngine tiers;
    private final StakeLedger stakes;
    private final CooldownStateMachine cooldowns;
    private final RewardAccrualEngine rewards;

    public StakingNode(NodeConfig config, LedgerClock clock, ValueTransfer transfers,
                       EventJournal journal, List<EventSink> extraSinks) {
        this.config = config;
        this.clock = clock;
        this.transfers = transfers;
        this.journal = journal;
        this.state = new LedgerState(config.operator, config.custodyAccount, config.loyaltyEnabled);
        this.pools = new PoolRegistry(state, transfers);
        this.tiers = new TierEngine(state);
        this.stakes = new StakeLedger(state, pools, tiers, transfers);
        this.cooldowns = new CooldownStateMachine(state, pools);
        this.rewards = new RewardAccrualEngine(state, pools, tiers, transfers);
        this.sinks = extraSinks == null ? List.of() : List.copyOf(extraSinks);
    }

    /** Convenience factory for an in-memory local node. */
    public static StakingNode inMemory(NodeConfig config, LedgerClock clock) {
        return new StakingNode(config, clock, new InMemoryValueTransfer(), new InMemoryEventJournal(),
                List.of(new LoggingEventSink(Level.FINE)));
    }

    /** Convenience factory for a node journaling events to RocksDB. */
    public static StakingNode rocks(NodeConfig config, LedgerClock clock, String journalDir) {
        return new StakingNode(config, clock, new InMemoryValueTransfer(), RocksDBEventJournal.open(journalDir),
                List.of(new LoggingEventSink(Level.FINE)));
    }

    /** Seed balances and install configured tier benefits. Call once. */
    public synchronized void start() {
        LedgerBootstrap.seedBalances(transfers, config.initialBalances);
        if (config.tierBenefits != null) {
            initializeTierBenefits(config.operator, config.tierBenefits);
        }
        LOG.info(() -> "Staking node started: operator=" + config.operator
                + " custody=" + config.custodyAccount + " loyalty=" + state.loyaltyEnabled());
    }

    // -------------------- operator calls --------------------

    public Receipt<Long> createPool(String caller, String name, long dailyRateBps, long minStake,
                                    long lockPeriod, long cooldownPeriod, OptionalLong duration) {
        return execute("create-pool", now ->
                pools.createPool(caller, name, dailyRateBps, minStake, lockPeriod, cooldownPeriod, duration, now));
    }

    public Receipt<Long> fundRewardPool(String caller, long poolId, long amount) {
        return execute("fund-reward-pool", now -> pools.fundRewardPool(caller, poolId, amount, now));
    }

    public Receipt<PoolStatus> pausePool(String caller, long poolId) {
        return execute("pause-pool", now -> pools.pausePool(caller, poolId, now));
    }

    public Receipt<PoolStatus> resumePool(String caller, long poolId) {
        return execute("resume-pool", now -> pools.resumePool(caller, poolId, now));
    }

    public Receipt<PoolStatus> endPool(String caller, long poolId) {
        return execute("end-pool", now -> pools.endPool(caller, poolId, now));
    }

    public Receipt<Map<Tier, TierBenefit>> initializeTierBenefits(String caller, Map<Tier, TierBenefit> benefits) {
        return execute("initialize-tier-benefits", now -> tiers.initializeBenefits(caller, benefits));
    }

    public Receipt<Boolean> setLoyaltyEnabled(String caller, boolean enabled) {
        return execute("set-loyalty-enabled", now -> tiers.setLoyaltyEnabled(caller, enabled, now));
    }

    // -------------------- staker calls --------------------

    public Receipt<Long> deposit(String staker, long poolId, long amount) {
        return execute("deposit", now -> stakes.deposit(staker, poolId, amount, now));
    }

    public Receipt<Long> withdraw(String staker, long poolId, long amount) {
        Receipt<Long> receipt = execute("withdraw", now -> stakes.withdraw(staker, poolId, amount, now));
        FeeMetrics.recordPenalty(amount - receipt.value());
        return receipt;
    }

    public Receipt<Long> startCooldown(String staker, long poolId) {
        return execute("start-cooldown", now -> cooldowns.startCooldown(staker, poolId, now));
    }

    public Receipt<Long> claim(String staker, long poolId) {
        Receipt<Long> receipt = execute("claim", now -> rewards.claim(staker, poolId, now));
        recordFees(receipt.events());
        return receipt;
    }

    public Receipt<TierClaim> claimWithTierBonus(String staker, long poolId) {
        Receipt<TierClaim> receipt = execute("claim-with-tier-bonus",
                now -> rewards.claimWithTierBonus(staker, poolId, now));
        recordFees(receipt.events());
        FeeMetrics.recordTierBonus(receipt.value().tierBonus());
        return receipt;
    }

    public Receipt<Long> compound(String staker, long poolId) {
        Receipt<Long> receipt = execute("compound", now -> rewards.compound(staker, poolId, now));
        recordFees(receipt.events());
        return receipt;
    }

    public Receipt<Tier> checkAndUpgradeTier(String staker, long poolId) {
        return execute("check-and-upgrade-tier", now -> tiers.checkAndUpgradeTier(staker, poolId, now));
    }

    // -------------------- read queries --------------------

    public synchronized Optional<Pool> getPool(long poolId) {
        return pools.getPool(poolId);
    }

    public synchronized List<Pool> listPools() {
        return pools.listPools();
    }

    public synchronized Optional<StakePosition> getPosition(long poolId, String staker) {
        return stakes.getPosition(poolId, staker);
    }

    public synchronized List<StakePosition> positionsInPool(long poolId) {
        return stakes.positionsInPool(poolId);
    }

    public synchronized Optional<UserStats> getUserStats(String staker) {
        return stakes.getUserStats(staker);
    }

    public synchronized long votingPower(String staker) {
        return stakes.votingPower(staker);
    }

    public synchronized long pendingRewards(String staker, long poolId) {
        return rewards.pendingRewards(staker, poolId, clock.now());
    }

    public synchronized CooldownState cooldownState(String staker, long poolId) {
        return cooldowns.cooldownState(staker, poolId, clock.now());
    }

    public synchronized TierEngine.TierInfo tierInfo(String staker, long poolId) {
        return tiers.tierInfo(poolId, staker, clock.now());
    }

    public synchronized Map<Tier, TierBenefit> tierBenefits() {
        return state.tierBenefits();
    }

    public synchronized boolean loyaltyEnabled() {
        return state.loyaltyEnabled();
    }

    public synchronized ProtocolStats protocolStats() {
        long now = clock.now();
        long active = 0;
        for (Pool pool : state.pools()) {
            if (pool.isAcceptingStake(now)) active++;
        }
        return new ProtocolStats(state.poolCount(), active, state.totalStaked(), state.activeStakerCount(),
                state.totalRewardsPaid(), state.totalFeesCollected(), state.tierUpgrades());
    }

    public long balanceOf(String account) {
        return transfers.getBalance(account);
    }

    public EventJournal journal() { return journal; }
    public NodeConfig config() { return config; }
    public LedgerClock clock() { return clock; }

    /** Close the journal if it holds native resources (RocksDB). */
    @Override
    public void close() {
        if (journal instanceof AutoCloseable) {
            try {
                ((AutoCloseable) journal).close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close event journal", e);
            }
        }
    }

    // -------------------- internals --------------------

    private synchronized <T> Receipt<T> execute(String operation, LongFunction<Receipt<T>> body) {
        long now = clock.now();
        Receipt<T> receipt;
        try {
            receipt = LedgerMetrics.recordOperation(() -> body.apply(now));
        } catch (StakingException e) {
            LedgerMetrics.countOperation(operation, e.error().wireName());
            LOG.fine(() -> operation + " rejected: " + e);
            throw e;
        }
        LedgerMetrics.countOperation(operation, "ok");
        LOG.fine(() -> operation + " committed at " + now + " -> " + receipt.value());
        publish(receipt.events());
        return receipt;
    }

    /**
     * The journal is the indexer's source of truth, so an append failure
     * propagates. The extra sinks are best-effort.
     */
    private void publish(List<LedgerEvent> events) {
        if (events.isEmpty()) return;
        try {
            journal.append(events);
        } catch (IllegalStateException e) {
            LOG.log(Level.SEVERE, "Event journal append failed after commit", e);
            throw e;
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Event journal append failed after commit", e);
            throw new IllegalStateException("Event journal append failed: " + e.getMessage(), e);
        }
        for (EventSink sink : sinks) {
            try {
                sink.publish(events);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Event sink " + sink.getClass().getSimpleName() + " failed", e);
            }
        }
    }

    private static void recordFees(List<LedgerEvent> events) {
        for (LedgerEvent event : events) {
            if (LedgerEvents.FEE_COLLECTED.equals(event.type())) {
                FeeMetrics.recordRewardFee(event.getLong("amount"));
            }
        }
    }
}
