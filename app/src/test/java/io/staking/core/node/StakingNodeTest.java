package io.staking.core.node;

import io.staking.core.clock.ManualClock;
import io.staking.core.events.EventSink;
import io.staking.core.events.LedgerEvent;
import io.staking.core.events.LedgerEvents;
import io.staking.core.metrics.LedgerMetrics;
import io.staking.core.protocol.Pool;
import io.staking.core.protocol.ProtocolStats;
import io.staking.core.protocol.StakePosition;
import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;
import io.staking.core.stake.CooldownState;
import io.staking.core.state.InMemoryValueTransfer;
import io.staking.core.storage.EventJournal;
import io.staking.core.storage.InMemoryEventJournal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class StakingNodeTest {

    private static final long DAY = Tier.SECONDS_PER_DAY;
    private static final long T0 = 1_700_000_000L;

    private final ManualClock clock = new ManualClock(T0);
    private StakingNode node;

    @AfterEach
    void tearDown() {
        if (node != null) {
            node.close();
        }
    }

    @Test
    void custodyAlwaysHoldsPrincipalPlusRewardBalances() {
        node = StakingNode.inMemory(NodeConfig.defaultLocal(), clock);
        node.start();

        long core = node.createPool("operator", "Core", 500, 1_000_000, 7 * DAY, DAY, OptionalLong.empty()).value();
        long side = node.createPool("operator", "Side", 100, 0, 0, 0, OptionalLong.of(90 * DAY)).value();
        node.fundRewardPool("operator", core, 1_000_000_000L);
        node.fundRewardPool("operator", side, 50_000_000L);
        node.deposit("alice", core, 10_000_000L);
        node.deposit("bob", core, 5_000_000L);
        node.deposit("bob", side, 2_000_000L);
        assertCustodyBalanced();

        clock.advance(DAY);
        node.claim("alice", core);
        node.withdraw("bob", core, 5_000_000L);
        node.compound("bob", side);
        assertCustodyBalanced();

        clock.advance(30 * DAY);
        node.claimWithTierBonus("alice", core);
        long ends = node.startCooldown("alice", core).value();
        clock.advance(ends - clock.now());
        assertEquals(CooldownState.WITHDRAWABLE, node.cooldownState("alice", core));
        node.withdraw("alice", core, 4_000_000L);
        assertCustodyBalanced();
    }

    @Test
    void committedEventsReachJournalInOrder() {
        node = StakingNode.inMemory(NodeConfig.defaultLocal(), clock);
        node.start();

        long id = node.createPool("operator", "Core", 500, 0, 0, 0, OptionalLong.empty()).value();
        node.fundRewardPool("operator", id, 1_000_000L);
        node.deposit("alice", id, 2_000_000L);

        EventJournal journal = node.journal();
        assertEquals(3L, journal.lastSequence());
        List<EventJournal.JournalEntry> entries = journal.readFrom(1, 10);
        assertEquals(LedgerEvents.POOL_CREATED, entries.get(0).event().type());
        assertEquals(LedgerEvents.POOL_FUNDED, entries.get(1).event().type());
        assertEquals(LedgerEvents.STAKE_DEPOSITED, entries.get(2).event().type());
        assertEquals(T0, entries.get(2).event().getLong("timestamp"));
    }

    @Test
    void rejectedOperationPublishesNothing() {
        node = StakingNode.inMemory(NodeConfig.defaultLocal(), clock);
        node.start();
        long id = node.createPool("operator", "Core", 500, 1_000_000, 0, 0, OptionalLong.empty()).value();
        double before = LedgerMetrics.operationCount("deposit", "invalid_amount");

        StakingException e = assertThrows(StakingException.class, () -> node.deposit("alice", id, 10L));

        assertEquals(StakingError.INVALID_AMOUNT, e.error());
        assertEquals(1L, node.journal().lastSequence());
        assertEquals(before + 1.0, LedgerMetrics.operationCount("deposit", "invalid_amount"));
    }

    @Test
    void failingSinkDoesNotFailTheOperation() {
        List<Integer> seen = new ArrayList<>();
        EventSink broken = events -> {
            throw new IllegalStateException("indexer offline");
        };
        EventSink counting = events -> seen.add(events.size());
        node = new StakingNode(NodeConfig.defaultLocal(), clock, new InMemoryValueTransfer(),
                new InMemoryEventJournal(), List.of(broken, counting));
        node.start();
        double before = LedgerMetrics.operationCount("create-pool", "ok");

        long id = node.createPool("operator", "Core", 500, 0, 0, 0, OptionalLong.empty()).value();

        assertTrue(node.getPool(id).isPresent());
        assertEquals(1L, node.journal().lastSequence());
        assertEquals(List.of(1), seen);
        assertEquals(before + 1.0, LedgerMetrics.operationCount("create-pool", "ok"));
    }

    @Test
    void journalFailurePropagatesAndSkipsExtraSinks() {
        List<Integer> seen = new ArrayList<>();
        InMemoryEventJournal backing = new InMemoryEventJournal();
        EventJournal broken = new EventJournal() {
            @Override
            public long append(List<LedgerEvent> events) {
                throw new IllegalStateException("disk full");
            }

            @Override
            public List<JournalEntry> readFrom(long fromSequence, int limit) {
                return backing.readFrom(fromSequence, limit);
            }

            @Override
            public long lastSequence() {
                return backing.lastSequence();
            }
        };
        node = new StakingNode(NodeConfig.defaultLocal(), clock, new InMemoryValueTransfer(),
                broken, List.of(events -> seen.add(events.size())));
        node.start();

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> node.createPool("operator", "Core", 500, 0, 0, 0, OptionalLong.empty()));

        assertEquals("disk full", e.getMessage());
        assertTrue(seen.isEmpty());
    }

    @Test
    void earlyExitOfLargeDepositPaysPenalty() {
        long huge = 20_000_000_000_000_000L;
        node = StakingNode.inMemory(NodeConfig.defaultLocal()
                .withInitialBalances(Map.of("operator", 1_000_000L, "whale", huge)), clock);
        node.start();
        long id = node.createPool("operator", "Core", 500, 0, 7 * DAY, DAY, OptionalLong.empty()).value();
        node.deposit("whale", id, huge);

        clock.advance(1);
        long net = node.withdraw("whale", id, huge).value();

        assertEquals(19_000_000_000_000_000L, net);
        assertEquals(net, node.balanceOf("whale"));
        assertEquals(1_000_000L + 1_000_000_000_000_000L, node.balanceOf("operator"));
        assertCustodyBalanced();
    }

    @Test
    void poolTotalsMatchSumOfPositionsThroughLifecycle() {
        node = StakingNode.inMemory(NodeConfig.defaultLocal(), clock);
        node.start();
        long core = node.createPool("operator", "Core", 500, 1_000_000, 7 * DAY, DAY, OptionalLong.empty()).value();
        long flex = node.createPool("operator", "Flex", 200, 0, 0, 0, OptionalLong.empty()).value();
        node.fundRewardPool("operator", core, 1_000_000_000L);
        node.fundRewardPool("operator", flex, 1_000_000_000L);

        node.deposit("alice", core, 10_000_000L);
        node.deposit("bob", core, 6_000_000L);
        node.deposit("alice", flex, 3_000_000L);
        assertPositionsBalanced();

        clock.advance(DAY);
        node.deposit("alice", core, 2_000_000L);
        node.compound("bob", core);
        node.compound("alice", flex);
        assertPositionsBalanced();

        clock.advance(DAY);
        node.withdraw("alice", core, 5_000_000L);
        long bobStake = node.getPosition(core, "bob").orElseThrow().amount();
        node.withdraw("bob", core, bobStake);
        assertTrue(node.getPosition(core, "bob").isEmpty());
        assertPositionsBalanced();

        long ends = node.startCooldown("alice", flex).value();
        clock.advance(ends - clock.now());
        long flexStake = node.getPosition(flex, "alice").orElseThrow().amount();
        node.withdraw("alice", flex, flexStake);
        assertTrue(node.positionsInPool(flex).isEmpty());
        assertEquals(0L, node.getPool(flex).orElseThrow().totalStaked());
        assertPositionsBalanced();
        assertCustodyBalanced();
    }

    @Test
    void protocolStatsAggregateAcrossPools() {
        node = StakingNode.inMemory(NodeConfig.defaultLocal(), clock);
        node.start();
        long a = node.createPool("operator", "A", 500, 0, 0, 0, OptionalLong.empty()).value();
        long b = node.createPool("operator", "B", 500, 0, 0, 0, OptionalLong.of(DAY)).value();
        long c = node.createPool("operator", "C", 500, 0, 0, 0, OptionalLong.empty()).value();
        node.fundRewardPool("operator", a, 1_000_000L);
        node.deposit("alice", a, 4_000_000L);
        node.deposit("alice", b, 1_000_000L);
        node.deposit("bob", a, 3_000_000L);
        node.pausePool("operator", c);

        clock.advance(DAY);
        node.claim("alice", a);
        ProtocolStats stats = node.protocolStats();

        assertEquals(3L, stats.totalPools());
        assertEquals(1L, stats.activePools());
        assertEquals(8_000_000L, stats.totalStaked());
        assertEquals(2L, stats.totalStakers());
        assertEquals(180_000L, stats.totalRewardsPaid());
        assertEquals(20_000L, stats.totalFeesCollected());
        assertEquals(0L, stats.tierUpgrades());
    }

    @Test
    void configuredBenefitsAreInstalledAtStart() {
        Map<Tier, TierBenefit> table = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            table.put(tier, new TierBenefit(tier.displayName(), 0, 0, tier.minDays()));
        }
        node = StakingNode.inMemory(NodeConfig.defaultLocal().withTierBenefits(table), clock);
        node.start();

        assertEquals(0L, node.tierBenefits().get(Tier.PLATINUM).feeDiscountBps());
        StakingException e = assertThrows(StakingException.class,
                () -> node.initializeTierBenefits("operator", table));
        assertEquals(StakingError.ALREADY_INITIALIZED, e.error());
    }

    @Test
    void loyaltyCanStartDisabled() {
        node = StakingNode.inMemory(NodeConfig.defaultLocal().withLoyaltyEnabled(false), clock);
        node.start();
        long id = node.createPool("operator", "Core", 500, 0, 0, 0, OptionalLong.empty()).value();
        node.fundRewardPool("operator", id, 1_000_000L);
        node.deposit("alice", id, 1_000_000L);
        clock.advance(DAY);

        StakingException e = assertThrows(StakingException.class, () -> node.claimWithTierBonus("alice", id));
        assertEquals(StakingError.LOYALTY_DISABLED, e.error());

        node.setLoyaltyEnabled("operator", true);
        assertEquals(45_000L, node.claimWithTierBonus("alice", id).value().netRewards());
    }

    private void assertPositionsBalanced() {
        for (Pool pool : node.listPools()) {
            long sum = 0;
            List<StakePosition> positions = node.positionsInPool(pool.id());
            for (StakePosition position : positions) {
                sum += position.amount();
            }
            assertEquals(pool.totalStaked(), sum, "pool " + pool.id());
            assertEquals(pool.stakerCount(), positions.size(), "pool " + pool.id());
        }
    }

    private void assertCustodyBalanced() {
        long expected = 0;
        long staked = 0;
        for (Pool pool : node.listPools()) {
            expected += pool.totalStaked() + pool.rewardPoolBalance();
            staked += pool.totalStaked();
        }
        assertEquals(expected, node.balanceOf(node.config().custodyAccount));
        assertEquals(staked, node.protocolStats().totalStaked());
    }
}
