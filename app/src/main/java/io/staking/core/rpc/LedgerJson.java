package io.staking.core.rpc;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.staking.core.events.EventCodec;
import io.staking.core.events.LedgerEvent;
import io.staking.core.protocol.LoyaltyTierRecord;
import io.staking.core.protocol.Pool;
import io.staking.core.protocol.ProtocolStats;
import io.staking.core.protocol.StakePosition;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;
import io.staking.core.protocol.UserStats;
import io.staking.core.storage.EventJournal.JournalEntry;
import io.staking.core.tier.TierEngine.TierInfo;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Response bodies for the RPC surface. */
final class LedgerJson {
    private LedgerJson() {}

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static ObjectNode pool(Pool pool) {
        ObjectNode n = NODES.objectNode();
        n.put("id", pool.id());
        n.put("name", pool.name());
        n.put("dailyRateBps", pool.dailyRateBps());
        n.put("minStake", pool.minStake());
        n.put("lockPeriod", pool.lockPeriod());
        n.put("cooldownPeriod", pool.cooldownPeriod());
        n.put("totalStaked", pool.totalStaked());
        n.put("totalRewardsPaid", pool.totalRewardsPaid());
        n.put("stakerCount", pool.stakerCount());
        n.put("createdAt", pool.createdAt());
        if (pool.endsAt().isPresent()) {
            n.put("endsAt", pool.endsAt().getAsLong());
        } else {
            n.putNull("endsAt");
        }
        n.put("status", pool.status().name().toLowerCase(Locale.ROOT));
        n.put("rewardPoolBalance", pool.rewardPoolBalance());
        return n;
    }

    static ObjectNode pools(List<Pool> pools) {
        ArrayNode array = NODES.arrayNode();
        for (Pool p : pools) {
            array.add(pool(p));
        }
        ObjectNode n = NODES.objectNode();
        n.set("pools", array);
        return n;
    }

    static ObjectNode position(long poolId, String staker, StakePosition position) {
        ObjectNode n = NODES.objectNode();
        n.put("poolId", poolId);
        n.put("staker", staker);
        n.put("amount", position.amount());
        n.put("stakedAt", position.stakedAt());
        n.put("lastClaim", position.lastClaim());
        n.put("totalEarned", position.totalEarned());
        n.put("unlockTime", position.unlockTime());
        if (position.cooldownStart().isPresent()) {
            n.put("cooldownStart", position.cooldownStart().getAsLong());
        } else {
            n.putNull("cooldownStart");
        }
        return n;
    }

    static ObjectNode userStats(String staker, UserStats stats) {
        ObjectNode n = NODES.objectNode();
        n.put("staker", staker);
        n.put("totalStaked", stats.totalStaked());
        n.put("totalRewardsEarned", stats.totalRewardsEarned());
        n.put("totalFeesPaid", stats.totalFeesPaid());
        n.put("poolsJoined", stats.poolsJoined());
        n.put("firstStakeAt", stats.firstStakeAt());
        n.put("lastActivityAt", stats.lastActivityAt());
        return n;
    }

    /** Hyphenated member names, as the indexer reads them. */
    static ObjectNode protocolStats(ProtocolStats stats) {
        ObjectNode n = NODES.objectNode();
        n.put("total-pools", stats.totalPools());
        n.put("active-pools", stats.activePools());
        n.put("total-staked", stats.totalStaked());
        n.put("total-stakers", stats.totalStakers());
        n.put("total-rewards-paid", stats.totalRewardsPaid());
        n.put("total-fees-collected", stats.totalFeesCollected());
        n.put("tier-upgrades", stats.tierUpgrades());
        return n;
    }

    static ObjectNode benefit(TierBenefit benefit) {
        ObjectNode n = NODES.objectNode();
        n.put("displayName", benefit.displayName());
        n.put("rewardBonusBps", benefit.rewardBonusBps());
        n.put("feeDiscountBps", benefit.feeDiscountBps());
        n.put("minDaysStaked", benefit.minDaysStaked());
        return n;
    }

    static ObjectNode tierBenefits(Map<Tier, TierBenefit> benefits) {
        ObjectNode n = NODES.objectNode();
        for (Tier tier : Tier.values()) {
            TierBenefit b = benefits.get(tier);
            if (b != null) {
                n.set(tier.name().toLowerCase(Locale.ROOT), benefit(b));
            }
        }
        return n;
    }

    static ObjectNode tierInfo(long poolId, String staker, TierInfo info) {
        ObjectNode n = NODES.objectNode();
        n.put("poolId", poolId);
        n.put("staker", staker);
        n.put("liveTier", info.liveTier().level());
        n.put("liveTierName", info.liveTier().displayName());
        n.set("benefit", benefit(info.benefit()));
        if (info.record().isPresent()) {
            LoyaltyTierRecord r = info.record().get();
            ObjectNode rec = n.putObject("record");
            rec.put("currentTier", r.currentTier().level());
            rec.put("achievedAt", r.achievedAt());
            rec.put("totalBonusEarned", r.totalBonusEarned());
            rec.put("totalFeeDiscount", r.totalFeeDiscount());
            rec.put("lastCheckedAt", r.lastCheckedAt());
        } else {
            n.putNull("record");
        }
        return n;
    }

    static ArrayNode events(List<LedgerEvent> events) {
        ArrayNode array = NODES.arrayNode();
        for (LedgerEvent e : events) {
            array.add(EventCodec.toJson(e));
        }
        return array;
    }

    static ObjectNode journalPage(List<JournalEntry> entries, long lastSequence) {
        ArrayNode array = NODES.arrayNode();
        for (JournalEntry entry : entries) {
            ObjectNode e = EventCodec.toJson(entry.event());
            e.put("sequence", entry.sequence());
            array.add(e);
        }
        ObjectNode n = NODES.objectNode();
        n.put("lastSequence", lastSequence);
        n.set("events", array);
        return n;
    }
}
