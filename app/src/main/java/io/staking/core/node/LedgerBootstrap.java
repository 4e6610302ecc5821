package io.staking.core.node;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;
import io.staking.core.state.ValueTransfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Seeds account balances and reads the tier benefit table.
 *
 * Benefit file format, one object per tier keyed by tier name:
 * <pre>
 * { "silver": { "rewardBonusBps": 500, "feeDiscountBps": 1000, "minDaysStaked": 30 }, ... }
 * </pre>
 * Tiers missing from the file keep their defaults.
 */
public final class LedgerBootstrap {
    private LedgerBootstrap() {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Credit initial balances into the value-transfer ledger. */
    public static void seedBalances(ValueTransfer transfers, Map<String, Long> balances) {
        if (balances == null || balances.isEmpty()) return;
        for (Map.Entry<String, Long> e : balances.entrySet()) {
            long amount = e.getValue() == null ? 0L : e.getValue();
            if (amount < 0) {
                throw new IllegalArgumentException("Negative initial balance for " + e.getKey());
            }
            transfers.credit(e.getKey(), amount);
        }
    }

    public static Map<Tier, TierBenefit> loadTierBenefits(Path file) {
        try {
            return parseTierBenefits(MAPPER.readTree(Files.readAllBytes(file)));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read tier benefits from " + file, e);
        }
    }

    public static Map<Tier, TierBenefit> parseTierBenefits(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Tier benefits must be a JSON object");
        }
        EnumMap<Tier, TierBenefit> out = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            out.put(tier, tier.defaultBenefit());
        }
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            Tier tier = Tier.fromName(e.getKey());
            JsonNode node = e.getValue();
            TierBenefit fallback = out.get(tier);
            out.put(tier, new TierBenefit(
                    node.path("displayName").asText(fallback.displayName()),
                    node.path("rewardBonusBps").asLong(fallback.rewardBonusBps()),
                    node.path("feeDiscountBps").asLong(fallback.feeDiscountBps()),
                    node.path("minDaysStaked").asLong(fallback.minDaysStaked())));
        }
        return out;
    }
}
