package io.staking.core.node;

import io.staking.core.protocol.Tier;
import io.staking.core.protocol.TierBenefit;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/** Simple config holder for a local staking node. */
public final class NodeConfig {
    public final String operator;
    public final String custodyAccount;
    public final boolean loyaltyEnabled;
    /** Installed at start through the operator bootstrap call; null keeps the built-in defaults. */
    public final Map<Tier, TierBenefit> tierBenefits;
    public final Map<String, Long> initialBalances;

    public NodeConfig(String operator, String custodyAccount, boolean loyaltyEnabled,
                      Map<Tier, TierBenefit> tierBenefits, Map<String, Long> initialBalances) {
        this.operator = operator;
        this.custodyAccount = custodyAccount;
        this.loyaltyEnabled = loyaltyEnabled;
        this.tierBenefits = tierBenefits == null ? null : Collections.unmodifiableMap(new HashMap<>(tierBenefits));
        this.initialBalances = initialBalances == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(initialBalances));
    }

    public static NodeConfig defaultLocal() {
        Map<String, Long> balances = new HashMap<String, Long>();
        balances.put("operator", 1_000_000_000_000L);
        balances.put("alice",       100_000_000_000L);
        balances.put("bob",          50_000_000_000L);
        return new NodeConfig(
                "operator",          // admin identity for pool management
                "staking-custody",   // holds principal and reward balances
                true,                // loyalty program on
                null,                // built-in tier benefits
                balances
        );
    }

    public NodeConfig withOperator(String operator) {
        return new NodeConfig(operator, custodyAccount, loyaltyEnabled, tierBenefits, initialBalances);
    }

    public NodeConfig withLoyaltyEnabled(boolean enabled) {
        return new NodeConfig(operator, custodyAccount, enabled, tierBenefits, initialBalances);
    }

    public NodeConfig withTierBenefits(Map<Tier, TierBenefit> benefits) {
        return new NodeConfig(operator, custodyAccount, loyaltyEnabled, benefits, initialBalances);
    }

    public NodeConfig withInitialBalances(Map<String, Long> balances) {
        return new NodeConfig(operator, custodyAccount, loyaltyEnabled, tierBenefits, balances);
    }
}
