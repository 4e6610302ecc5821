package io.staking.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

public final class FeeMetrics {
    private static final DistributionSummary rewardFees;
    private static final DistributionSummary penalties;
    private static final Counter tierBonuses;

    static {
        MeterRegistry registry = LedgerMetrics.registry();
        rewardFees = DistributionSummary.builder("ledger.fees.reward")
                .baseUnit("minor")
                .description("Reward fees routed to the operator")
                .register(registry);
        penalties = DistributionSummary.builder("ledger.fees.early_withdrawal")
                .baseUnit("minor")
                .description("Early-withdrawal penalties routed to the operator")
                .register(registry);
        tierBonuses = Counter.builder("ledger.tier.bonus")
                .baseUnit("minor")
                .description("Loyalty bonus paid on top of base rewards")
                .register(registry);
    }

    private FeeMetrics() {}

    public static void recordRewardFee(long amountMinor) {
        if (amountMinor > 0) rewardFees.record(amountMinor);
    }

    public static void recordPenalty(long amountMinor) {
        if (amountMinor > 0) penalties.record(amountMinor);
    }

    public static void recordTierBonus(long amountMinor) {
        if (amountMinor > 0) tierBonuses.increment(amountMinor);
    }
}
