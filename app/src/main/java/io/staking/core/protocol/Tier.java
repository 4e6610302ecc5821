package io.staking.core.protocol;

import java.util.Locale;

/**
 * Loyalty tiers, ordered by the continuous staking duration they require.
 */
public enum Tier {
    BRONZE(0, "Bronze", 0),
    SILVER(1, "Silver", 30),
    GOLD(2, "Gold", 90),
    PLATINUM(3, "Platinum", 180);

    public static final long SECONDS_PER_DAY = 86_400L;

    private final int level;
    private final String displayName;
    private final long minDays;

    Tier(int level, String displayName, long minDays) {
        this.level = level;
        this.displayName = displayName;
        this.minDays = minDays;
    }

    public int level() {
        return level;
    }

    public String displayName() {
        return displayName;
    }

    public long minDays() {
        return minDays;
    }

    public boolean isAbove(Tier other) {
        return level > other.level;
    }

    /** Bronze below 30 days, Silver [30, 90), Gold [90, 180), Platinum from 180. */
    public static Tier forDays(long elapsedDays) {
        if (elapsedDays >= PLATINUM.minDays) return PLATINUM;
        if (elapsedDays >= GOLD.minDays) return GOLD;
        if (elapsedDays >= SILVER.minDays) return SILVER;
        return BRONZE;
    }

    public static Tier forDuration(long elapsedSeconds) {
        return forDays(Math.max(0L, elapsedSeconds) / SECONDS_PER_DAY);
    }

    /** Benefits that apply until an operator installs its own table. */
    public TierBenefit defaultBenefit() {
        return switch (this) {
            case BRONZE -> new TierBenefit(displayName, 0, 0, minDays);
            case SILVER -> new TierBenefit(displayName, 500, 1_000, minDays);
            case GOLD -> new TierBenefit(displayName, 1_000, 2_500, minDays);
            case PLATINUM -> new TierBenefit(displayName, 2_000, 5_000, minDays);
        };
    }

    public static Tier fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Tier name required");
        }
        return Tier.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
