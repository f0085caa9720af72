package com.metersentinel.core.model;

/**
 * Coarse severity bucket derived from a numeric score in {@code [0, 100]}.
 *
 * <p>
 * Declaration order is significant: later constants are more severe.
 * </p>
 *
 * @since 1.0.0
 */
public enum SeverityTier {

    LOW,
    MEDIUM,
    CRITICAL;

    /**
     * Map a score onto a tier.
     *
     * @param score          numeric score
     * @param criticalScore  minimum score for {@link #CRITICAL}
     * @param mediumScore    minimum score for {@link #MEDIUM}
     * @return matching tier
     */
    public static SeverityTier fromScore(double score, double criticalScore, double mediumScore) {
        if (score >= criticalScore) {
            return CRITICAL;
        }
        if (score >= mediumScore) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * @param other tier to compare against
     * @return {@code true} if this tier is at least as severe as {@code other}
     */
    public boolean isAtLeast(SeverityTier other) {
        return compareTo(other) >= 0;
    }
}
