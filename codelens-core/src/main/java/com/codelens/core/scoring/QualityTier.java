package com.codelens.core.scoring;

/**
 * Discrete quality level derived from a weighted score.
 */
public enum QualityTier {
    LOW,
    MEDIUM,
    HIGH;

    static final double HIGH_CUTOFF = 0.7;
    static final double MEDIUM_CUTOFF = 0.4;

    /**
     * Maps a combined score to its tier: {@code >= 0.7} is HIGH, {@code >= 0.4} is MEDIUM.
     *
     * @param score combined score
     * @return tier
     */
    public static QualityTier forScore(double score) {
        if (score >= HIGH_CUTOFF) {
            return HIGH;
        }
        if (score >= MEDIUM_CUTOFF) {
            return MEDIUM;
        }
        return LOW;
    }
}
