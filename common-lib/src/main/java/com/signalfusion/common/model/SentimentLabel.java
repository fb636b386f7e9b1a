package com.signalfusion.common.model;

/**
 * Three-tier sentiment label used by category aggregation and ticker-level fusion.
 * Each caller supplies its own symmetric threshold.
 */
public enum SentimentLabel {
    POSITIVE,
    NEUTRAL,
    NEGATIVE;

    public String code() {
        return name().toLowerCase();
    }

    /**
     * @param threshold strict bound: {@code score > threshold} is positive,
     *                  {@code score < -threshold} is negative
     */
    public static SentimentLabel of(double score, double threshold) {
        if (score > threshold)  return POSITIVE;
        if (score < -threshold) return NEGATIVE;
        return NEUTRAL;
    }
}
