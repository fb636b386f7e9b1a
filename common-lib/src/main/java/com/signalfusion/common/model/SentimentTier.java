package com.signalfusion.common.model;

/**
 * Five-tier label produced by multi-channel fusion.
 *
 * <pre>
 *   score &gt;  strong → BULLISH
 *   score &gt;  weak   → SLIGHTLY_POSITIVE
 *   score &lt; -strong → BEARISH
 *   score &lt; -weak   → SLIGHTLY_NEGATIVE
 *   otherwise        → NEUTRAL
 * </pre>
 */
public enum SentimentTier {
    BULLISH,
    SLIGHTLY_POSITIVE,
    NEUTRAL,
    SLIGHTLY_NEGATIVE,
    BEARISH;

    public String code() {
        return name().toLowerCase();
    }

    public static SentimentTier of(double score, double strong, double weak) {
        if (score > strong)  return BULLISH;
        if (score > weak)    return SLIGHTLY_POSITIVE;
        if (score < -strong) return BEARISH;
        if (score < -weak)   return SLIGHTLY_NEGATIVE;
        return NEUTRAL;
    }
}
