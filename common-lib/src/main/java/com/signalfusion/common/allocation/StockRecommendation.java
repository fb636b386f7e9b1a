package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-stock advisory label.
 *
 * <pre>
 *   confidence &lt; 0.3 → HOLD - Monitor
 *   score &gt;  0.2     → STRONG BUY
 *   score &gt;  0.05    → BUY
 *   score &lt; −0.2     → STRONG SELL
 *   score &lt; −0.05    → SELL
 *   otherwise        → HOLD
 * </pre>
 */
public enum StockRecommendation {
    STRONG_BUY("STRONG BUY"),
    BUY("BUY"),
    HOLD("HOLD"),
    SELL("SELL"),
    STRONG_SELL("STRONG SELL"),
    HOLD_LOW_CONFIDENCE("HOLD - Monitor");

    private static final double LOW_CONFIDENCE = 0.3;
    private static final double STRONG         = 0.2;
    private static final double WEAK           = 0.05;

    private final String label;

    StockRecommendation(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static StockRecommendation of(double score, double confidence) {
        if (confidence < LOW_CONFIDENCE) return HOLD_LOW_CONFIDENCE;
        if (score >  STRONG)             return STRONG_BUY;
        if (score >  WEAK)               return BUY;
        if (score < -STRONG)             return STRONG_SELL;
        if (score < -WEAK)               return SELL;
        return HOLD;
    }
}
