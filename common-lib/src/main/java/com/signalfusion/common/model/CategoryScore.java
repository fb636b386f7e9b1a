package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated sentiment of one evidence category (general market, one ticker, one sector).
 * Derived per call; never cached.
 *
 * @param score                       time-weighted mean blended score in [-1, 1]
 * @param confidence                  evidence-volume confidence in [0, 1]
 * @param avgClassificationConfidence mean relevance confidence of the items
 */
public record CategoryScore(
    @JsonProperty("label") CategoryLabel label,
    @JsonProperty("score") double score,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("sentiment") SentimentLabel sentiment,
    @JsonProperty("itemCount") int itemCount,
    @JsonProperty("financialItemCount") int financialItemCount,
    @JsonProperty("avgTimeWeight") double avgTimeWeight,
    @JsonProperty("avgClassificationConfidence") double avgClassificationConfidence
) {
    public CategoryScore {
        if (score < -1.0 || score > 1.0) {
            throw new IllegalArgumentException("score out of [-1,1]: " + score);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        if (itemCount < 0 || financialItemCount < 0 || financialItemCount > itemCount) {
            throw new IllegalArgumentException(
                "invalid counts itemCount=" + itemCount + " financialItemCount=" + financialItemCount);
        }
        sentiment = sentiment != null ? sentiment : SentimentLabel.NEUTRAL;
    }

    /** No evidence: zero score, zero confidence. */
    public static CategoryScore empty(CategoryLabel label) {
        return new CategoryScore(label, 0.0, 0.0, SentimentLabel.NEUTRAL, 0, 0, 0.0, 0.0);
    }

    /**
     * Convenience for callers that hold only summary numbers (e.g. pre-aggregated sector data).
     */
    public static CategoryScore of(CategoryLabel label, double score, double confidence, int itemCount) {
        return new CategoryScore(label, score, confidence, SentimentLabel.of(score, 0.1),
            itemCount, 0, itemCount > 0 ? 1.0 : 0.0, 0.0);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return itemCount == 0;
    }

    @JsonProperty(value = "financialRatio", access = JsonProperty.Access.READ_ONLY)
    public double financialRatio() {
        return (double) financialItemCount / Math.max(1, itemCount);
    }
}
