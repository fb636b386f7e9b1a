package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scored item ready for aggregation.
 *
 * @param timeWeight   recency weight in [minWeight, 1]
 * @param blendedScore adaptive blend of both model readings in [-1, 1]
 */
public record WeightedItem(
    @JsonProperty("item") AnalyzedItem item,
    @JsonProperty("timeWeight") double timeWeight,
    @JsonProperty("blendedScore") double blendedScore
) {
    public WeightedItem {
        if (timeWeight < 0.0 || timeWeight > 1.0) {
            throw new IllegalArgumentException("timeWeight out of [0,1]: " + timeWeight);
        }
        if (blendedScore < -1.0 || blendedScore > 1.0) {
            throw new IllegalArgumentException("blendedScore out of [-1,1]: " + blendedScore);
        }
    }

    /** Per-item contribution for audit output: blended score scaled by relevance confidence. */
    @JsonProperty(value = "contribution", access = JsonProperty.Access.READ_ONLY)
    public double contribution() {
        return blendedScore * item.classificationConfidence();
    }
}
