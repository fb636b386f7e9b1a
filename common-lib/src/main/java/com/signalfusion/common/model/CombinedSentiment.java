package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fused sentiment for one ticker or sector.
 *
 * <p>{@code weightsUsed} records the renormalized weight of every source that actually
 * contributed. Whenever at least one source contributed, the weights sum to 1.0; this is
 * enforced here rather than checked after the fact.
 *
 * @param subject ticker, sector id or other scope the sentiment is about
 * @param label   {@link SentimentLabel#code()} or {@link SentimentTier#code()} depending on the fuser
 */
public record CombinedSentiment(
    @JsonProperty("subject") String subject,
    @JsonProperty("score") double score,
    @JsonProperty("label") String label,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("weightsUsed") Map<String, Double> weightsUsed
) {
    static final double WEIGHT_SUM_TOLERANCE = 1e-6;
    private static final double RANGE_EPSILON = 1e-9;

    public CombinedSentiment {
        if (score < -1.0 - RANGE_EPSILON || score > 1.0 + RANGE_EPSILON) {
            throw new IllegalArgumentException("score out of [-1,1]: " + score);
        }
        if (confidence < -RANGE_EPSILON || confidence > 1.0 + RANGE_EPSILON) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        score = Math.max(-1.0, Math.min(1.0, score));
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        weightsUsed = weightsUsed == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(weightsUsed));
        if (!weightsUsed.isEmpty()) {
            double sum = weightsUsed.values().stream().mapToDouble(Double::doubleValue).sum();
            if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
                throw new IllegalArgumentException("weightsUsed must sum to 1.0 but sum to " + sum);
            }
        }
    }

    /** Neutral placeholder returned when no source produced any data. */
    public static CombinedSentiment neutral(String subject, String neutralLabel) {
        return new CombinedSentiment(subject, 0.0, neutralLabel, 0.0, Map.of());
    }
}
