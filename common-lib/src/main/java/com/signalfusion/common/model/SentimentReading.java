package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Label and probability returned by one sentiment model for one text.
 *
 * @param label free-form model label; positive / negative / neutral are recognised case-insensitively
 * @param score model probability for {@code label}, expected in [0, 1]
 */
public record SentimentReading(
    @JsonProperty("label") String label,
    @JsonProperty("score") double score
) {
    private static final SentimentReading NEUTRAL = new SentimentReading("neutral", 0.0);

    /** Placeholder used when a model call failed. */
    public static SentimentReading neutral() {
        return NEUTRAL;
    }
}
