package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A {@link SourceItem} after relevance classification and both model readings.
 *
 * @param financeReading           reading of the finance-specialised model
 * @param generalReading           reading of the general-purpose model
 * @param financial                relevance verdict
 * @param classificationConfidence relevance confidence; forced to 0 when inference failed entirely
 * @param inferenceFailures        number of model calls that failed for this item (0..2)
 */
public record AnalyzedItem(
    @JsonProperty("text") String text,
    @JsonProperty("source") String source,
    @JsonProperty("publishedAt") String publishedAt,
    @JsonProperty("kind") ItemKind kind,
    @JsonProperty("financeReading") SentimentReading financeReading,
    @JsonProperty("generalReading") SentimentReading generalReading,
    @JsonProperty("financial") boolean financial,
    @JsonProperty("classificationConfidence") double classificationConfidence,
    @JsonProperty("inferenceFailures") int inferenceFailures
) {
    public boolean degraded() {
        return inferenceFailures > 0;
    }

    /** The reading that matches the item's relevance: finance for financial text, general otherwise. */
    public SentimentReading primaryReading() {
        return financial ? financeReading : generalReading;
    }
}
