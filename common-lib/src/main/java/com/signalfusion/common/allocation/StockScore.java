package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalfusion.common.model.CombinedSentiment;

/**
 * Fused sentiment of one stock, as consumed by {@link PortfolioAllocator}.
 */
public record StockScore(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("score") double score,
    @JsonProperty("confidence") double confidence
) {
    public StockScore {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("ticker is required");
        }
        if (score < -1.0 || score > 1.0) {
            throw new IllegalArgumentException("score out of [-1,1]: " + score);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
    }

    public static StockScore of(String ticker, CombinedSentiment sentiment) {
        return new StockScore(ticker, sentiment.score(), sentiment.confidence());
    }

    public double rankingKey() {
        return score * confidence;
    }
}
