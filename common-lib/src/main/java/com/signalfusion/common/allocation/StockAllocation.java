package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param amount     dollars allocated to the stock
 * @param percentage share of the whole portfolio, 0..100
 */
public record StockAllocation(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("score") double score,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("amount") double amount,
    @JsonProperty("percentage") double percentage,
    @JsonProperty("recommendation") StockRecommendation recommendation
) {}
