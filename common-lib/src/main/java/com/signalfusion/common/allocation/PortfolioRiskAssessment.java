package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param diversificationScore   0..100, reaches 100 at fifteen positions
 * @param sectorConcentrationPct largest sector share of the portfolio, 0..100
 * @param sentimentStdDev        population standard deviation of stock scores
 * @param sentimentConsistency   {@code 1 − sentimentStdDev}
 * @param advice                 risk-management suggestions, most specific first
 */
public record PortfolioRiskAssessment(
    @JsonProperty("riskTier") RiskTier riskTier,
    @JsonProperty("diversificationScore") double diversificationScore,
    @JsonProperty("sectorConcentrationPct") double sectorConcentrationPct,
    @JsonProperty("sentimentStdDev") double sentimentStdDev,
    @JsonProperty("averageSentiment") double averageSentiment,
    @JsonProperty("sentimentConsistency") double sentimentConsistency,
    @JsonProperty("totalPositions") int totalPositions,
    @JsonProperty("advice") List<String> advice
) {
    public PortfolioRiskAssessment {
        advice = advice == null ? List.of() : List.copyOf(advice);
    }

    /** Assessment of an allocation that holds no positions. */
    public static PortfolioRiskAssessment empty() {
        return new PortfolioRiskAssessment(RiskTier.LOW, 0.0, 0.0, 0.0, 0.0, 1.0, 0,
            List.of("No sector passed the risk filter; portfolio stays in cash"));
    }
}
