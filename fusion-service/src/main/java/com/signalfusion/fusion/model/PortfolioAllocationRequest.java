package com.signalfusion.fusion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalfusion.common.allocation.StockScore;
import com.signalfusion.common.sector.SectorRanking;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/portfolio/allocate}. Null numeric fields and a null risk
 * tolerance fall back to the {@code fusion.allocation.default-*} properties.
 */
public record PortfolioAllocationRequest(
    @JsonProperty("ranking") SectorRanking ranking,
    @JsonProperty("stockScoresBySector") Map<String, List<StockScore>> stockScoresBySector,
    @JsonProperty("riskTolerance") String riskTolerance,
    @JsonProperty("portfolioSize") Double portfolioSize,
    @JsonProperty("maxSectors") Integer maxSectors,
    @JsonProperty("stocksPerSector") Integer stocksPerSector
) {
    public PortfolioAllocationRequest {
        ranking = ranking != null ? ranking : SectorRanking.empty();
        stockScoresBySector = stockScoresBySector != null ? stockScoresBySector : Map.of();
    }
}
