package com.signalfusion.fusion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalfusion.common.allocation.PortfolioPlan;
import com.signalfusion.common.allocation.StockScore;
import com.signalfusion.common.sector.SectorRanking;

import java.util.List;
import java.util.Map;

/**
 * End-to-end recommendation: the sector ranking derived from market news, the fused stock
 * scores collected per sector and the resulting plan.
 */
public record PortfolioRecommendation(
    @JsonProperty("ranking") SectorRanking ranking,
    @JsonProperty("stockScoresBySector") Map<String, List<StockScore>> stockScoresBySector,
    @JsonProperty("plan") PortfolioPlan plan
) {}
