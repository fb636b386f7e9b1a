package com.signalfusion.fusion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalfusion.common.model.CategoryScore;
import com.signalfusion.common.sector.SectorRanking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sector rotation view built from general market news.
 *
 * @param sectorScores    aggregated score of every sector that received at least one item,
 *                        including sectors later dropped from the ranking for thin evidence
 * @param itemCount       items fetched
 * @param unassignedCount items that matched no sector (general market)
 */
public record MarketSectorReport(
    @JsonProperty("ranking") SectorRanking ranking,
    @JsonProperty("sectorScores") Map<String, CategoryScore> sectorScores,
    @JsonProperty("itemCount") int itemCount,
    @JsonProperty("unassignedCount") int unassignedCount
) {
    public MarketSectorReport {
        ranking = ranking != null ? ranking : SectorRanking.empty();
        sectorScores = sectorScores == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(sectorScores));
    }
}
