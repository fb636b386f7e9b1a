package com.signalfusion.common.sector;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One eligible sector in a {@link SectorRanking}.
 *
 * @param rank           1-based position, best first
 * @param recommendation advisory label derived from score and confidence
 */
public record RankedSector(
    @JsonProperty("rank") int rank,
    @JsonProperty("sectorId") String sectorId,
    @JsonProperty("score") double score,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("itemCount") int itemCount,
    @JsonProperty("etfTicker") String etfTicker,
    @JsonProperty("tier") SectorTier tier,
    @JsonProperty("recommendation") String recommendation
) {
    @JsonProperty(value = "rankingKey", access = JsonProperty.Access.READ_ONLY)
    public double rankingKey() {
        return score * confidence;
    }
}
