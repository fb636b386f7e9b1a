package com.signalfusion.common.sector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Eligible sectors ordered by {@code score × confidence}, descending.
 * Sectors with fewer than the minimum item count never appear.
 */
public record SectorRanking(
    @JsonProperty("rankings") List<RankedSector> rankings
) {
    public SectorRanking {
        rankings = rankings == null ? List.of() : List.copyOf(rankings);
        for (int i = 1; i < rankings.size(); i++) {
            if (rankings.get(i).rankingKey() > rankings.get(i - 1).rankingKey()) {
                throw new IllegalArgumentException(
                    "rankings not sorted by score*confidence at position " + (i + 1));
            }
        }
    }

    public static SectorRanking empty() {
        return new SectorRanking(List.of());
    }

    @JsonProperty(value = "overweight", access = JsonProperty.Access.READ_ONLY)
    public List<String> overweight() {
        return idsOf(SectorTier.OVERWEIGHT);
    }

    @JsonProperty(value = "neutral", access = JsonProperty.Access.READ_ONLY)
    public List<String> neutral() {
        return idsOf(SectorTier.NEUTRAL);
    }

    @JsonProperty(value = "underweight", access = JsonProperty.Access.READ_ONLY)
    public List<String> underweight() {
        return idsOf(SectorTier.UNDERWEIGHT);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rankings.isEmpty();
    }

    private List<String> idsOf(SectorTier tier) {
        return rankings.stream().filter(r -> r.tier() == tier).map(RankedSector::sectorId).toList();
    }
}
