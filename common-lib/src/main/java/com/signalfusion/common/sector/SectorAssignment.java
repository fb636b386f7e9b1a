package com.signalfusion.common.sector;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sector verdict for one news item.
 *
 * @param allMatches every sector that qualified, with its confidence, in catalog order
 */
public record SectorAssignment(
    @JsonProperty("sectorId") String sectorId,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("allMatches") Map<String, Double> allMatches,
    @JsonProperty("method") AssignmentMethod method
) {
    public static final String GENERAL_MARKET = "general_market";
    public static final double FALLBACK_CONFIDENCE = 0.5;

    public SectorAssignment {
        allMatches = allMatches == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(allMatches));
    }

    public static SectorAssignment fallback() {
        return new SectorAssignment(GENERAL_MARKET, FALLBACK_CONFIDENCE, Map.of(), AssignmentMethod.FALLBACK);
    }

    public boolean isGeneralMarket() {
        return GENERAL_MARKET.equals(sectorId);
    }
}
