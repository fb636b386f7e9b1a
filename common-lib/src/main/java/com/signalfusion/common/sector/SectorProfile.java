package com.signalfusion.common.sector;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Static reference data for one market sector, loaded from the sector catalog.
 * Keywords are stored lower-cased; tickers upper-cased.
 */
public record SectorProfile(
    @JsonProperty("sectorId") String sectorId,
    @JsonProperty("etfTicker") String etfTicker,
    @JsonProperty("tickers") List<String> tickers,
    @JsonProperty("keywords") List<String> keywords
) {
    public SectorProfile {
        if (sectorId == null || sectorId.isBlank()) {
            throw new IllegalArgumentException("sectorId is required");
        }
        etfTicker = etfTicker != null ? etfTicker : "N/A";
        tickers = tickers == null ? List.of()
            : tickers.stream().map(t -> t.trim().toUpperCase(Locale.ROOT)).distinct().toList();
        keywords = keywords == null ? List.of()
            : keywords.stream().map(k -> k.trim().toLowerCase(Locale.ROOT)).distinct().toList();
    }

    public boolean hasTicker(String ticker) {
        return ticker != null && tickers.contains(ticker.trim().toUpperCase(Locale.ROOT));
    }
}
