package com.signalfusion.common.sector;

import com.signalfusion.common.exception.FusionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable sector reference table: one {@link SectorProfile} per sector, in catalog order,
 * plus case-insensitive word-boundary patterns that boost a few core sectors.
 *
 * <p>Built once at startup by {@link SectorCatalogLoader}; safe for concurrent reads.
 */
public final class SectorCatalog {

    private final String version;
    private final Map<String, SectorProfile> profiles;
    private final Map<String, Pattern> patterns;

    public SectorCatalog(String version, List<SectorProfile> sectors, Map<String, String> patterns) {
        if (sectors == null || sectors.isEmpty()) {
            throw FusionException.invalidConfiguration("SectorCatalog", "catalog must define at least one sector");
        }
        Map<String, SectorProfile> byId = new LinkedHashMap<>();
        for (SectorProfile profile : sectors) {
            if (byId.putIfAbsent(profile.sectorId(), profile) != null) {
                throw FusionException.invalidConfiguration("SectorCatalog", "duplicate sectorId " + profile.sectorId());
            }
        }

        Map<String, Pattern> compiled = new LinkedHashMap<>();
        if (patterns != null) {
            for (Map.Entry<String, String> entry : patterns.entrySet()) {
                if (!byId.containsKey(entry.getKey())) {
                    throw FusionException.invalidConfiguration("SectorCatalog", "pattern for unknown sector " + entry.getKey());
                }
                try {
                    compiled.put(entry.getKey(), Pattern.compile(entry.getValue(), Pattern.CASE_INSENSITIVE));
                } catch (PatternSyntaxException e) {
                    throw FusionException.invalidConfiguration("SectorCatalog",
                        "invalid pattern for sector " + entry.getKey() + ": " + e.getDescription(), e);
                }
            }
        }

        this.version  = version != null ? version : "unversioned";
        this.profiles = Collections.unmodifiableMap(byId);
        this.patterns = Collections.unmodifiableMap(compiled);
    }

    public String version() {
        return version;
    }

    /** Profiles in catalog order. */
    public List<SectorProfile> profiles() {
        return List.copyOf(profiles.values());
    }

    public Optional<SectorProfile> profile(String sectorId) {
        return Optional.ofNullable(profiles.get(sectorId));
    }

    public Map<String, Pattern> patterns() {
        return patterns;
    }

    /** ETF ticker for {@code sectorId}, or {@code "N/A"} when the sector is unknown. */
    public String etfTicker(String sectorId) {
        return profile(sectorId).map(SectorProfile::etfTicker).orElse("N/A");
    }

    /** First sector in catalog order whose ticker set contains {@code ticker}. */
    public Optional<SectorProfile> sectorOf(String ticker) {
        return profiles.values().stream().filter(p -> p.hasTicker(ticker)).findFirst();
    }

    public int size() {
        return profiles.size();
    }
}
