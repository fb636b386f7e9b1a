package com.signalfusion.common.sector;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns a news item to a market sector.
 *
 * <h3>Precedence</h3>
 * <ol>
 *   <li>Ticker: a supplied ticker found in a sector's ticker set wins outright, confidence 1.0.</li>
 *   <li>Keywords: {@code confidence = min(1, keywordMatches / keywordCount × 10)}, kept when &gt; 0.1.</li>
 *   <li>Patterns: {@code patternConfidence = min(1, hits × 0.3)}. A sector not yet matched is
 *       seeded with it (one hit is enough); a matched sector gains {@code patternConfidence × 0.5} (capped at 1).</li>
 *   <li>The highest confidence wins, ties resolved in catalog order. No match falls back to
 *       {@code general_market} at 0.5.</li>
 * </ol>
 *
 * <p>Pure over an immutable {@link SectorCatalog}; thread-safe.
 */
public final class SectorClassifier {

    private static final Pattern TICKER_TOKEN = Pattern.compile("\\b([A-Z]{2,5})\\b");

    private static final double KEYWORD_SCALE        = 10.0;
    private static final double KEYWORD_MIN          = 0.1;
    private static final double PATTERN_HIT_WEIGHT   = 0.3;
    private static final double PATTERN_BOOST_FACTOR = 0.5;

    private final SectorCatalog catalog;

    public SectorClassifier(SectorCatalog catalog) {
        this.catalog = catalog;
    }

    public SectorAssignment classify(String headline, String summary, String ticker) {
        if (ticker != null && !ticker.isBlank()) {
            Optional<SectorProfile> owner = catalog.sectorOf(ticker);
            if (owner.isPresent()) {
                String sectorId = owner.get().sectorId();
                return new SectorAssignment(sectorId, 1.0, Map.of(sectorId, 1.0), AssignmentMethod.TICKER);
            }
        }

        String content = (nullToEmpty(headline) + " " + nullToEmpty(summary)).toLowerCase(Locale.ROOT);
        Map<String, Double> confidences = new LinkedHashMap<>();
        Set<String> patternSeeded = new HashSet<>();

        for (SectorProfile profile : catalog.profiles()) {
            if (profile.keywords().isEmpty()) continue;
            long matches = profile.keywords().stream().filter(content::contains).count();
            if (matches == 0) continue;
            double confidence = Math.min(1.0, (double) matches / profile.keywords().size() * KEYWORD_SCALE);
            if (confidence > KEYWORD_MIN) {
                confidences.put(profile.sectorId(), confidence);
            }
        }

        for (Map.Entry<String, Pattern> entry : catalog.patterns().entrySet()) {
            int hits = countHits(entry.getValue(), content);
            if (hits == 0) continue;
            double patternConfidence = Math.min(1.0, hits * PATTERN_HIT_WEIGHT);
            String sectorId = entry.getKey();
            Double existing = confidences.get(sectorId);
            if (existing == null) {
                confidences.put(sectorId, patternConfidence);
                patternSeeded.add(sectorId);
            } else {
                confidences.put(sectorId, Math.min(1.0, existing + patternConfidence * PATTERN_BOOST_FACTOR));
            }
        }

        if (confidences.isEmpty()) {
            return SectorAssignment.fallback();
        }

        // catalog order, then strict improvement, keeps the first of equal confidences
        Map<String, Double> ordered = new LinkedHashMap<>();
        for (SectorProfile profile : catalog.profiles()) {
            Double confidence = confidences.get(profile.sectorId());
            if (confidence != null) ordered.put(profile.sectorId(), confidence);
        }
        String best = null;
        double bestConfidence = -1.0;
        for (Map.Entry<String, Double> entry : ordered.entrySet()) {
            if (entry.getValue() > bestConfidence) {
                best = entry.getKey();
                bestConfidence = entry.getValue();
            }
        }
        AssignmentMethod method = patternSeeded.contains(best) ? AssignmentMethod.PATTERN : AssignmentMethod.KEYWORD;
        return new SectorAssignment(best, bestConfidence, ordered, method);
    }

    /**
     * First upper-case token of 2 to 5 letters, used as a ticker hint when an item
     * carries none. Crude: acronyms such as {@code CEO} match too.
     */
    public static Optional<String> extractTicker(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = TICKER_TOKEN.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static int countHits(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        int hits = 0;
        while (matcher.find()) hits++;
        return hits;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
