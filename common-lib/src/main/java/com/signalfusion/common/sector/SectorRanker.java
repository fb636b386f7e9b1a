package com.signalfusion.common.sector;

import com.signalfusion.common.model.CategoryScore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Ranks sectors by confidence-weighted sentiment and partitions them into tiers.
 *
 * <pre>
 *   eligible    = itemCount ≥ minItemCount (2) and not general_market
 *   order       = score × confidence, descending; sectorId breaks ties
 *   k           = max(1, ⌈n / 3⌉)
 *   OVERWEIGHT  = among the first k, score &gt;  tierThreshold (0.1)
 *   UNDERWEIGHT = among the last k,  score &lt; −tierThreshold
 *   NEUTRAL     = everything else
 * </pre>
 *
 * <p>With fewer than three sectors the top and bottom windows overlap; a sector gets the
 * first tier it qualifies for in the order OVERWEIGHT, UNDERWEIGHT, NEUTRAL.
 */
public final class SectorRanker {

    public static final int    DEFAULT_MIN_ITEM_COUNT  = 2;
    public static final double DEFAULT_TIER_THRESHOLD  = 0.1;

    private static final double LOW_CONFIDENCE = 0.3;
    private static final double STRONG_SCORE   = 0.2;
    private static final double WEAK_SCORE     = 0.05;

    private final SectorCatalog catalog;
    private final int minItemCount;
    private final double tierThreshold;

    public SectorRanker(SectorCatalog catalog) {
        this(catalog, DEFAULT_MIN_ITEM_COUNT, DEFAULT_TIER_THRESHOLD);
    }

    /**
     * @param catalog used for ETF tickers only; may be {@code null}
     */
    public SectorRanker(SectorCatalog catalog, int minItemCount, double tierThreshold) {
        this.catalog       = catalog;
        this.minItemCount  = Math.max(1, minItemCount);
        this.tierThreshold = tierThreshold;
    }

    public SectorRanking rank(Map<String, CategoryScore> sectorScores) {
        if (sectorScores == null || sectorScores.isEmpty()) {
            return SectorRanking.empty();
        }

        List<Map.Entry<String, CategoryScore>> eligible = new ArrayList<>();
        for (Map.Entry<String, CategoryScore> entry : sectorScores.entrySet()) {
            if (entry.getValue() == null) continue;
            if (SectorAssignment.GENERAL_MARKET.equals(entry.getKey())) continue;
            if (entry.getValue().itemCount() < minItemCount) continue;
            eligible.add(entry);
        }
        eligible.sort(Comparator
            .comparingDouble((Map.Entry<String, CategoryScore> e) -> -(e.getValue().score() * e.getValue().confidence()))
            .thenComparing(Map.Entry::getKey));

        int n = eligible.size();
        int window = Math.max(1, (n + 2) / 3);
        List<RankedSector> rankings = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String sectorId = eligible.get(i).getKey();
            CategoryScore score = eligible.get(i).getValue();
            rankings.add(new RankedSector(
                i + 1,
                sectorId,
                score.score(),
                score.confidence(),
                score.itemCount(),
                catalog != null ? catalog.etfTicker(sectorId) : "N/A",
                tierOf(i, n, window, score.score()),
                recommendation(score.score(), score.confidence())));
        }
        return new SectorRanking(rankings);
    }

    private SectorTier tierOf(int index, int n, int window, double score) {
        if (index < window && score > tierThreshold)        return SectorTier.OVERWEIGHT;
        if (index >= n - window && score < -tierThreshold)  return SectorTier.UNDERWEIGHT;
        return SectorTier.NEUTRAL;
    }

    static String recommendation(double score, double confidence) {
        if (confidence < LOW_CONFIDENCE) return "HOLD - Low Confidence";
        if (score >  STRONG_SCORE)       return "BUY - Positive Sentiment";
        if (score >  WEAK_SCORE)         return "MODERATE BUY";
        if (score < -STRONG_SCORE)       return "SELL - Negative Sentiment";
        if (score < -WEAK_SCORE)         return "MODERATE SELL";
        return "HOLD - Neutral";
    }
}
