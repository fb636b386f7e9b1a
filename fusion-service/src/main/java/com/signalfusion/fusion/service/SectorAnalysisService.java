package com.signalfusion.fusion.service;

import com.signalfusion.common.aggregation.CategoryAggregator;
import com.signalfusion.common.model.CategoryLabel;
import com.signalfusion.common.model.CategoryScore;
import com.signalfusion.common.model.Channel;
import com.signalfusion.common.model.WeightedItem;
import com.signalfusion.common.sector.SectorAssignment;
import com.signalfusion.common.sector.SectorClassifier;
import com.signalfusion.common.sector.SectorRanker;
import com.signalfusion.common.sector.SectorRanking;
import com.signalfusion.fusion.adapter.ItemQuery;
import com.signalfusion.fusion.config.FusionProperties;
import com.signalfusion.fusion.logger.FusionFlowLogger;
import com.signalfusion.fusion.model.MarketSectorReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sector rotation: assigns market news to sectors, aggregates each sector's items with the
 * {@link CategoryLabel#SECTOR} label and ranks them.
 */
@Service
public class SectorAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(SectorAnalysisService.class);

    private final ItemScoringService scoringService;
    private final SectorClassifier sectorClassifier;
    private final CategoryAggregator categoryAggregator;
    private final SectorRanker sectorRanker;
    private final FusionFlowLogger flowLogger;
    private final String generalMarketQuery;

    public SectorAnalysisService(ItemScoringService scoringService,
                                 SectorClassifier sectorClassifier,
                                 CategoryAggregator categoryAggregator,
                                 SectorRanker sectorRanker,
                                 FusionFlowLogger flowLogger,
                                 FusionProperties properties) {
        this.scoringService     = scoringService;
        this.sectorClassifier   = sectorClassifier;
        this.categoryAggregator = categoryAggregator;
        this.sectorRanker       = sectorRanker;
        this.flowLogger         = flowLogger;
        this.generalMarketQuery = properties.getCombined().getGeneralMarketQuery();
    }

    public Mono<SectorRanking> rankSectors(Map<String, CategoryScore> sectorScores) {
        return Mono.fromCallable(() -> sectorRanker.rank(sectorScores == null ? Map.of() : sectorScores))
            .doOnEach(flowLogger.stage(FusionFlowLogger.SECTORS_RANKED));
    }

    /**
     * Scores general market news, groups the items by the sector they were assigned to and
     * ranks the sectors. Items that match no sector are counted but not ranked.
     */
    public Mono<MarketSectorReport> analyzeMarketSectors() {
        return scoringService.fetchAndScore(ItemQuery.generalMarket(Channel.NEWS, generalMarketQuery))
            .map(this::groupBySector)
            .doOnEach(flowLogger.stage(FusionFlowLogger.CATEGORIES_AGGREGATED))
            .map(grouped -> {
                SectorRanking ranking = sectorRanker.rank(grouped.scores());
                log.info("Sector analysis complete. items={} assignedSectors={} ranked={} unassigned={}",
                    grouped.itemCount(), grouped.scores().size(), ranking.rankings().size(), grouped.unassigned());
                return new MarketSectorReport(ranking, grouped.scores(), grouped.itemCount(), grouped.unassigned());
            })
            .doOnEach(flowLogger.stage(FusionFlowLogger.SECTORS_RANKED));
    }

    private Grouped groupBySector(List<WeightedItem> items) {
        Map<String, List<WeightedItem>> bySector = new LinkedHashMap<>();
        int unassigned = 0;
        for (WeightedItem item : items) {
            String text = item.item().text();
            String ticker = SectorClassifier.extractTicker(text).orElse(null);
            SectorAssignment assignment = sectorClassifier.classify(text, "", ticker);
            if (assignment.isGeneralMarket()) {
                unassigned++;
                continue;
            }
            bySector.computeIfAbsent(assignment.sectorId(), id -> new ArrayList<>()).add(item);
        }
        Map<String, CategoryScore> scores = new LinkedHashMap<>();
        bySector.forEach((sectorId, sectorItems) ->
            scores.put(sectorId, categoryAggregator.aggregate(CategoryLabel.SECTOR, sectorItems)));
        return new Grouped(scores, items.size(), unassigned);
    }

    private record Grouped(Map<String, CategoryScore> scores, int itemCount, int unassigned) {}
}
