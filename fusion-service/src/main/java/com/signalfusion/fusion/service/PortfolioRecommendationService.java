package com.signalfusion.fusion.service;

import com.signalfusion.common.allocation.PortfolioPlan;
import com.signalfusion.common.allocation.PortfolioPlanner;
import com.signalfusion.common.allocation.RiskTolerance;
import com.signalfusion.common.allocation.StockScore;
import com.signalfusion.common.exception.FusionException;
import com.signalfusion.common.sector.RankedSector;
import com.signalfusion.common.sector.SectorCatalog;
import com.signalfusion.common.sector.SectorProfile;
import com.signalfusion.common.sector.SectorRanking;
import com.signalfusion.fusion.config.FusionProperties;
import com.signalfusion.fusion.logger.FusionFlowLogger;
import com.signalfusion.fusion.model.PortfolioAllocationRequest;
import com.signalfusion.fusion.model.PortfolioRecommendation;
import com.signalfusion.fusion.model.TickerSentimentReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns sector rankings and fused stock scores into a {@link PortfolioPlan}.
 *
 * <p>{@link #allocatePortfolio} works on caller-supplied inputs only.
 * {@link #recommendPortfolio} builds those inputs itself: it ranks sectors from market news,
 * then fuses sentiment for the first {@code 2 × stocksPerSector} catalog tickers of every
 * sector the risk tolerance admits.
 */
@Service
public class PortfolioRecommendationService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioRecommendationService.class);
    private static final String COMPONENT = "PortfolioRecommendationService";

    private final SectorAnalysisService sectorAnalysisService;
    private final SentimentFusionService sentimentFusionService;
    private final SectorCatalog sectorCatalog;
    private final PortfolioPlanner portfolioPlanner;
    private final FusionFlowLogger flowLogger;
    private final FusionProperties.Allocation defaults;

    public PortfolioRecommendationService(SectorAnalysisService sectorAnalysisService,
                                          SentimentFusionService sentimentFusionService,
                                          SectorCatalog sectorCatalog,
                                          PortfolioPlanner portfolioPlanner,
                                          FusionFlowLogger flowLogger,
                                          FusionProperties properties) {
        this.sectorAnalysisService  = sectorAnalysisService;
        this.sentimentFusionService = sentimentFusionService;
        this.sectorCatalog          = sectorCatalog;
        this.portfolioPlanner       = portfolioPlanner;
        this.flowLogger             = flowLogger;
        this.defaults               = properties.getAllocation();
    }

    public Mono<PortfolioPlan> allocatePortfolio(PortfolioAllocationRequest request) {
        return Mono.fromCallable(() -> {
                RiskTolerance tolerance = RiskTolerance.from(
                    request.riskTolerance() != null ? request.riskTolerance() : defaults.getDefaultRiskTolerance());
                return portfolioPlanner.plan(
                    request.ranking(),
                    request.stockScoresBySector(),
                    tolerance,
                    request.portfolioSize() != null ? request.portfolioSize() : defaults.getDefaultPortfolioSize(),
                    request.maxSectors() != null ? request.maxSectors() : defaults.getDefaultMaxSectors(),
                    request.stocksPerSector() != null ? request.stocksPerSector() : defaults.getDefaultStocksPerSector());
            })
            .doOnNext(plan -> log.info("Portfolio allocated. tolerance={} sectors={} positions={} risk={}",
                plan.allocation().riskTolerance().code(), plan.allocation().sectors().size(),
                plan.allocation().totalPositions(), plan.riskAssessment().riskTier()))
            .doOnEach(flowLogger.stage(FusionFlowLogger.PORTFOLIO_ALLOCATED));
    }

    /**
     * Null arguments fall back to the {@code fusion.allocation.default-*} properties.
     */
    public Mono<PortfolioRecommendation> recommendPortfolio(String riskTolerance,
                                                            Double portfolioSize,
                                                            Integer maxSectors,
                                                            Integer stocksPerSector) {
        RiskTolerance tolerance = RiskTolerance.from(
            riskTolerance != null ? riskTolerance : defaults.getDefaultRiskTolerance());
        double size = portfolioSize != null ? portfolioSize : defaults.getDefaultPortfolioSize();
        int sectors = maxSectors != null ? maxSectors : defaults.getDefaultMaxSectors();
        int perSector = stocksPerSector != null ? stocksPerSector : defaults.getDefaultStocksPerSector();
        validate(size, sectors, perSector);

        return sectorAnalysisService.analyzeMarketSectors()
            .flatMap(report -> collectStockScores(report.ranking(), tolerance, perSector)
                .map(stockScores -> new PortfolioRecommendation(
                    report.ranking(),
                    stockScores,
                    portfolioPlanner.plan(report.ranking(), stockScores, tolerance, size, sectors, perSector))))
            .doOnEach(flowLogger.stage(FusionFlowLogger.PORTFOLIO_ALLOCATED));
    }

    private Mono<Map<String, List<StockScore>>> collectStockScores(SectorRanking ranking,
                                                                   RiskTolerance tolerance,
                                                                   int stocksPerSector) {
        int candidates = 2 * stocksPerSector;
        return Flux.fromIterable(ranking.rankings())
            .filter(tolerance::accepts)
            .concatMap(sector -> scoreSector(sector, candidates)
                .map(scores -> Map.entry(sector.sectorId(), scores)))
            .collectList()
            .map(entries -> {
                Map<String, List<StockScore>> bySector = new LinkedHashMap<>();
                entries.forEach(e -> bySector.put(e.getKey(), e.getValue()));
                return bySector;
            });
    }

    private Mono<List<StockScore>> scoreSector(RankedSector sector, int candidates) {
        List<String> tickers = sectorCatalog.profile(sector.sectorId())
            .map(SectorProfile::tickers)
            .orElse(List.of());
        return Flux.fromIterable(tickers.subList(0, Math.min(candidates, tickers.size())))
            .flatMapSequential(sentimentFusionService::fuseSentiment)
            .filter(report -> report.sentiment().isAvailable())
            .map(this::toStockScore)
            .collectList();
    }

    private StockScore toStockScore(TickerSentimentReport report) {
        return StockScore.of(report.ticker(), report.sentiment().value());
    }

    private static void validate(double portfolioSize, int maxSectors, int stocksPerSector) {
        if (!(portfolioSize > 0.0)) {
            throw FusionException.invalidField(COMPONENT, "portfolioSize", portfolioSize, "> 0");
        }
        if (maxSectors < 1) {
            throw FusionException.invalidField(COMPONENT, "maxSectors", maxSectors, ">= 1");
        }
        if (stocksPerSector < 1) {
            throw FusionException.invalidField(COMPONENT, "stocksPerSector", stocksPerSector, ">= 1");
        }
    }
}
