package com.signalfusion.fusion.controller;

import com.signalfusion.common.allocation.PortfolioPlan;
import com.signalfusion.common.economic.EconomicIndicators;
import com.signalfusion.common.economic.EconomicRisk;
import com.signalfusion.common.model.CategoryScore;
import com.signalfusion.common.model.CombinedSentiment;
import com.signalfusion.common.model.SignalResult;
import com.signalfusion.common.sector.SectorRanking;
import com.signalfusion.common.trace.FusionTrace;
import com.signalfusion.fusion.logger.FusionFlowLogger;
import com.signalfusion.fusion.model.ChannelFusionRequest;
import com.signalfusion.fusion.model.ChannelSentimentReport;
import com.signalfusion.fusion.model.MarketSectorReport;
import com.signalfusion.fusion.model.PortfolioAllocationRequest;
import com.signalfusion.fusion.model.PortfolioRecommendation;
import com.signalfusion.fusion.model.TickerSentimentReport;
import com.signalfusion.fusion.service.MarketContextService;
import com.signalfusion.fusion.service.PortfolioRecommendationService;
import com.signalfusion.fusion.service.SectorAnalysisService;
import com.signalfusion.fusion.service.SentimentFusionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/v1")
public class FusionController {

    private final SentimentFusionService sentimentService;
    private final SectorAnalysisService sectorService;
    private final PortfolioRecommendationService portfolioService;
    private final MarketContextService marketContextService;
    private final FusionFlowLogger flowLogger;

    public FusionController(SentimentFusionService sentimentService,
                            SectorAnalysisService sectorService,
                            PortfolioRecommendationService portfolioService,
                            MarketContextService marketContextService,
                            FusionFlowLogger flowLogger) {
        this.sentimentService     = sentimentService;
        this.sectorService        = sectorService;
        this.portfolioService     = portfolioService;
        this.marketContextService = marketContextService;
        this.flowLogger           = flowLogger;
    }

    @GetMapping("/sentiment/{ticker}")
    public Mono<ResponseEntity<TickerSentimentReport>> fuseSentiment(
            @PathVariable String ticker,
            @RequestHeader(value = FusionTrace.HEADER, required = false) String traceHeader) {
        return traced(traceHeader, () -> sentimentService.fuseSentiment(ticker));
    }

    @PostMapping("/sentiment/channels")
    public Mono<ResponseEntity<SignalResult<CombinedSentiment>>> fuseMultiChannel(
            @RequestBody ChannelFusionRequest request,
            @RequestHeader(value = FusionTrace.HEADER, required = false) String traceHeader) {
        return traced(traceHeader, () -> sentimentService.fuseMultiChannel(request.subject(), request.channels()));
    }

    @GetMapping("/sentiment/{ticker}/channels")
    public Mono<ResponseEntity<ChannelSentimentReport>> analyzeChannels(
            @PathVariable String ticker,
            @RequestHeader(value = FusionTrace.HEADER, required = false) String traceHeader) {
        return traced(traceHeader, () -> sentimentService.analyzeChannels(ticker));
    }

    @PostMapping("/sectors/rank")
    public Mono<ResponseEntity<SectorRanking>> rankSectors(
            @RequestBody Map<String, CategoryScore> sectorScores,
            @RequestHeader(value = FusionTrace.HEADER, required = false) String traceHeader) {
        return traced(traceHeader, () -> sectorService.rankSectors(sectorScores));
    }

    @GetMapping("/sectors")
    public Mono<ResponseEntity<MarketSectorReport>> analyzeMarketSectors(
            @RequestHeader(value = FusionTrace.HEADER, required = false) String traceHeader) {
        return traced(traceHeader, sectorService::analyzeMarketSectors);
    }

    @PostMapping("/portfolio/allocate")
    public Mono<ResponseEntity<PortfolioPlan>> allocatePortfolio(
            @RequestBody PortfolioAllocationRequest request,
            @RequestHeader(value = FusionTrace.HEADER, required = false) String traceHeader) {
        return traced(traceHeader, () -> portfolioService.allocatePortfolio(request));
    }

    @GetMapping("/portfolio/recommendations")
    public Mono<ResponseEntity<PortfolioRecommendation>> recommendPortfolio(
            @RequestParam(required = false) String riskTolerance,
            @RequestParam(required = false) Double portfolioSize,
            @RequestParam(required = false) Integer maxSectors,
            @RequestParam(required = false) Integer stocksPerSector,
            @RequestHeader(value = FusionTrace.HEADER, required = false) String traceHeader) {
        return traced(traceHeader,
            () -> portfolioService.recommendPortfolio(riskTolerance, portfolioSize, maxSectors, stocksPerSector));
    }

    @GetMapping("/market/context")
    public Mono<ResponseEntity<SignalResult<EconomicRisk>>> marketContext(
            @RequestHeader(value = FusionTrace.HEADER, required = false) String traceHeader) {
        return traced(traceHeader, marketContextService::assessMarketContext);
    }

    @PostMapping("/market/context")
    public Mono<ResponseEntity<SignalResult<EconomicRisk>>> assessMarketContext(
            @RequestBody EconomicIndicators indicators,
            @RequestHeader(value = FusionTrace.HEADER, required = false) String traceHeader) {
        return traced(traceHeader, () -> marketContextService.assessMarketContext(indicators));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    /**
     * Resolves the request's trace id, logs its arrival, then binds the id to the whole
     * pipeline. Synchronous validation errors thrown by {@code pipeline} reach the advice.
     */
    private <T> Mono<ResponseEntity<T>> traced(String traceHeader, Supplier<Mono<T>> pipeline) {
        String traceId = FusionTrace.resolve(traceHeader);
        flowLogger.logWithTraceId(FusionFlowLogger.REQUEST_RECEIVED, traceId);
        return FusionTrace.bind(pipeline.get().map(ResponseEntity::ok), traceId);
    }
}
