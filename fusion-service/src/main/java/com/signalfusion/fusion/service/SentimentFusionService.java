package com.signalfusion.fusion.service;

import com.signalfusion.common.aggregation.CategoryAggregator;
import com.signalfusion.common.aggregation.ChannelAggregator;
import com.signalfusion.common.exception.FusionException;
import com.signalfusion.common.fusion.CombinedSentimentFuser;
import com.signalfusion.common.fusion.MultiChannelFuser;
import com.signalfusion.common.model.CategoryLabel;
import com.signalfusion.common.model.CategoryScore;
import com.signalfusion.common.model.Channel;
import com.signalfusion.common.model.ChannelResult;
import com.signalfusion.common.model.CombinedSentiment;
import com.signalfusion.common.model.SignalResult;
import com.signalfusion.common.model.WeightedItem;
import com.signalfusion.common.trace.FusionTrace;
import com.signalfusion.fusion.adapter.ItemQuery;
import com.signalfusion.fusion.config.FusionProperties;
import com.signalfusion.fusion.logger.FusionFlowLogger;
import com.signalfusion.fusion.model.ChannelSentimentReport;
import com.signalfusion.fusion.model.TickerSentimentReport;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Ticker-level sentiment: general market news and stock-specific news fused into one
 * {@link CombinedSentiment}, and the five-tier multi-channel variant.
 */
@Service
public class SentimentFusionService {

    private final ItemScoringService scoringService;
    private final CategoryAggregator categoryAggregator;
    private final ChannelAggregator channelAggregator;
    private final CombinedSentimentFuser combinedFuser;
    private final MultiChannelFuser channelFuser;
    private final FusionFlowLogger flowLogger;
    private final String generalMarketQuery;

    public SentimentFusionService(ItemScoringService scoringService,
                                  CategoryAggregator categoryAggregator,
                                  ChannelAggregator channelAggregator,
                                  CombinedSentimentFuser combinedFuser,
                                  MultiChannelFuser channelFuser,
                                  FusionFlowLogger flowLogger,
                                  FusionProperties properties) {
        this.scoringService     = scoringService;
        this.categoryAggregator = categoryAggregator;
        this.channelAggregator  = channelAggregator;
        this.combinedFuser      = combinedFuser;
        this.channelFuser       = channelFuser;
        this.flowLogger         = flowLogger;
        this.generalMarketQuery = properties.getCombined().getGeneralMarketQuery();
    }

    /**
     * Fetches general market and stock-specific news concurrently, aggregates each into a
     * {@link CategoryScore} and fuses both. A category without items drops out of the fusion
     * and the result is {@code DEGRADED}; with neither, it is {@code UNAVAILABLE}.
     */
    public Mono<TickerSentimentReport> fuseSentiment(String ticker) {
        String subject = normalizeTicker(ticker);
        Mono<List<WeightedItem>> general =
            scoringService.fetchAndScore(ItemQuery.generalMarket(Channel.NEWS, generalMarketQuery));
        Mono<List<WeightedItem>> specific =
            scoringService.fetchAndScore(ItemQuery.forTicker(Channel.NEWS, subject));

        return Mono.zip(general, specific)
            .map(scored -> {
                CategoryScore generalScore = categoryAggregator.aggregate(CategoryLabel.GENERAL_MARKET, scored.getT1());
                CategoryScore specificScore = categoryAggregator.aggregate(CategoryLabel.STOCK_SPECIFIC, scored.getT2());
                int degraded = countDegraded(scored.getT1()) + countDegraded(scored.getT2());
                return new Scored(generalScore, specificScore, degraded);
            })
            .doOnEach(flowLogger.stage(FusionFlowLogger.CATEGORIES_AGGREGATED))
            .flatMap(scored -> FusionTrace.propagate(traceId -> {
                SignalResult<CombinedSentiment> fused =
                    withInferenceNote(combinedFuser.fuse(subject, scored.general(), scored.specific()), scored.degraded());
                flowLogger.logSentiment(fused, traceId);
                return Mono.just(new TickerSentimentReport(
                    subject, fused, scored.general(), scored.specific(), scored.degraded()));
            }));
    }

    /** Fuses caller-supplied channel results; missing channels are renormalized away. */
    public Mono<SignalResult<CombinedSentiment>> fuseMultiChannel(String subject, List<ChannelResult> channelResults) {
        return Mono.fromCallable(() -> channelFuser.fuse(subject, channelResults))
            .doOnEach(flowLogger.stage(FusionFlowLogger.SENTIMENT_FUSED));
    }

    /**
     * Collects every channel for {@code ticker}, aggregates each with {@link ChannelAggregator}
     * and fuses them with the five-tier labelling.
     */
    public Mono<ChannelSentimentReport> analyzeChannels(String ticker) {
        String subject = normalizeTicker(ticker);
        return Flux.fromArray(Channel.values())
            .flatMapSequential(channel -> scoringService.fetchAndScore(ItemQuery.forTicker(channel, subject))
                .map(items -> channelAggregator.aggregate(channel, items)))
            .collectList()
            .doOnEach(flowLogger.stage(FusionFlowLogger.CATEGORIES_AGGREGATED))
            .flatMap(channels -> FusionTrace.propagate(traceId -> {
                SignalResult<CombinedSentiment> fused = channelFuser.fuse(subject, channels);
                flowLogger.logSentiment(fused, traceId);
                return Mono.just(new ChannelSentimentReport(subject, fused, channels));
            }));
    }

    private static SignalResult<CombinedSentiment> withInferenceNote(SignalResult<CombinedSentiment> fused, int degraded) {
        if (degraded == 0 || !fused.isAvailable()) {
            return fused;
        }
        String note = degraded + " item(s) scored without a model reading";
        String reason = fused.reason() == null ? note : fused.reason() + "; " + note;
        return SignalResult.degraded(fused.value(), reason);
    }

    private static int countDegraded(List<WeightedItem> items) {
        return (int) items.stream().filter(i -> i.item().degraded()).count();
    }

    static String normalizeTicker(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw FusionException.invalidRequest("SentimentFusionService", "ticker", "ticker is required");
        }
        return ticker.trim().toUpperCase(Locale.ROOT);
    }

    private record Scored(CategoryScore general, CategoryScore specific, int degraded) {}
}
