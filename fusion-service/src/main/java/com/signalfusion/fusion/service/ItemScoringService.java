package com.signalfusion.fusion.service;

import com.signalfusion.common.model.SourceItem;
import com.signalfusion.common.model.WeightedItem;
import com.signalfusion.common.scoring.ItemAnalyzer;
import com.signalfusion.fusion.adapter.ItemFetcher;
import com.signalfusion.fusion.adapter.ItemQuery;
import com.signalfusion.fusion.config.FusionProperties;
import com.signalfusion.fusion.logger.FusionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Fetches items for one channel/scope and scores them in parallel.
 *
 * <p>Each item is analysed on {@code boundedElastic} because the sentiment capability
 * blocks on inference. All items of one call share the same reference instant so that
 * recency weights are comparable.
 */
@Service
public class ItemScoringService {

    private static final Logger log = LoggerFactory.getLogger(ItemScoringService.class);

    private final ItemFetcher itemFetcher;
    private final ItemAnalyzer itemAnalyzer;
    private final FusionFlowLogger flowLogger;
    private final Clock clock;
    private final int concurrency;

    public ItemScoringService(ItemFetcher itemFetcher,
                              ItemAnalyzer itemAnalyzer,
                              FusionFlowLogger flowLogger,
                              Clock clock,
                              FusionProperties properties) {
        this.itemFetcher  = itemFetcher;
        this.itemAnalyzer = itemAnalyzer;
        this.flowLogger   = flowLogger;
        this.clock        = clock;
        this.concurrency  = properties.getInference().getConcurrency();
    }

    public Mono<List<WeightedItem>> fetchAndScore(ItemQuery query) {
        return itemFetcher.fetch(query)
            .defaultIfEmpty(List.of())
            .doOnEach(flowLogger.stage(FusionFlowLogger.ITEMS_FETCHED))
            .flatMap(this::scoreAll);
    }

    public Mono<List<WeightedItem>> scoreAll(List<SourceItem> items) {
        if (items.isEmpty()) {
            return Mono.just(List.of());
        }
        Instant now = clock.instant();
        log.info("Scoring {} items in parallel", items.size());
        return Flux.fromIterable(items)
            .flatMap(item -> Mono.fromCallable(() -> itemAnalyzer.analyze(item, now))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("Item scoring failed, dropping item. source={}", item.source(), e);
                    return Mono.empty();
                }), concurrency)
            .collectList()
            .doOnEach(flowLogger.stage(FusionFlowLogger.ITEMS_SCORED));
    }
}
