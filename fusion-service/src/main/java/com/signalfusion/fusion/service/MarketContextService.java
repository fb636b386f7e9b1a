package com.signalfusion.fusion.service;

import com.signalfusion.common.economic.EconomicContextAssessor;
import com.signalfusion.common.economic.EconomicIndicators;
import com.signalfusion.common.economic.EconomicRisk;
import com.signalfusion.common.model.SignalResult;
import com.signalfusion.fusion.adapter.IndicatorFetcher;
import com.signalfusion.fusion.logger.FusionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Economic backdrop: VIX, inflation, unemployment, fed funds rate and consumer sentiment
 * scored into a {@link com.signalfusion.common.economic.MarketCondition}.
 */
@Service
public class MarketContextService {

    private static final Logger log = LoggerFactory.getLogger(MarketContextService.class);

    private final IndicatorFetcher indicatorFetcher;
    private final EconomicContextAssessor assessor;
    private final FusionFlowLogger flowLogger;

    public MarketContextService(IndicatorFetcher indicatorFetcher,
                                EconomicContextAssessor assessor,
                                FusionFlowLogger flowLogger) {
        this.indicatorFetcher = indicatorFetcher;
        this.assessor         = assessor;
        this.flowLogger       = flowLogger;
    }

    /** Scores the indicators currently published by the gateway. */
    public Mono<SignalResult<EconomicRisk>> assessMarketContext() {
        return indicatorFetcher.fetch()
            .defaultIfEmpty(EconomicIndicators.none())
            .flatMap(this::assessMarketContext);
    }

    /** Scores caller-supplied indicators; absent ones are defaulted. */
    public Mono<SignalResult<EconomicRisk>> assessMarketContext(EconomicIndicators indicators) {
        return Mono.fromCallable(() -> assessor.assess(indicators))
            .doOnNext(result -> log.info("Market context assessed. status={} condition={} riskScore={} defaulted={}",
                result.status(), result.value().condition(), result.value().riskScore(),
                result.value().defaultedIndicators()))
            .doOnEach(flowLogger.stage(FusionFlowLogger.MARKET_CONTEXT_ASSESSED));
    }
}
