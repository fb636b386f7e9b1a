package com.signalfusion.fusion.adapter;

import com.signalfusion.common.economic.EconomicIndicators;
import com.signalfusion.common.trace.FusionTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Reads economic indicators from the gateway ({@code GET /api/v1/indicators}).
 * Partial bodies are fine: absent fields stay {@code null} and are defaulted when scored.
 */
@Component
public class RemoteIndicatorFetcher implements IndicatorFetcher {

    private static final Logger log = LoggerFactory.getLogger(RemoteIndicatorFetcher.class);

    private final WebClient gatewayClient;

    public RemoteIndicatorFetcher(@Qualifier("gatewayWebClient") WebClient gatewayClient) {
        this.gatewayClient = gatewayClient;
    }

    @Override
    public Mono<EconomicIndicators> fetch() {
        return FusionTrace.propagate(traceId -> gatewayClient.get()
            .uri("/api/v1/indicators")
            .header(FusionTrace.HEADER, traceId)
            .retrieve()
            .bodyToMono(EconomicIndicators.class)
            .defaultIfEmpty(EconomicIndicators.none())
            .doOnNext(indicators -> log.debug("Indicators fetched. missing={} traceId={}",
                indicators.missing(), traceId))
            .onErrorResume(e -> {
                log.warn("Indicator fetch failed, scoring at defaults. traceId={} reason={}", traceId, e.getMessage());
                return Mono.just(EconomicIndicators.none());
            }));
    }
}
