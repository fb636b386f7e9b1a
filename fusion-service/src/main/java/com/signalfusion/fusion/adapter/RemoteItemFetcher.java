package com.signalfusion.fusion.adapter;

import com.signalfusion.common.model.SourceItem;
import com.signalfusion.common.trace.FusionTrace;
import com.signalfusion.fusion.config.FusionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fetches news, forum and microblog items from the item gateway.
 *
 * <p>Errors fall back to an empty list so that one unreachable channel only removes that
 * channel from fusion instead of failing the request. The traceId is taken from the
 * Reactor Context and forwarded as {@link FusionTrace#HEADER}.
 */
@Component
public class RemoteItemFetcher implements ItemFetcher {

    private static final Logger log = LoggerFactory.getLogger(RemoteItemFetcher.class);
    private static final ParameterizedTypeReference<List<SourceItem>> ITEM_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient gatewayClient;
    private final int itemLimit;

    public RemoteItemFetcher(@Qualifier("gatewayWebClient") WebClient gatewayClient, FusionProperties properties) {
        this.gatewayClient = gatewayClient;
        this.itemLimit     = properties.getGateway().getItemLimit();
    }

    @Override
    public Mono<List<SourceItem>> fetch(ItemQuery query) {
        return FusionTrace.propagate(traceId -> gatewayClient.get()
            .uri(uri -> {
                uri.path("/api/v1/items")
                    .queryParam("channel", query.channel().code())
                    .queryParam("limit", itemLimit);
                if (query.isTickerScoped()) {
                    uri.queryParam("ticker", query.ticker());
                } else {
                    uri.queryParam("query", query.query());
                }
                return uri.build();
            })
            .header(FusionTrace.HEADER, traceId)
            .retrieve()
            .bodyToMono(ITEM_LIST)
            .defaultIfEmpty(List.of())
            .doOnNext(items -> log.debug("Items fetched. channel={} scope={} count={} traceId={}",
                query.channel().code(), query.scope(), items.size(), traceId))
            .onErrorResume(e -> {
                log.warn("Item fetch failed, treating channel as empty. channel={} scope={} traceId={} reason={}",
                    query.channel().code(), query.scope(), traceId, e.getMessage());
                return Mono.just(List.of());
            }));
    }
}
