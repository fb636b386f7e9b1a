package com.signalfusion.fusion.adapter;

import com.signalfusion.common.model.SourceItem;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of raw items for one channel. Implementations never signal an error for an
 * unreachable source: they emit an empty list, which downstream reads as "no data".
 */
public interface ItemFetcher {

    Mono<List<SourceItem>> fetch(ItemQuery query);
}
