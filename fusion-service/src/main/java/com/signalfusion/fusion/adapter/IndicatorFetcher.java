package com.signalfusion.fusion.adapter;

import com.signalfusion.common.economic.EconomicIndicators;
import reactor.core.publisher.Mono;

/**
 * Source of the latest macro readings. An unreachable provider yields
 * {@link EconomicIndicators#none()}, never an error signal.
 */
public interface IndicatorFetcher {

    Mono<EconomicIndicators> fetch();
}
