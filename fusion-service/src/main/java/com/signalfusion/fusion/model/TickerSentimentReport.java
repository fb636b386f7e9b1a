package com.signalfusion.fusion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalfusion.common.model.CategoryScore;
import com.signalfusion.common.model.CombinedSentiment;
import com.signalfusion.common.model.SignalResult;

/**
 * Combined news sentiment for one ticker plus the two category scores it was fused from.
 *
 * @param degradedItems items whose finance or general model call failed
 */
public record TickerSentimentReport(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("sentiment") SignalResult<CombinedSentiment> sentiment,
    @JsonProperty("generalMarket") CategoryScore generalMarket,
    @JsonProperty("stockSpecific") CategoryScore stockSpecific,
    @JsonProperty("degradedItems") int degradedItems
) {}
