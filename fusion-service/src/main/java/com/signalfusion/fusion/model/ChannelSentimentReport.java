package com.signalfusion.fusion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalfusion.common.model.ChannelResult;
import com.signalfusion.common.model.CombinedSentiment;
import com.signalfusion.common.model.SignalResult;

import java.util.List;

/**
 * Five-tier multi-channel sentiment for one ticker, with one entry per channel
 * (channels without items carry {@code itemCount == 0}).
 */
public record ChannelSentimentReport(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("sentiment") SignalResult<CombinedSentiment> sentiment,
    @JsonProperty("channels") List<ChannelResult> channels
) {
    public ChannelSentimentReport {
        channels = channels == null ? List.of() : List.copyOf(channels);
    }
}
