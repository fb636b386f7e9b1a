package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Independently produced sentiment of one channel. A channel that produced no items
 * has {@code itemCount == 0} and is excluded from fusion rather than read as a zero score.
 */
public record ChannelResult(
    @JsonProperty("channel") Channel channel,
    @JsonProperty("score") double score,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("itemCount") int itemCount
) {
    public ChannelResult {
        if (channel == null) {
            throw new IllegalArgumentException("channel is required");
        }
        if (score < -1.0 || score > 1.0) {
            throw new IllegalArgumentException("score out of [-1,1]: " + score);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        if (itemCount < 0) {
            throw new IllegalArgumentException("itemCount must be >= 0: " + itemCount);
        }
    }

    public static ChannelResult absent(Channel channel) {
        return new ChannelResult(channel, 0.0, 0.0, 0);
    }

    public boolean hasData() {
        return itemCount > 0;
    }
}
