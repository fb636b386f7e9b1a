package com.signalfusion.fusion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalfusion.common.model.ChannelResult;

import java.util.List;

public record ChannelFusionRequest(
    @JsonProperty("subject") String subject,
    @JsonProperty("channels") List<ChannelResult> channels
) {
    public ChannelFusionRequest {
        subject = subject == null || subject.isBlank() ? "unknown" : subject.trim();
        channels = channels == null ? List.of() : List.copyOf(channels);
    }
}
