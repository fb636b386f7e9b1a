package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Follow-up trigger for a held position, or for the portfolio as a whole when
 * {@code ticker} is absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonitoringAlert(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("alertType") String alertType,
    @JsonProperty("threshold") String threshold,
    @JsonProperty("action") String action
) {}
