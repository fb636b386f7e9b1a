package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param step 1-based order of execution
 */
public record ExecutionStep(
    @JsonProperty("step") int step,
    @JsonProperty("action") String action,
    @JsonProperty("ticker") String ticker,
    @JsonProperty("sectorId") String sectorId,
    @JsonProperty("amount") double amount,
    @JsonProperty("percentage") double percentage,
    @JsonProperty("priority") ExecutionPriority priority
) {}
