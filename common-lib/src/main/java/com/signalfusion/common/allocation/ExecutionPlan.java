package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ExecutionPlan(
    @JsonProperty("steps") List<ExecutionStep> steps,
    @JsonProperty("totalInvestment") double totalInvestment,
    @JsonProperty("estimatedCommissions") double estimatedCommissions,
    @JsonProperty("timeline") String timeline
) {
    public ExecutionPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
