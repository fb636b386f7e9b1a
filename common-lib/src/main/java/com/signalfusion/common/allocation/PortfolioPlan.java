package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything {@code allocatePortfolio} returns: the allocation, its risk assessment,
 * the buy orders that realise it and the triggers to watch afterwards.
 */
public record PortfolioPlan(
    @JsonProperty("allocation") PortfolioAllocation allocation,
    @JsonProperty("riskAssessment") PortfolioRiskAssessment riskAssessment,
    @JsonProperty("executionPlan") ExecutionPlan executionPlan,
    @JsonProperty("monitoringAlerts") List<MonitoringAlert> monitoringAlerts
) {
    public PortfolioPlan {
        monitoringAlerts = monitoringAlerts == null ? List.of() : List.copyOf(monitoringAlerts);
    }
}
