package com.signalfusion.common.economic;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Scored macro backdrop.
 *
 * @param riskScore           sum of the per-indicator risk points, 0..11
 * @param riskDetails         one line per indicator that scored any points
 * @param indicators          the values actually scored, defaults included
 * @param defaultedIndicators indicators that were missing and scored at their default
 */
public record EconomicRisk(
    @JsonProperty("condition") MarketCondition condition,
    @JsonProperty("riskScore") int riskScore,
    @JsonProperty("riskDetails") List<String> riskDetails,
    @JsonProperty("indicators") EconomicIndicators indicators,
    @JsonProperty("defaultedIndicators") List<String> defaultedIndicators
) {
    public EconomicRisk {
        if (riskScore < 0) {
            throw new IllegalArgumentException("riskScore must be >= 0 but was " + riskScore);
        }
        riskDetails = riskDetails == null ? List.of() : List.copyOf(riskDetails);
        defaultedIndicators = defaultedIndicators == null ? List.of() : List.copyOf(defaultedIndicators);
    }

    @JsonProperty(value = "description", access = JsonProperty.Access.READ_ONLY)
    public String description() {
        return condition.description();
    }

    @JsonProperty(value = "recommendation", access = JsonProperty.Access.READ_ONLY)
    public String recommendation() {
        return condition.recommendation();
    }
}
