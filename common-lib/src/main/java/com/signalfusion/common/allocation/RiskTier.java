package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Portfolio risk tier, ordered from least to most risky.
 */
public enum RiskTier {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
