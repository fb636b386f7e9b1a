package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.signalfusion.common.exception.FusionException;
import com.signalfusion.common.sector.RankedSector;

import java.util.Locale;

/**
 * Risk-tolerance presets. Each preset fixes how much of an allocation is spread evenly
 * versus skewed towards sentiment performance, and which sectors are admissible at all.
 *
 * <pre>
 *   preset        equal  performance  sector filter
 *   conservative  0.8    0.2          confidence ≥ 0.5 and score ≥ 0
 *   moderate      0.6    0.4          confidence ≥ 0.3 and score ≥ −0.1
 *   aggressive    0.4    0.6          confidence ≥ 0.2
 * </pre>
 */
public enum RiskTolerance {
    CONSERVATIVE(0.8, 0.2, 0.5, 0.0),
    MODERATE(0.6, 0.4, 0.3, -0.1),
    AGGRESSIVE(0.4, 0.6, 0.2, Double.NEGATIVE_INFINITY);

    private final double equalWeight;
    private final double performanceWeight;
    private final double minConfidence;
    private final double minScore;

    RiskTolerance(double equalWeight, double performanceWeight, double minConfidence, double minScore) {
        this.equalWeight       = equalWeight;
        this.performanceWeight = performanceWeight;
        this.minConfidence     = minConfidence;
        this.minScore          = minScore;
    }

    public double equalWeight() {
        return equalWeight;
    }

    public double performanceWeight() {
        return performanceWeight;
    }

    public boolean accepts(RankedSector sector) {
        return sector.confidence() >= minConfidence && sector.score() >= minScore;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RiskTolerance from(String value) {
        if (value != null) {
            for (RiskTolerance tolerance : values()) {
                if (tolerance.name().equalsIgnoreCase(value.trim())) {
                    return tolerance;
                }
            }
        }
        throw FusionException.invalidRequest("RiskTolerance", "riskTolerance",
            "unknown risk tolerance '" + value + "', expected conservative, moderate or aggressive");
    }
}
