package com.signalfusion.common.sector;

/**
 * Portfolio tilt relative to an equal-weight benchmark.
 */
public enum SectorTier {
    OVERWEIGHT,
    NEUTRAL,
    UNDERWEIGHT;

    public String code() {
        return name().toLowerCase();
    }
}
