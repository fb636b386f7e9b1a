package com.signalfusion.common.economic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Latest macro readings. Any field may be {@code null} when the provider had no value;
 * {@link #resolved()} fills those with long-run neutral defaults.
 *
 * @param vix               CBOE volatility index
 * @param inflation         CPI inflation, percent
 * @param unemployment      unemployment rate, percent
 * @param fedFundsRate      effective federal funds rate, percent
 * @param consumerSentiment University of Michigan consumer sentiment index
 */
public record EconomicIndicators(
    @JsonProperty("vix") Double vix,
    @JsonProperty("inflation") Double inflation,
    @JsonProperty("unemployment") Double unemployment,
    @JsonProperty("fedFundsRate") Double fedFundsRate,
    @JsonProperty("consumerSentiment") Double consumerSentiment
) {
    public static final int COUNT = 5;
    public static final EconomicIndicators DEFAULTS = new EconomicIndicators(20.0, 3.0, 4.0, 5.0, 80.0);

    public static EconomicIndicators none() {
        return new EconomicIndicators(null, null, null, null, null);
    }

    /** Names of the fields that are absent or not finite, in declaration order. */
    @JsonIgnore
    public List<String> missing() {
        List<String> missing = new ArrayList<>(COUNT);
        if (!usable(vix)) missing.add("vix");
        if (!usable(inflation)) missing.add("inflation");
        if (!usable(unemployment)) missing.add("unemployment");
        if (!usable(fedFundsRate)) missing.add("fedFundsRate");
        if (!usable(consumerSentiment)) missing.add("consumerSentiment");
        return missing;
    }

    public EconomicIndicators resolved() {
        return new EconomicIndicators(
            usable(vix) ? vix : DEFAULTS.vix,
            usable(inflation) ? inflation : DEFAULTS.inflation,
            usable(unemployment) ? unemployment : DEFAULTS.unemployment,
            usable(fedFundsRate) ? fedFundsRate : DEFAULTS.fedFundsRate,
            usable(consumerSentiment) ? consumerSentiment : DEFAULTS.consumerSentiment);
    }

    private static boolean usable(Double value) {
        return value != null && Double.isFinite(value);
    }
}
