package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Dollar allocation of one selected sector and its stocks.
 * The stock amounts reconcile with the sector amount to within a cent, or to within a
 * relative 1e-12 once the amount is large enough for a cent to be below double precision.
 */
public record SectorAllocation(
    @JsonProperty("sectorId") String sectorId,
    @JsonProperty("etfTicker") String etfTicker,
    @JsonProperty("sectorScore") double sectorScore,
    @JsonProperty("sectorConfidence") double sectorConfidence,
    @JsonProperty("amount") double amount,
    @JsonProperty("percentage") double percentage,
    @JsonProperty("stocks") List<StockAllocation> stocks
) {
    static final double RECONCILE_TOLERANCE = 0.01;
    private static final double RELATIVE_TOLERANCE = 1e-12;

    public SectorAllocation {
        stocks = stocks == null ? List.of() : List.copyOf(stocks);
        if (!stocks.isEmpty()) {
            double sum = stocks.stream().mapToDouble(StockAllocation::amount).sum();
            if (Math.abs(sum - amount) >= reconcileTolerance(amount)) {
                throw new IllegalArgumentException(
                    "stock allocations of " + sectorId + " sum to " + sum + " but sector holds " + amount);
            }
        }
    }

    /** Cent tolerance, widened relatively for amounts where a cent is below one ulp. */
    static double reconcileTolerance(double total) {
        return Math.max(RECONCILE_TOLERANCE, Math.abs(total) * RELATIVE_TOLERANCE);
    }
}
