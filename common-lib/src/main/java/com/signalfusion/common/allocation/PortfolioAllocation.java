package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of {@link PortfolioAllocator#allocate}. When any sector was selected the sector
 * amounts reconcile with {@code portfolioSize} to within a cent. No admissible sector is
 * a valid outcome: {@code sectors} is then empty.
 */
public record PortfolioAllocation(
    @JsonProperty("riskTolerance") RiskTolerance riskTolerance,
    @JsonProperty("portfolioSize") double portfolioSize,
    @JsonProperty("sectors") List<SectorAllocation> sectors
) {
    public PortfolioAllocation {
        sectors = sectors == null ? List.of() : List.copyOf(sectors);
        if (!sectors.isEmpty()) {
            double sum = sectors.stream().mapToDouble(SectorAllocation::amount).sum();
            if (Math.abs(sum - portfolioSize) >= SectorAllocation.reconcileTolerance(portfolioSize)) {
                throw new IllegalArgumentException(
                    "sector allocations sum to " + sum + " but portfolio size is " + portfolioSize);
            }
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sectors.isEmpty();
    }

    @JsonProperty(value = "totalPositions", access = JsonProperty.Access.READ_ONLY)
    public int totalPositions() {
        return sectors.stream().mapToInt(s -> s.stocks().size()).sum();
    }
}
