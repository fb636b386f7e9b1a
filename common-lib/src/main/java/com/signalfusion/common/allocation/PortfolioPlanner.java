package com.signalfusion.common.allocation;

import com.signalfusion.common.sector.SectorRanking;

import java.util.List;
import java.util.Map;

/**
 * Allocation, risk assessment and execution planning in one call.
 */
public final class PortfolioPlanner {

    private final PortfolioAllocator allocator;
    private final RiskAssessor riskAssessor;
    private final ExecutionPlanner executionPlanner;

    public PortfolioPlanner(PortfolioAllocator allocator, RiskAssessor riskAssessor, ExecutionPlanner executionPlanner) {
        this.allocator        = allocator;
        this.riskAssessor     = riskAssessor;
        this.executionPlanner = executionPlanner;
    }

    public PortfolioPlanner() {
        this(new PortfolioAllocator(), new RiskAssessor(), new ExecutionPlanner());
    }

    public PortfolioPlan plan(SectorRanking ranking,
                              Map<String, List<StockScore>> stockScoresBySector,
                              RiskTolerance riskTolerance,
                              double portfolioSize,
                              int maxSectors,
                              int stocksPerSector) {
        PortfolioAllocation allocation = allocator.allocate(
            ranking, stockScoresBySector, riskTolerance, portfolioSize, maxSectors, stocksPerSector);
        return new PortfolioPlan(
            allocation,
            riskAssessor.assess(allocation),
            executionPlanner.plan(allocation),
            executionPlanner.monitoringAlerts(allocation));
    }
}
