package com.signalfusion.common.allocation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskAssessorTest {

    private final RiskAssessor assessor = new RiskAssessor();

    /** Sector holding {@code percentage} of a 100k portfolio, split evenly over the given scores. */
    static SectorAllocation sector(String id, double percentage, double... stockScores) {
        double amount = percentage * 1_000;
        List<StockAllocation> stocks = new ArrayList<>();
        for (int i = 0; i < stockScores.length; i++) {
            double share = amount / stockScores.length;
            stocks.add(new StockAllocation(id + i, stockScores[i], 0.8, share, share / 1_000,
                StockRecommendation.of(stockScores[i], 0.8)));
        }
        return new SectorAllocation(id, "ETF", 0.2, 0.8, amount, percentage, stocks);
    }

    @Nested
    @DisplayName("assess() — metrics")
    class MetricTests {

        @Test
        @DisplayName("three balanced sectors, six positions → MEDIUM on concentration")
        void balancedPortfolio() {
            double third = 100.0 / 3;
            PortfolioRiskAssessment assessment = assessor.assess(List.of(
                sector("a", third, 0.1, 0.3), sector("b", third, 0.2, 0.2), sector("c", third, 0.0, 0.4)));

            assertEquals(RiskTier.MEDIUM, assessment.riskTier());
            assertEquals(6, assessment.totalPositions());
            assertEquals(40.0, assessment.diversificationScore(), 1e-9);
            assertEquals(third, assessment.sectorConcentrationPct(), 1e-9);
            assertEquals(0.2, assessment.averageSentiment(), 1e-9);
            double variance = (0.01 + 0.01 + 0 + 0 + 0.04 + 0.04) / 6;
            assertEquals(Math.sqrt(variance), assessment.sentimentStdDev(), 1e-9);
            assertEquals(1 - Math.sqrt(variance), assessment.sentimentConsistency(), 1e-9);
            assertTrue(assessment.advice().contains("Monitor sector concentration risk"));
            assertFalse(assessment.advice().contains("Consider increasing diversification"));
        }

        @Test
        @DisplayName("single concentrated sector with two stocks → HIGH with targeted advice")
        void concentratedPortfolio() {
            PortfolioRiskAssessment assessment = assessor.assess(List.of(sector("a", 100.0, 0.3, 0.3)));

            assertEquals(RiskTier.HIGH, assessment.riskTier());
            assertEquals(List.of(
                "Consider increasing diversification",
                "Reduce sector concentration below 30%",
                "Consider adding more positions to reduce single-stock risk",
                "Monitor sector concentration risk",
                "Set stop-loss orders at 5-10% below entry points",
                "Review and rebalance portfolio monthly"), assessment.advice());
        }

        @Test
        @DisplayName("well spread portfolio with consistent sentiment → LOW")
        void lowRisk() {
            List<SectorAllocation> sectors = new ArrayList<>();
            for (int i = 0; i < 5; i++) sectors.add(sector("s" + i, 20.0, 0.2, 0.25, 0.3));
            PortfolioRiskAssessment assessment = assessor.assess(sectors);

            assertEquals(RiskTier.LOW, assessment.riskTier());
            assertEquals(100.0, assessment.diversificationScore(), 1e-9);
            assertEquals(2, assessment.advice().size());
        }

        @Test
        @DisplayName("empty allocation → LOW, no positions")
        void emptyAllocation() {
            PortfolioRiskAssessment assessment = assessor.assess(List.of());
            assertEquals(RiskTier.LOW, assessment.riskTier());
            assertEquals(0, assessment.totalPositions());
            assertFalse(assessment.advice().isEmpty());
        }
    }

    @Nested
    @DisplayName("tierOf() — thresholds")
    class TierTests {

        @Test
        @DisplayName("raising concentration past 40% never lowers the tier (positions ≥ 5)")
        void concentrationMonotonic() {
            for (int positions = 5; positions <= 20; positions += 5) {
                for (double stdDev : new double[] {0.0, 0.2, 0.5}) {
                    RiskTier previous = RiskTier.LOW;
                    for (double concentration = 10.0; concentration <= 100.0; concentration += 2.5) {
                        RiskTier tier = RiskAssessor.tierOf(concentration, positions, stdDev);
                        assertTrue(tier.ordinal() >= previous.ordinal(),
                            "tier fell at concentration " + concentration);
                        previous = tier;
                    }
                    assertEquals(RiskTier.HIGH, previous);
                }
            }
        }

        @Test
        @DisplayName("fewer than five positions is HIGH; dispersion alone makes MEDIUM")
        void positionsAndDispersion() {
            assertEquals(RiskTier.HIGH, RiskAssessor.tierOf(10.0, 4, 0.0));
            assertEquals(RiskTier.MEDIUM, RiskAssessor.tierOf(10.0, 10, 0.31));
            assertEquals(RiskTier.LOW, RiskAssessor.tierOf(25.0, 10, 0.3));
        }
    }
}
