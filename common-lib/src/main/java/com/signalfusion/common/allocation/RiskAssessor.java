package com.signalfusion.common.allocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Concentration, diversification and sentiment-dispersion metrics over a final allocation.
 *
 * <pre>
 *   concentration        = max(sector percentage)
 *   diversificationScore = min(100, totalPositions / 15 × 100)
 *   HIGH   if concentration &gt; 40 or totalPositions &lt; 5
 *   MEDIUM if concentration &gt; 25 or stdDev &gt; 0.3
 *   LOW    otherwise
 * </pre>
 */
public final class RiskAssessor {

    private static final double HIGH_CONCENTRATION    = 40.0;
    private static final double MEDIUM_CONCENTRATION  = 25.0;
    private static final double WATCH_CONCENTRATION   = 30.0;
    private static final int    MIN_POSITIONS         = 5;
    private static final double MEDIUM_STD_DEV        = 0.3;
    private static final double FULL_DIVERSIFICATION  = 15.0;

    public PortfolioRiskAssessment assess(PortfolioAllocation allocation) {
        return assess(allocation != null ? allocation.sectors() : List.of());
    }

    public PortfolioRiskAssessment assess(List<SectorAllocation> sectors) {
        if (sectors == null || sectors.isEmpty()) {
            return PortfolioRiskAssessment.empty();
        }

        double concentration = 0.0;
        List<Double> scores = new ArrayList<>();
        for (SectorAllocation sector : sectors) {
            concentration = Math.max(concentration, sector.percentage());
            sector.stocks().forEach(stock -> scores.add(stock.score()));
        }
        int positions = scores.size();

        double mean = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = scores.stream().mapToDouble(s -> (s - mean) * (s - mean)).average().orElse(0.0);
        double stdDev = Math.sqrt(variance);

        RiskTier tier = tierOf(concentration, positions, stdDev);
        return new PortfolioRiskAssessment(
            tier,
            Math.min(100.0, positions / FULL_DIVERSIFICATION * 100.0),
            concentration,
            stdDev,
            mean,
            1.0 - stdDev,
            positions,
            advice(tier, concentration, positions));
    }

    static RiskTier tierOf(double concentration, int positions, double stdDev) {
        if (concentration > HIGH_CONCENTRATION || positions < MIN_POSITIONS) return RiskTier.HIGH;
        if (concentration > MEDIUM_CONCENTRATION || stdDev > MEDIUM_STD_DEV)  return RiskTier.MEDIUM;
        return RiskTier.LOW;
    }

    private static List<String> advice(RiskTier tier, double concentration, int positions) {
        List<String> advice = new ArrayList<>();
        if (tier == RiskTier.HIGH) {
            advice.add("Consider increasing diversification");
            if (concentration > HIGH_CONCENTRATION) {
                advice.add("Reduce sector concentration below 30%");
            }
            if (positions < MIN_POSITIONS) {
                advice.add("Consider adding more positions to reduce single-stock risk");
            }
        }
        if (concentration > WATCH_CONCENTRATION) {
            advice.add("Monitor sector concentration risk");
        }
        advice.add("Set stop-loss orders at 5-10% below entry points");
        advice.add("Review and rebalance portfolio monthly");
        return advice;
    }
}
