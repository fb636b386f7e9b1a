package com.signalfusion.common.allocation;

import com.signalfusion.common.exception.FusionException;
import com.signalfusion.common.sector.RankedSector;
import com.signalfusion.common.sector.SectorRanking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Turns a sector ranking plus per-stock sentiment into dollar allocations.
 *
 * <h3>Selection</h3>
 * Sectors are taken in ranking order, keeping those the {@link RiskTolerance} admits and
 * that have at least one stock score, up to {@code maxSectors}. Within a sector, stocks are
 * ordered by {@code score × confidence} and capped at {@code stocksPerSector}.
 *
 * <h3>Weights</h3>
 * <pre>
 *   raw_i    = (1/n) × equalWeight + score_i × confidence_i × performanceWeight / n
 *   weight_i = max(0, raw_i) / Σ max(0, raw_j)          (equal weights if every raw_j ≤ 0)
 *   sectorAmount = portfolioSize × sectorWeight
 *   stockAmount  = sectorAmount  × stockWeight
 * </pre>
 * The raw blend is not normalized across sectors, so the final renormalization is what
 * makes sector amounts sum to {@code portfolioSize} and stock amounts to their sector.
 * The last sector and the last stock of each sector take the remainder, so rounding never
 * leaves the totals apart, whatever the portfolio size.
 */
public final class PortfolioAllocator {

    public PortfolioAllocation allocate(SectorRanking ranking,
                                        Map<String, List<StockScore>> stockScoresBySector,
                                        RiskTolerance riskTolerance,
                                        double portfolioSize,
                                        int maxSectors,
                                        int stocksPerSector) {
        validate(riskTolerance, portfolioSize, maxSectors, stocksPerSector);
        if (ranking == null || ranking.isEmpty() || stockScoresBySector == null) {
            return new PortfolioAllocation(riskTolerance, portfolioSize, List.of());
        }

        List<RankedSector> selected = new ArrayList<>();
        List<List<StockScore>> selectedStocks = new ArrayList<>();
        for (RankedSector sector : ranking.rankings()) {
            if (selected.size() >= maxSectors) break;
            if (!riskTolerance.accepts(sector)) continue;
            List<StockScore> stocks = topStocks(stockScoresBySector.get(sector.sectorId()), stocksPerSector);
            if (stocks.isEmpty()) continue;
            selected.add(sector);
            selectedStocks.add(stocks);
        }
        if (selected.isEmpty()) {
            return new PortfolioAllocation(riskTolerance, portfolioSize, List.of());
        }

        double[] sectorAmounts = split(portfolioSize, weights(selected, s -> s.score() * s.confidence(), riskTolerance));
        List<SectorAllocation> allocations = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            RankedSector sector = selected.get(i);
            double sectorAmount = sectorAmounts[i];

            List<StockScore> stocks = selectedStocks.get(i);
            double[] stockAmounts = split(sectorAmount, weights(stocks, StockScore::rankingKey, riskTolerance));
            List<StockAllocation> stockAllocations = new ArrayList<>(stocks.size());
            for (int j = 0; j < stocks.size(); j++) {
                StockScore stock = stocks.get(j);
                double amount = stockAmounts[j];
                stockAllocations.add(new StockAllocation(
                    stock.ticker(),
                    stock.score(),
                    stock.confidence(),
                    amount,
                    amount / portfolioSize * 100.0,
                    StockRecommendation.of(stock.score(), stock.confidence())));
            }

            allocations.add(new SectorAllocation(
                sector.sectorId(),
                sector.etfTicker(),
                sector.score(),
                sector.confidence(),
                sectorAmount,
                sectorAmount / portfolioSize * 100.0,
                stockAllocations));
        }
        return new PortfolioAllocation(riskTolerance, portfolioSize, allocations);
    }

    private static List<StockScore> topStocks(List<StockScore> scores, int limit) {
        if (scores == null || scores.isEmpty()) {
            return List.of();
        }
        return scores.stream()
            .sorted(Comparator.comparingDouble(StockScore::rankingKey).reversed()
                .thenComparing(StockScore::ticker))
            .limit(limit)
            .toList();
    }

    private static <T> double[] weights(List<T> members, ToDoubleFunction<T> performance, RiskTolerance tolerance) {
        int n = members.size();
        double base = 1.0 / n;
        double[] raw = new double[n];
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            double weight = base * tolerance.equalWeight()
                + performance.applyAsDouble(members.get(i)) * tolerance.performanceWeight() / n;
            raw[i] = Math.max(0.0, weight);
            total += raw[i];
        }
        for (int i = 0; i < n; i++) {
            raw[i] = total > 0.0 ? raw[i] / total : base;
        }
        return raw;
    }

    private static double[] split(double total, double[] weights) {
        double[] amounts = new double[weights.length];
        double assigned = 0.0;
        int last = weights.length - 1;
        for (int i = 0; i < last; i++) {
            amounts[i] = total * weights[i];
            assigned += amounts[i];
        }
        amounts[last] = Math.max(0.0, total - assigned);
        return amounts;
    }

    private static void validate(RiskTolerance riskTolerance, double portfolioSize, int maxSectors, int stocksPerSector) {
        if (riskTolerance == null) {
            throw FusionException.invalidRequest("PortfolioAllocator", "riskTolerance", "riskTolerance is required");
        }
        if (!(portfolioSize > 0.0) || Double.isInfinite(portfolioSize)) {
            throw FusionException.invalidField("PortfolioAllocator", "portfolioSize", portfolioSize, "positive and finite");
        }
        if (maxSectors < 1) {
            throw FusionException.invalidField("PortfolioAllocator", "maxSectors", maxSectors, ">= 1");
        }
        if (stocksPerSector < 1) {
            throw FusionException.invalidField("PortfolioAllocator", "stocksPerSector", stocksPerSector, ">= 1");
        }
    }
}
