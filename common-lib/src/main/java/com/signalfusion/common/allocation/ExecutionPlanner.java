package com.signalfusion.common.allocation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Derives buy orders and monitoring triggers from a final allocation.
 *
 * <p>One BUY step per stock; priority HIGH when the stock score exceeds 0.1. Steps run
 * HIGH first, larger amounts first within a priority, and are numbered after ordering.
 */
public final class ExecutionPlanner {

    public static final double DEFAULT_COMMISSION_PER_TRADE = 10.0;
    public static final String DEFAULT_TIMELINE = "1-2 trading days";

    private static final double HIGH_PRIORITY_SCORE = 0.1;

    private final double commissionPerTrade;

    public ExecutionPlanner() {
        this(DEFAULT_COMMISSION_PER_TRADE);
    }

    public ExecutionPlanner(double commissionPerTrade) {
        this.commissionPerTrade = Math.max(0.0, commissionPerTrade);
    }

    public ExecutionPlan plan(PortfolioAllocation allocation) {
        List<ExecutionStep> unordered = new ArrayList<>();
        for (SectorAllocation sector : allocation.sectors()) {
            for (StockAllocation stock : sector.stocks()) {
                ExecutionPriority priority = stock.score() > HIGH_PRIORITY_SCORE
                    ? ExecutionPriority.HIGH : ExecutionPriority.MEDIUM;
                unordered.add(new ExecutionStep(0, "BUY", stock.ticker(), sector.sectorId(),
                    stock.amount(), stock.percentage(), priority));
            }
        }
        unordered.sort(Comparator
            .comparing((ExecutionStep s) -> s.priority() == ExecutionPriority.HIGH ? 0 : 1)
            .thenComparing(Comparator.comparingDouble(ExecutionStep::amount).reversed()));

        List<ExecutionStep> steps = new ArrayList<>(unordered.size());
        double total = 0.0;
        for (int i = 0; i < unordered.size(); i++) {
            ExecutionStep s = unordered.get(i);
            steps.add(new ExecutionStep(i + 1, s.action(), s.ticker(), s.sectorId(),
                s.amount(), s.percentage(), s.priority()));
            total += s.amount();
        }
        return new ExecutionPlan(steps, total, steps.size() * commissionPerTrade, DEFAULT_TIMELINE);
    }

    public List<MonitoringAlert> monitoringAlerts(PortfolioAllocation allocation) {
        List<MonitoringAlert> alerts = new ArrayList<>();
        for (SectorAllocation sector : allocation.sectors()) {
            for (StockAllocation stock : sector.stocks()) {
                alerts.add(new MonitoringAlert(stock.ticker(), "sentiment_change",
                    "Monitor if sentiment drops below -0.2", "Consider reducing position if sustained"));
                alerts.add(new MonitoringAlert(stock.ticker(), "price_movement",
                    "Alert on 10%+ daily move", "Reassess position sizing"));
            }
        }
        alerts.add(new MonitoringAlert(null, "sector_rotation",
            "Weekly sector sentiment analysis", "Rebalance if sector rankings change significantly"));
        return alerts;
    }
}
