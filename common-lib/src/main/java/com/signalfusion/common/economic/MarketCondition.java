package com.signalfusion.common.economic;

/**
 * Macro backdrop derived from the economic risk score, with the positioning it calls for.
 */
public enum MarketCondition {
    RISK_ON(0, "Risk-On - Growth Opportunities",
        "Growth-oriented strategy: consider technology, growth stocks, and cyclical sectors."),
    LOW_RISK(2, "Low Risk - Selective Opportunities",
        "Selective growth opportunities: focus on quality stocks with strong fundamentals."),
    MODERATE_RISK(4, "Moderate Risk - Cautious Approach",
        "Balanced approach: mix of defensive and growth stocks. Monitor economic indicators closely."),
    HIGH_RISK(6, "High Risk - Defensive Strategy",
        "Focus on defensive assets: bonds, utilities, consumer staples. Consider hedging strategies.");

    private final int minRiskScore;
    private final String description;
    private final String recommendation;

    MarketCondition(int minRiskScore, String description, String recommendation) {
        this.minRiskScore   = minRiskScore;
        this.description    = description;
        this.recommendation = recommendation;
    }

    public static MarketCondition forRiskScore(int riskScore) {
        MarketCondition condition = RISK_ON;
        for (MarketCondition candidate : values()) {
            if (riskScore >= candidate.minRiskScore) condition = candidate;
        }
        return condition;
    }

    public int minRiskScore() {
        return minRiskScore;
    }

    public String description() {
        return description;
    }

    public String recommendation() {
        return recommendation;
    }
}
