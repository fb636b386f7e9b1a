package com.signalfusion.common.scoring;

import com.signalfusion.common.exception.FusionException;
import com.signalfusion.common.model.SentimentReading;

/**
 * Blends the finance-model and general-model readings of one item, trusting the finance
 * model more on financial text.
 *
 * <pre>
 *   financial:     blended = 0.8 × financeScore + 0.2 × generalScore
 *   non-financial: blended = 0.4 × financeScore + 0.6 × generalScore
 * </pre>
 *
 * <p>The general-model share of each mix is {@code 1 − financeShare}. Pure: no hidden state.
 */
public final class AdaptiveBlender {

    public static final double DEFAULT_FINANCIAL_FINANCE_SHARE     = 0.8;
    public static final double DEFAULT_NON_FINANCIAL_FINANCE_SHARE = 0.4;

    private final double financialFinanceShare;
    private final double nonFinancialFinanceShare;

    public AdaptiveBlender() {
        this(DEFAULT_FINANCIAL_FINANCE_SHARE, DEFAULT_NON_FINANCIAL_FINANCE_SHARE);
    }

    /**
     * @param financialFinanceShare    finance-model share applied to financial items
     * @param nonFinancialFinanceShare finance-model share applied to all other items
     */
    public AdaptiveBlender(double financialFinanceShare, double nonFinancialFinanceShare) {
        requireShare("financialFinanceShare", financialFinanceShare);
        requireShare("nonFinancialFinanceShare", nonFinancialFinanceShare);
        this.financialFinanceShare    = financialFinanceShare;
        this.nonFinancialFinanceShare = nonFinancialFinanceShare;
    }

    public double blend(SentimentReading finance, SentimentReading general, boolean financial) {
        return blend(ItemScorer.toScalar(finance), ItemScorer.toScalar(general), financial);
    }

    public double blend(double financeScore, double generalScore, boolean financial) {
        double share = financial ? financialFinanceShare : nonFinancialFinanceShare;
        double blended = share * financeScore + (1.0 - share) * generalScore;
        return Math.max(-1.0, Math.min(1.0, blended));
    }

    private static void requireShare(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw FusionException.invalidConfiguration("AdaptiveBlender", name + " must be in [0,1] but was " + value);
        }
    }
}
