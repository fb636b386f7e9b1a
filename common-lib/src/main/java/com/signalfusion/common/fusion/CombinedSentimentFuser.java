package com.signalfusion.common.fusion;

import com.signalfusion.common.exception.FusionException;
import com.signalfusion.common.model.CategoryLabel;
import com.signalfusion.common.model.CategoryScore;
import com.signalfusion.common.model.CombinedSentiment;
import com.signalfusion.common.model.SentimentLabel;
import com.signalfusion.common.model.SignalResult;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges category scores (general market, stock specific, ...) into one ticker-level
 * {@link CombinedSentiment} using dynamic, confidence-adjusted weights.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Drop categories without items; they are absent, not zero.</li>
 *   <li>{@code adjusted_i = base_i × (1 + (avgClassificationConfidence_i − 0.5) × confidenceFactor)}</li>
 *   <li>{@code adjusted_i ×= 1.1} when the category's financial-item ratio exceeds 0.7.</li>
 *   <li>Renormalize the adjusted weights to sum to 1.0.</li>
 *   <li>{@code score = Σ w_i × score_i}, {@code confidence = Σ w_i × confidence_i}.</li>
 *   <li>Label: {@code score > 0.12} positive, {@code score < −0.12} negative, else neutral.</li>
 * </ol>
 *
 * <p>{@code weightsUsed} of the result holds the renormalized weights keyed by
 * {@link CategoryLabel#code()}. Stateless and thread-safe.
 */
public final class CombinedSentimentFuser {

    public static final double DEFAULT_GENERAL_WEIGHT     = 0.4;
    public static final double DEFAULT_SPECIFIC_WEIGHT    = 0.6;
    public static final double DEFAULT_CONFIDENCE_FACTOR  = 0.2;
    public static final double DEFAULT_FINANCIAL_RATIO    = 0.7;
    public static final double DEFAULT_FINANCIAL_BOOST    = 1.1;
    public static final double DEFAULT_LABEL_THRESHOLD    = 0.12;

    private final Map<CategoryLabel, Double> baseWeights;
    private final double confidenceFactor;
    private final double financialRatioThreshold;
    private final double financialBoost;
    private final double labelThreshold;

    public CombinedSentimentFuser() {
        this(defaultBaseWeights(), DEFAULT_CONFIDENCE_FACTOR, DEFAULT_FINANCIAL_RATIO,
             DEFAULT_FINANCIAL_BOOST, DEFAULT_LABEL_THRESHOLD);
    }

    /**
     * @param baseWeights categories this fuser accepts and their base weights; categories
     *                    passed to {@link #fuse} without a base weight are ignored
     */
    public CombinedSentimentFuser(Map<CategoryLabel, Double> baseWeights,
                                  double confidenceFactor,
                                  double financialRatioThreshold,
                                  double financialBoost,
                                  double labelThreshold) {
        if (baseWeights == null || baseWeights.isEmpty()) {
            throw FusionException.invalidConfiguration("CombinedSentimentFuser", "at least one base weight is required");
        }
        baseWeights.forEach((label, weight) -> {
            if (weight == null || weight <= 0.0) {
                throw FusionException.invalidConfiguration("CombinedSentimentFuser",
                    "base weight for " + label.code() + " must be > 0 but was " + weight);
            }
        });
        this.baseWeights             = new EnumMap<>(baseWeights);
        this.confidenceFactor        = confidenceFactor;
        this.financialRatioThreshold = financialRatioThreshold;
        this.financialBoost          = financialBoost;
        this.labelThreshold          = labelThreshold;
    }

    public static Map<CategoryLabel, Double> defaultBaseWeights() {
        Map<CategoryLabel, Double> weights = new EnumMap<>(CategoryLabel.class);
        weights.put(CategoryLabel.GENERAL_MARKET, DEFAULT_GENERAL_WEIGHT);
        weights.put(CategoryLabel.STOCK_SPECIFIC, DEFAULT_SPECIFIC_WEIGHT);
        return weights;
    }

    /** Two-category form: general market news and news specific to {@code subject}. */
    public SignalResult<CombinedSentiment> fuse(String subject, CategoryScore general, CategoryScore specific) {
        Map<CategoryLabel, CategoryScore> categories = new EnumMap<>(CategoryLabel.class);
        if (general != null)  categories.put(CategoryLabel.GENERAL_MARKET, general);
        if (specific != null) categories.put(CategoryLabel.STOCK_SPECIFIC, specific);
        return fuse(subject, categories);
    }

    public SignalResult<CombinedSentiment> fuse(String subject, Map<CategoryLabel, CategoryScore> categories) {
        List<String> missing = new ArrayList<>();
        Map<CategoryLabel, Double> adjusted = new EnumMap<>(CategoryLabel.class);

        for (Map.Entry<CategoryLabel, Double> base : baseWeights.entrySet()) {
            CategoryScore category = categories != null ? categories.get(base.getKey()) : null;
            if (category == null || category.isEmpty()) {
                missing.add(base.getKey().code());
                continue;
            }
            double weight = base.getValue()
                * (1.0 + (category.avgClassificationConfidence() - 0.5) * confidenceFactor);
            if (category.financialRatio() > financialRatioThreshold) {
                weight *= financialBoost;
            }
            adjusted.put(base.getKey(), Math.max(0.0, weight));
        }

        if (adjusted.isEmpty()) {
            return SignalResult.unavailable(
                CombinedSentiment.neutral(subject, SentimentLabel.NEUTRAL.code()),
                "no category produced any items");
        }

        double total = adjusted.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> weightsUsed = new LinkedHashMap<>();
        double score      = 0.0;
        double confidence = 0.0;
        for (Map.Entry<CategoryLabel, Double> entry : adjusted.entrySet()) {
            double weight = total > 0.0 ? entry.getValue() / total : 1.0 / adjusted.size();
            CategoryScore category = categories.get(entry.getKey());
            weightsUsed.put(entry.getKey().code(), weight);
            score      += weight * category.score();
            confidence += weight * category.confidence();
        }

        CombinedSentiment combined = new CombinedSentiment(
            subject, score, SentimentLabel.of(score, labelThreshold).code(), confidence, weightsUsed);
        return missing.isEmpty()
            ? SignalResult.ok(combined)
            : SignalResult.degraded(combined, "no items for " + String.join(", ", missing));
    }
}
