package com.signalfusion.common.aggregation;

import com.signalfusion.common.model.CategoryLabel;
import com.signalfusion.common.model.CategoryScore;
import com.signalfusion.common.model.SentimentLabel;
import com.signalfusion.common.model.WeightedItem;

import java.util.List;

/**
 * Reduces the weighted items of one evidence category into a {@link CategoryScore}.
 *
 * <pre>
 *   score      = Σ(blendedScore_i × timeWeight_i) / max(Σ timeWeight_i, ε)
 *   confidence = min(1.0, itemCount / 10)
 *   sentiment  = score &gt; threshold → positive, score &lt; −threshold → negative, else neutral
 * </pre>
 *
 * <p>An empty list yields {@link CategoryScore#empty(CategoryLabel)}: the category is
 * reported as absent, which fusers exclude instead of reading it as a zero score.
 * Item order does not affect the result.
 */
public final class CategoryAggregator {

    public static final double DEFAULT_LABEL_THRESHOLD = 0.1;
    public static final int    FULL_CONFIDENCE_ITEMS   = 10;

    private static final double EPSILON = 1e-9;

    private final double labelThreshold;

    public CategoryAggregator() {
        this(DEFAULT_LABEL_THRESHOLD);
    }

    public CategoryAggregator(double labelThreshold) {
        this.labelThreshold = labelThreshold;
    }

    public CategoryScore aggregate(CategoryLabel label, List<WeightedItem> items) {
        if (items == null || items.isEmpty()) {
            return CategoryScore.empty(label);
        }

        double weightedSum      = 0.0;
        double totalTimeWeight  = 0.0;
        double classConfSum     = 0.0;
        int    financialCount   = 0;
        for (WeightedItem item : items) {
            weightedSum     += item.blendedScore() * item.timeWeight();
            totalTimeWeight += item.timeWeight();
            classConfSum    += item.item().classificationConfidence();
            if (item.item().financial()) financialCount++;
        }

        int count = items.size();
        double score = clamp(weightedSum / Math.max(totalTimeWeight, EPSILON), -1.0, 1.0);
        double confidence = Math.min(1.0, count / (double) FULL_CONFIDENCE_ITEMS);

        return new CategoryScore(
            label,
            score,
            confidence,
            SentimentLabel.of(score, labelThreshold),
            count,
            financialCount,
            totalTimeWeight / count,
            clamp(classConfSum / count, 0.0, 1.0));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
