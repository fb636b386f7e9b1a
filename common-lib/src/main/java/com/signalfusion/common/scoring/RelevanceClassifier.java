package com.signalfusion.common.scoring;

import com.signalfusion.common.exception.FusionException;
import com.signalfusion.common.model.RelevanceVerdict;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-density estimate of whether a text discusses financial or market topics.
 * Independent of any sentiment model: the verdict only selects the blend ratio
 * applied downstream by {@link AdaptiveBlender}.
 *
 * <pre>
 *   matches    = number of financial keywords occurring in the lower-cased text (substring match)
 *   confidence = min(1, matches / max(1, wordCount × densityFactor))
 *   financial  = matches ≥ 2  OR  confidence &gt; threshold
 * </pre>
 *
 * <p>Stateless and thread-safe.
 */
public final class RelevanceClassifier {

    public static final double DEFAULT_DENSITY_FACTOR = 0.1;
    public static final double DEFAULT_THRESHOLD      = 0.2;

    private static final int MIN_KEYWORD_MATCHES = 2;

    static final List<String> FINANCIAL_KEYWORDS = List.of(
        "earnings", "revenue", "profit", "quarterly", "dividend",
        "stock", "share", "market", "trading", "investment",
        "financial", "economy", "price", "analyst", "forecast",
        "guidance", "sec", "ipo", "merger", "acquisition"
    );

    private final double densityFactor;
    private final double threshold;

    public RelevanceClassifier() {
        this(DEFAULT_DENSITY_FACTOR, DEFAULT_THRESHOLD);
    }

    public RelevanceClassifier(double densityFactor, double threshold) {
        if (densityFactor <= 0.0) {
            throw FusionException.invalidConfiguration("RelevanceClassifier", "densityFactor must be > 0 but was " + densityFactor);
        }
        this.densityFactor = densityFactor;
        this.threshold     = threshold;
    }

    public RelevanceVerdict classify(String text) {
        if (text == null || text.isBlank()) {
            return RelevanceVerdict.none();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int matches = 0;
        for (String keyword : FINANCIAL_KEYWORDS) {
            if (lower.contains(keyword)) matches++;
        }
        int wordCount = lower.trim().split("\\s+").length;

        double confidence = Math.min(1.0, matches / Math.max(1.0, wordCount * densityFactor));
        boolean financial = matches >= MIN_KEYWORD_MATCHES || confidence > threshold;
        return new RelevanceVerdict(financial, confidence, matches);
    }
}
