package com.signalfusion.common.fusion;

import com.signalfusion.common.exception.FusionException;
import com.signalfusion.common.model.Channel;
import com.signalfusion.common.model.ChannelResult;
import com.signalfusion.common.model.CombinedSentiment;
import com.signalfusion.common.model.SentimentTier;
import com.signalfusion.common.model.SignalResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges independently produced channel results (news, social forum, microblog).
 *
 * <p>Base weights (default 0.4 / 0.3 / 0.3) are normalized once at construction. On each
 * call, channels that produced no items are dropped and the remaining base weights are
 * renormalized over the channels actually present:
 * <pre>
 *   w_i        = base_i / Σ base_present
 *   score      = Σ w_i × score_i
 *   confidence = Σ w_i × confidence_i
 * </pre>
 *
 * <p>The label uses a five-tier scheme ({@link SentimentTier}) with thresholds of its own,
 * independent of {@link CombinedSentimentFuser}'s three-tier label.
 */
public final class MultiChannelFuser {

    public static final double DEFAULT_NEWS_WEIGHT      = 0.4;
    public static final double DEFAULT_FORUM_WEIGHT     = 0.3;
    public static final double DEFAULT_MICROBLOG_WEIGHT = 0.3;
    public static final double DEFAULT_STRONG_THRESHOLD = 0.2;
    public static final double DEFAULT_WEAK_THRESHOLD   = 0.05;

    private final Map<Channel, Double> baseWeights;
    private final double strongThreshold;
    private final double weakThreshold;

    public MultiChannelFuser() {
        this(defaultBaseWeights(), DEFAULT_STRONG_THRESHOLD, DEFAULT_WEAK_THRESHOLD);
    }

    public MultiChannelFuser(Map<Channel, Double> baseWeights, double strongThreshold, double weakThreshold) {
        if (baseWeights == null || baseWeights.isEmpty()) {
            throw FusionException.invalidConfiguration("MultiChannelFuser", "at least one channel weight is required");
        }
        double sum = 0.0;
        for (Map.Entry<Channel, Double> entry : baseWeights.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0.0) {
                throw FusionException.invalidConfiguration("MultiChannelFuser",
                    "weight for " + entry.getKey().code() + " must be >= 0 but was " + entry.getValue());
            }
            sum += entry.getValue();
        }
        if (sum <= 0.0) {
            throw FusionException.invalidConfiguration("MultiChannelFuser", "channel weights must not all be zero");
        }
        Map<Channel, Double> normalized = new EnumMap<>(Channel.class);
        for (Map.Entry<Channel, Double> entry : baseWeights.entrySet()) {
            if (entry.getValue() > 0.0) {
                normalized.put(entry.getKey(), entry.getValue() / sum);
            }
        }
        this.baseWeights     = Collections.unmodifiableMap(normalized);
        this.strongThreshold = strongThreshold;
        this.weakThreshold   = weakThreshold;
    }

    public static Map<Channel, Double> defaultBaseWeights() {
        Map<Channel, Double> weights = new EnumMap<>(Channel.class);
        weights.put(Channel.NEWS, DEFAULT_NEWS_WEIGHT);
        weights.put(Channel.SOCIAL_FORUM, DEFAULT_FORUM_WEIGHT);
        weights.put(Channel.MICROBLOG, DEFAULT_MICROBLOG_WEIGHT);
        return weights;
    }

    /** Normalized base weights, summing to 1.0. */
    public Map<Channel, Double> baseWeights() {
        return baseWeights;
    }

    /**
     * @param results channel results in any order; a channel appearing more than once
     *                contributes its first result with data
     */
    public SignalResult<CombinedSentiment> fuse(String subject, List<ChannelResult> results) {
        Map<Channel, ChannelResult> present = new EnumMap<>(Channel.class);
        if (results != null) {
            for (ChannelResult result : results) {
                if (result != null && result.hasData() && baseWeights.containsKey(result.channel())) {
                    present.putIfAbsent(result.channel(), result);
                }
            }
        }

        if (present.isEmpty()) {
            return SignalResult.unavailable(
                CombinedSentiment.neutral(subject, SentimentTier.NEUTRAL.code()),
                "no channel produced any items");
        }

        double presentTotal = present.keySet().stream().mapToDouble(baseWeights::get).sum();
        Map<String, Double> weightsUsed = new LinkedHashMap<>();
        double score      = 0.0;
        double confidence = 0.0;
        for (ChannelResult result : present.values()) {
            double weight = baseWeights.get(result.channel()) / presentTotal;
            weightsUsed.put(result.channel().code(), weight);
            score      += weight * result.score();
            confidence += weight * result.confidence();
        }

        CombinedSentiment combined = new CombinedSentiment(
            subject, score, SentimentTier.of(score, strongThreshold, weakThreshold).code(),
            confidence, weightsUsed);

        List<String> missing = new ArrayList<>();
        for (Channel channel : baseWeights.keySet()) {
            if (!present.containsKey(channel)) missing.add(channel.code());
        }
        return missing.isEmpty()
            ? SignalResult.ok(combined)
            : SignalResult.degraded(combined, "no items for " + String.join(", ", missing));
    }
}
