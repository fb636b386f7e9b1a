package com.signalfusion.common.aggregation;

import com.signalfusion.common.model.Channel;
import com.signalfusion.common.model.ChannelResult;
import com.signalfusion.common.model.ItemKind;
import com.signalfusion.common.model.WeightedItem;

import java.util.List;

/**
 * Reduces the scored items of one channel into a {@link ChannelResult}.
 *
 * <pre>
 *   score      = Σ(blendedScore_i × kindWeight_i) / Σ kindWeight_i     (POST = 2.0, other kinds = 1.0)
 *   confidence = mean probability of each item's primary reading
 * </pre>
 *
 * <p>A channel without items is reported absent ({@code itemCount == 0}).
 */
public final class ChannelAggregator {

    public static final double DEFAULT_POST_WEIGHT = 2.0;

    private final double postWeight;

    public ChannelAggregator() {
        this(DEFAULT_POST_WEIGHT);
    }

    public ChannelAggregator(double postWeight) {
        this.postWeight = postWeight > 0.0 ? postWeight : DEFAULT_POST_WEIGHT;
    }

    public ChannelResult aggregate(Channel channel, List<WeightedItem> items) {
        if (items == null || items.isEmpty()) {
            return ChannelResult.absent(channel);
        }

        double weightedSum    = 0.0;
        double totalWeight    = 0.0;
        double probabilitySum = 0.0;
        for (WeightedItem item : items) {
            double kindWeight = item.item().kind() == ItemKind.POST ? postWeight : 1.0;
            weightedSum    += item.blendedScore() * kindWeight;
            totalWeight    += kindWeight;
            probabilitySum += clamp(item.item().primaryReading().score(), 0.0, 1.0);
        }

        double score      = clamp(weightedSum / totalWeight, -1.0, 1.0);
        double confidence = clamp(probabilitySum / items.size(), 0.0, 1.0);
        return new ChannelResult(channel, score, confidence, items.size());
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
