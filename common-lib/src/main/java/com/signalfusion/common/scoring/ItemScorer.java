package com.signalfusion.common.scoring;

import com.signalfusion.common.model.SentimentReading;

import java.util.Locale;

/**
 * Maps a model reading onto a signed scalar in [-1, 1].
 *
 * <pre>
 *   positive → +probability
 *   negative → −probability
 *   neutral / unrecognised → 0.0
 * </pre>
 */
public final class ItemScorer {

    private ItemScorer() {}

    public static double toScalar(SentimentReading reading) {
        if (reading == null || reading.label() == null) {
            return 0.0;
        }
        double probability = Double.isNaN(reading.score())
            ? 0.0
            : Math.max(0.0, Math.min(1.0, reading.score()));
        return switch (reading.label().trim().toLowerCase(Locale.ROOT)) {
            case "positive" -> probability;
            case "negative" -> -probability;
            default         -> 0.0;
        };
    }
}
