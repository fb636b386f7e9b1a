package com.signalfusion.common.scoring;

import com.signalfusion.common.model.AnalyzedItem;
import com.signalfusion.common.model.ModelKind;
import com.signalfusion.common.model.RelevanceVerdict;
import com.signalfusion.common.model.SentimentReading;
import com.signalfusion.common.model.SourceItem;
import com.signalfusion.common.model.WeightedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Runs one raw item through the per-item pipeline:
 * relevance classification, recency weight, finance and general model readings, blend.
 *
 * <p>A failed model call never escapes. The failed reading becomes neutral; when both
 * calls fail the item is scored neutral with classification confidence 0, so it only
 * dilutes its category by its time weight. Each failure is logged at WARN.
 */
public class ItemAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ItemAnalyzer.class);

    private final SentimentCapability sentimentCapability;
    private final RelevanceClassifier relevanceClassifier;
    private final RecencyWeighter recencyWeighter;
    private final AdaptiveBlender blender;
    private final Clock clock;

    public ItemAnalyzer(SentimentCapability sentimentCapability,
                        RelevanceClassifier relevanceClassifier,
                        RecencyWeighter recencyWeighter,
                        AdaptiveBlender blender,
                        Clock clock) {
        this.sentimentCapability = Objects.requireNonNull(sentimentCapability, "sentimentCapability");
        this.relevanceClassifier = Objects.requireNonNull(relevanceClassifier, "relevanceClassifier");
        this.recencyWeighter     = Objects.requireNonNull(recencyWeighter, "recencyWeighter");
        this.blender             = Objects.requireNonNull(blender, "blender");
        this.clock               = clock != null ? clock : Clock.systemUTC();
    }

    public ItemAnalyzer(SentimentCapability sentimentCapability) {
        this(sentimentCapability, new RelevanceClassifier(), new RecencyWeighter(),
             new AdaptiveBlender(), Clock.systemUTC());
    }

    public WeightedItem analyze(SourceItem item) {
        return analyze(item, clock.instant());
    }

    public WeightedItem analyze(SourceItem item, Instant now) {
        RelevanceVerdict verdict = relevanceClassifier.classify(item.text());

        int failures = 0;
        SentimentReading finance = classifySafely(item, ModelKind.FINANCE);
        if (finance == null) {
            failures++;
            finance = SentimentReading.neutral();
        }
        SentimentReading general = classifySafely(item, ModelKind.GENERAL);
        if (general == null) {
            failures++;
            general = SentimentReading.neutral();
        }

        double classificationConfidence = failures == 2 ? 0.0 : verdict.confidence();
        AnalyzedItem analyzed = new AnalyzedItem(
            item.text(), item.source(), item.publishedAt(), item.kind(),
            finance, general, verdict.financial(), classificationConfidence, failures);

        double timeWeight = recencyWeighter.weight(item.publishedAt(), now);
        double blended = blender.blend(finance, general, verdict.financial());
        return new WeightedItem(analyzed, timeWeight, blended);
    }

    public List<WeightedItem> analyzeAll(List<SourceItem> items, Instant now) {
        return items.stream().map(item -> analyze(item, now)).toList();
    }

    /** @return the model reading, or {@code null} when the call failed */
    private SentimentReading classifySafely(SourceItem item, ModelKind kind) {
        if (item.text().isBlank()) {
            return SentimentReading.neutral();
        }
        try {
            SentimentReading reading = sentimentCapability.classify(item.text(), kind);
            if (reading == null) {
                log.warn("[ItemAnalyzer] Empty reading model={} source={}", kind.code(), item.source());
                return null;
            }
            return reading;
        } catch (RuntimeException e) {
            log.warn("[ItemAnalyzer] Inference failed model={} source={} reason={}",
                kind.code(), item.source(), e.getMessage());
            return null;
        }
    }
}
