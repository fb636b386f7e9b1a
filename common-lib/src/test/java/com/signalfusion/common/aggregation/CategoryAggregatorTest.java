package com.signalfusion.common.aggregation;

import com.signalfusion.common.model.CategoryLabel;
import com.signalfusion.common.model.CategoryScore;
import com.signalfusion.common.model.SentimentLabel;
import com.signalfusion.common.model.SentimentReading;
import com.signalfusion.common.model.SourceItem;
import com.signalfusion.common.model.WeightedItem;
import com.signalfusion.common.scoring.AdaptiveBlender;
import com.signalfusion.common.scoring.ItemAnalyzer;
import com.signalfusion.common.scoring.RecencyWeighter;
import com.signalfusion.common.scoring.RelevanceClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.signalfusion.common.TestItems.financial;
import static com.signalfusion.common.TestItems.general;
import static org.junit.jupiter.api.Assertions.*;

class CategoryAggregatorTest {

    private final CategoryAggregator aggregator = new CategoryAggregator();

    @Test
    @DisplayName("three same-day positive financial items → score ≈ 0.9, confidence 0.3, positive")
    void threeSameDayPositiveItems() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        ItemAnalyzer analyzer = new ItemAnalyzer((text, kind) -> new SentimentReading("positive", 0.9),
            new RelevanceClassifier(), new RecencyWeighter(24.0, 0.1, clock), new AdaptiveBlender(), clock);

        List<WeightedItem> items = analyzer.analyzeAll(List.of(
            SourceItem.article("Apple quarterly earnings beat analyst forecast", "Reuters", "2024-05-01T11:59:00Z"),
            SourceItem.article("Microsoft revenue and profit guidance raised", "Bloomberg", "2024-05-01T11:30:00Z"),
            SourceItem.article("Nvidia stock price rallies on dividend news", "CNBC", "2024-05-01T12:00:00Z")
        ), now);

        CategoryScore score = aggregator.aggregate(CategoryLabel.STOCK_SPECIFIC, items);

        assertEquals(0.9, score.score(), 1e-9);
        assertEquals(0.3, score.confidence(), 1e-9);
        assertEquals(SentimentLabel.POSITIVE, score.sentiment());
        assertEquals(3, score.itemCount());
        assertEquals(3, score.financialItemCount());
        assertTrue(score.avgTimeWeight() > 0.98);
    }

    @Nested
    @DisplayName("aggregate() — weighted mean")
    class WeightedMeanTests {

        @Test
        @DisplayName("score is Σ(blended × timeWeight) / Σ timeWeight")
        void timeWeightedMean() {
            CategoryScore score = aggregator.aggregate(CategoryLabel.GENERAL_MARKET,
                List.of(financial(0.5, 1.0), financial(-0.5, 0.5)));
            assertEquals((0.5 - 0.25) / 1.5, score.score(), 1e-9);
            assertEquals(0.75, score.avgTimeWeight(), 1e-9);
        }

        @Test
        @DisplayName("item order does not change the result")
        void orderIndependent() {
            List<WeightedItem> items = new ArrayList<>(List.of(
                financial(0.7, 1.0), general(-0.2, 0.4, 0.3), financial(0.1, 0.8), general(0.4, 0.2, 0.9)));
            CategoryScore forward = aggregator.aggregate(CategoryLabel.SECTOR, items);
            Collections.reverse(items);
            CategoryScore reversed = aggregator.aggregate(CategoryLabel.SECTOR, items);

            assertEquals(forward.score(), reversed.score(), 1e-12);
            assertEquals(forward.avgClassificationConfidence(), reversed.avgClassificationConfidence(), 1e-12);
        }

        @Test
        @DisplayName("confidence grows with item count and caps at 1.0")
        void confidenceCaps() {
            List<WeightedItem> twelve = Collections.nCopies(12, financial(0.2, 1.0));
            assertEquals(1.0, aggregator.aggregate(CategoryLabel.SECTOR, twelve).confidence());
            assertEquals(0.5, aggregator.aggregate(CategoryLabel.SECTOR, twelve.subList(0, 5)).confidence(), 1e-9);
        }

        @Test
        @DisplayName("records financial count and mean classification confidence")
        void relevanceStatistics() {
            CategoryScore score = aggregator.aggregate(CategoryLabel.GENERAL_MARKET,
                List.of(financial(0.2, 1.0), general(0.2, 1.0, 0.4)));
            assertEquals(1, score.financialItemCount());
            assertEquals(0.5, score.financialRatio(), 1e-9);
            assertEquals(0.7, score.avgClassificationConfidence(), 1e-9);
        }
    }

    @Nested
    @DisplayName("labels and empty input")
    class LabelTests {

        @Test
        @DisplayName("empty list → score 0, confidence 0, itemCount 0")
        void emptyList() {
            CategoryScore score = aggregator.aggregate(CategoryLabel.GENERAL_MARKET, List.of());
            assertTrue(score.isEmpty());
            assertEquals(0.0, score.score());
            assertEquals(0.0, score.confidence());
            assertEquals(SentimentLabel.NEUTRAL, score.sentiment());
        }

        @Test
        @DisplayName("default threshold ±0.1 is strict")
        void defaultThreshold() {
            assertEquals(SentimentLabel.NEUTRAL,
                aggregator.aggregate(CategoryLabel.SECTOR, List.of(financial(0.1, 1.0))).sentiment());
            assertEquals(SentimentLabel.NEGATIVE,
                aggregator.aggregate(CategoryLabel.SECTOR, List.of(financial(-0.15, 1.0))).sentiment());
        }

        @Test
        @DisplayName("threshold is configurable")
        void customThreshold() {
            CategoryAggregator wide = new CategoryAggregator(0.2);
            assertEquals(SentimentLabel.NEUTRAL,
                wide.aggregate(CategoryLabel.SECTOR, List.of(financial(0.15, 1.0))).sentiment());
        }
    }
}
