package com.signalfusion.fusion.service;

import com.signalfusion.common.model.AnalyzedItem;
import com.signalfusion.common.model.Channel;
import com.signalfusion.common.model.ItemKind;
import com.signalfusion.common.model.SentimentReading;
import com.signalfusion.common.model.SourceItem;
import com.signalfusion.common.model.WeightedItem;
import com.signalfusion.common.scoring.ItemAnalyzer;
import com.signalfusion.fusion.FusionTestFixtures;
import com.signalfusion.fusion.StubItemFetcher;
import com.signalfusion.fusion.adapter.ItemQuery;
import com.signalfusion.fusion.config.FusionProperties;
import com.signalfusion.fusion.logger.FusionFlowLogger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.signalfusion.fusion.FusionTestFixtures.article;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ItemScoringServiceTest {

    @Test
    @DisplayName("every fetched item is scored against the same reference instant")
    void scoresAllItems() {
        FusionTestFixtures fx = new FusionTestFixtures();
        fx.fetcher.forTicker(Channel.NEWS, "AAPL",
            article("AAPL shares climb"),
            SourceItem.article("AAPL shares slump", "Bloomberg", "2024-04-30T12:00:00Z"));

        StepVerifier.create(fx.scoringService.fetchAndScore(ItemQuery.forTicker(Channel.NEWS, "AAPL")))
            .assertNext(items -> {
                assertEquals(2, items.size());
                WeightedItem fresh = items.stream().filter(i -> i.blendedScore() > 0).findFirst().orElseThrow();
                WeightedItem dayOld = items.stream().filter(i -> i.blendedScore() < 0).findFirst().orElseThrow();
                assertEquals(1.0, fresh.timeWeight(), 1e-9);
                assertEquals(0.1 + 0.9 * Math.exp(-1.0), dayOld.timeWeight(), 1e-9);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("nothing fetched → empty list without touching the analyzer")
    void emptyFetch() {
        ItemAnalyzer analyzer = mock(ItemAnalyzer.class);
        ItemScoringService service = new ItemScoringService(new StubItemFetcher(), analyzer,
            new FusionFlowLogger(), Clock.fixed(FusionTestFixtures.NOW, ZoneOffset.UTC), new FusionProperties());

        StepVerifier.create(service.fetchAndScore(ItemQuery.forTicker(Channel.MICROBLOG, "TSLA")))
            .assertNext(items -> assertTrue(items.isEmpty()))
            .verifyComplete();
        verify(analyzer, never()).analyze(any(), any());
    }

    @Test
    @DisplayName("an item whose scoring throws is dropped, the rest survive")
    void failingItemDropped() {
        SourceItem good = article("AAPL shares climb");
        SourceItem bad = article("corrupt payload");
        ItemAnalyzer analyzer = mock(ItemAnalyzer.class);
        AnalyzedItem analyzed = new AnalyzedItem(good.text(), good.source(), good.publishedAt(), ItemKind.ARTICLE,
            new SentimentReading("positive", 0.9), new SentimentReading("positive", 0.9), true, 0.6, 0);
        when(analyzer.analyze(eq(good), any())).thenReturn(new WeightedItem(analyzed, 1.0, 0.9));
        when(analyzer.analyze(eq(bad), any())).thenThrow(new IllegalArgumentException("blendedScore out of range"));

        ItemScoringService service = new ItemScoringService(new StubItemFetcher(), analyzer,
            new FusionFlowLogger(), Clock.fixed(FusionTestFixtures.NOW, ZoneOffset.UTC), new FusionProperties());

        StepVerifier.create(service.scoreAll(List.of(good, bad)))
            .assertNext(items -> {
                assertEquals(1, items.size());
                assertEquals(0.9, items.get(0).blendedScore(), 1e-9);
            })
            .verifyComplete();
    }
}
