package com.signalfusion.fusion.service;

import com.signalfusion.common.model.CategoryLabel;
import com.signalfusion.common.model.CategoryScore;
import com.signalfusion.common.sector.RankedSector;
import com.signalfusion.common.sector.SectorTier;
import com.signalfusion.fusion.FusionTestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.signalfusion.fusion.FusionTestFixtures.article;
import static org.junit.jupiter.api.Assertions.*;

class SectorAnalysisServiceTest {

    @Nested
    @DisplayName("rankSectors()")
    class RankSectorsTests {

        @Test
        @DisplayName("five sectors, two with a single item → exactly three ranked")
        void thinSectorsExcluded() {
            FusionTestFixtures fx = new FusionTestFixtures();
            Map<String, CategoryScore> scores = new LinkedHashMap<>();
            scores.put("technology", CategoryScore.of(CategoryLabel.SECTOR, 0.4, 0.6, 6));
            scores.put("healthcare", CategoryScore.of(CategoryLabel.SECTOR, 0.1, 0.5, 5));
            scores.put("energy", CategoryScore.of(CategoryLabel.SECTOR, -0.3, 0.4, 4));
            scores.put("utilities", CategoryScore.of(CategoryLabel.SECTOR, 0.9, 0.1, 1));
            scores.put("materials", CategoryScore.of(CategoryLabel.SECTOR, -0.9, 0.1, 1));

            StepVerifier.create(fx.sectorService.rankSectors(scores))
                .assertNext(ranking -> {
                    assertEquals(List.of("technology", "healthcare", "energy"),
                        ranking.rankings().stream().map(RankedSector::sectorId).toList());
                    assertEquals("XLK", ranking.rankings().get(0).etfTicker());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("null input → empty ranking")
        void nullInput() {
            FusionTestFixtures fx = new FusionTestFixtures();
            StepVerifier.create(fx.sectorService.rankSectors(null))
                .assertNext(ranking -> assertTrue(ranking.isEmpty()))
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("analyzeMarketSectors()")
    class AnalyzeMarketSectorsTests {

        @Test
        @DisplayName("news is grouped by sector, thin sectors are scored but not ranked")
        void groupsAndRanks() {
            FusionTestFixtures fx = new FusionTestFixtures();
            fx.fetcher.generalMarket(
                article("XOM shares climb on crude rally"),
                article("XOM output to climb next quarter"),
                article("XOM dividend expected to climb"),
                article("JPM shares slump after results"),
                article("JPM lending margins slump"),
                article("AAPL shares climb"),
                article("Markets were quiet overnight"));

            StepVerifier.create(fx.sectorService.analyzeMarketSectors())
                .assertNext(report -> {
                    assertEquals(7, report.itemCount());
                    assertEquals(1, report.unassignedCount());
                    assertEquals(3, report.sectorScores().size());
                    assertEquals(1, report.sectorScores().get("technology").itemCount());

                    List<RankedSector> ranked = report.ranking().rankings();
                    assertEquals(2, ranked.size());
                    assertEquals("energy", ranked.get(0).sectorId());
                    assertEquals(0.9, ranked.get(0).score(), 1e-9);
                    assertEquals(0.3, ranked.get(0).confidence(), 1e-9);
                    assertEquals(SectorTier.OVERWEIGHT, ranked.get(0).tier());
                    assertEquals("XLE", ranked.get(0).etfTicker());
                    assertEquals("financial", ranked.get(1).sectorId());
                    assertEquals(SectorTier.UNDERWEIGHT, ranked.get(1).tier());
                    assertEquals(List.of("energy"), report.ranking().overweight());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("no market news → empty ranking")
        void noNews() {
            FusionTestFixtures fx = new FusionTestFixtures();
            StepVerifier.create(fx.sectorService.analyzeMarketSectors())
                .assertNext(report -> {
                    assertTrue(report.ranking().isEmpty());
                    assertEquals(0, report.itemCount());
                })
                .verifyComplete();
        }
    }
}
