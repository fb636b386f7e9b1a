package com.signalfusion.fusion.controller;

import com.signalfusion.common.economic.EconomicIndicators;
import com.signalfusion.common.model.Channel;
import com.signalfusion.fusion.FusionTestFixtures;
import com.signalfusion.fusion.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static com.signalfusion.fusion.FusionTestFixtures.article;
import static org.junit.jupiter.api.Assertions.assertEquals;

class FusionControllerTest {

    private FusionTestFixtures fx;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        fx = new FusionTestFixtures();
        FusionController controller = new FusionController(
            fx.sentimentService, fx.sectorService, fx.portfolioService, fx.marketContextService, fx.flowLogger);
        client = WebTestClient.bindToController(controller)
            .controllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("GET /api/v1/health → OK")
    void health() {
        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }

    @Nested
    @DisplayName("sentiment endpoints")
    class SentimentEndpoints {

        @Test
        @DisplayName("GET /sentiment/{ticker} reports status and renormalized weights")
        void tickerSentiment() {
            fx.fetcher.forTicker(Channel.NEWS, "AAPL", article("AAPL shares climb"));

            client.get().uri("/api/v1/sentiment/aapl")
                .header("X-Trace-Id", "trace-7")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ticker").isEqualTo("AAPL")
                .jsonPath("$.sentiment.status").isEqualTo("DEGRADED")
                .jsonPath("$.sentiment.value.weightsUsed.stock_specific").isEqualTo(1.0)
                .jsonPath("$.stockSpecific.itemCount").isEqualTo(1)
                .jsonPath("$.generalMarket.itemCount").isEqualTo(0);
        }

        @Test
        @DisplayName("POST /sentiment/channels fuses supplied channel results")
        void channelFusion() {
            String body = """
                {"subject":"AAPL","channels":[
                  {"channel":"NEWS","score":0.8,"confidence":0.9,"itemCount":12},
                  {"channel":"SOCIAL_FORUM","score":0.0,"confidence":0.0,"itemCount":0},
                  {"channel":"MICROBLOG","score":-0.2,"confidence":0.3,"itemCount":40}]}
                """;

            client.post().uri("/api/v1/sentiment/channels")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("DEGRADED")
                .jsonPath("$.value.label").isEqualTo("bullish")
                .jsonPath("$.value.weightsUsed.social_forum").doesNotExist();
        }

        @Test
        @DisplayName("GET /sentiment/{ticker}/channels lists all three channels")
        void channelBreakdown() {
            client.get().uri("/api/v1/sentiment/MSFT/channels")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.channels.length()").isEqualTo(3)
                .jsonPath("$.sentiment.status").isEqualTo("UNAVAILABLE");
        }
    }

    @Nested
    @DisplayName("sector endpoints")
    class SectorEndpoints {

        @Test
        @DisplayName("POST /sectors/rank drops sectors with fewer than two items")
        void rank() {
            String body = """
                {"technology":{"label":"SECTOR","score":0.4,"confidence":0.6,"sentiment":"POSITIVE","itemCount":6,
                               "financialItemCount":2,"avgTimeWeight":0.9,"avgClassificationConfidence":0.5,
                               "financialRatio":0.33},
                 "energy":{"label":"SECTOR","score":-0.3,"confidence":0.4,"itemCount":4},
                 "utilities":{"label":"SECTOR","score":0.9,"confidence":0.1,"itemCount":1}}
                """;

            client.post().uri("/api/v1/sectors/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.rankings.length()").isEqualTo(2)
                .jsonPath("$.rankings[0].sectorId").isEqualTo("technology")
                .jsonPath("$.rankings[0].etfTicker").isEqualTo("XLK")
                .jsonPath("$.overweight[0]").isEqualTo("technology");
        }

        @Test
        @DisplayName("GET /sectors with no news → empty ranking")
        void marketSectors() {
            client.get().uri("/api/v1/sectors")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ranking.rankings.length()").isEqualTo(0)
                .jsonPath("$.itemCount").isEqualTo(0);
        }
    }

    @Nested
    @DisplayName("portfolio endpoints")
    class PortfolioEndpoints {

        @Test
        @DisplayName("POST /portfolio/allocate accepts a ranking as previously returned")
        void allocate() {
            String body = """
                {"ranking":{"rankings":[
                   {"rank":1,"sectorId":"technology","score":0.5,"confidence":0.8,"itemCount":8,"etfTicker":"XLK",
                    "tier":"OVERWEIGHT","recommendation":"BUY - Positive Sentiment","rankingKey":0.4}],
                  "overweight":["technology"],"neutral":[],"underweight":[]},
                 "stockScoresBySector":{"technology":[{"ticker":"AAPL","score":0.6,"confidence":0.8}]},
                 "riskTolerance":"aggressive","portfolioSize":5000,"maxSectors":2,"stocksPerSector":1}
                """;

            client.post().uri("/api/v1/portfolio/allocate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.allocation.riskTolerance").isEqualTo("aggressive")
                .jsonPath("$.allocation.sectors[0].amount").value(amount ->
                    assertEquals(5000.0, ((Number) amount).doubleValue(), 0.01))
                .jsonPath("$.allocation.sectors[0].stocks[0].ticker").isEqualTo("AAPL")
                .jsonPath("$.riskAssessment.riskTier").exists()
                .jsonPath("$.executionPlan.steps").isArray();
        }

        @Test
        @DisplayName("unknown risk tolerance → 400 naming the component")
        void unknownTolerance() {
            client.post().uri("/api/v1/portfolio/allocate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"riskTolerance\":\"reckless\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.component").isEqualTo("RiskTolerance")
                .jsonPath("$.field").isEqualTo("riskTolerance");
        }

        @Test
        @DisplayName("GET /portfolio/recommendations with maxSectors=0 → 400")
        void invalidMaxSectors() {
            client.get().uri("/api/v1/portfolio/recommendations?maxSectors=0")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.component").isEqualTo("PortfolioRecommendationService")
                .jsonPath("$.field").isEqualTo("maxSectors")
                .jsonPath("$.error").isEqualTo("maxSectors must be >= 1 but was 0");
        }
    }

    @Nested
    @DisplayName("market context endpoints")
    class MarketContextEndpoints {

        @Test
        @DisplayName("GET /market/context scores the published indicators")
        void publishedIndicators() {
            fx.indicators.publish(new EconomicIndicators(35.0, 6.0, 7.0, 6.5, 60.0));

            client.get().uri("/api/v1/market/context")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("OK")
                .jsonPath("$.value.condition").isEqualTo("HIGH_RISK")
                .jsonPath("$.value.riskScore").isEqualTo(11)
                .jsonPath("$.value.description").isEqualTo("High Risk - Defensive Strategy")
                .jsonPath("$.value.riskDetails.length()").isEqualTo(5);
        }

        @Test
        @DisplayName("POST /market/context defaults the indicators the caller left out")
        void suppliedIndicators() {
            client.post().uri("/api/v1/market/context")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"vix\":32,\"unemployment\":3,\"fedFundsRate\":2,\"consumerSentiment\":90}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("DEGRADED")
                .jsonPath("$.value.defaultedIndicators[0]").isEqualTo("inflation")
                .jsonPath("$.value.riskScore").isEqualTo(3)
                .jsonPath("$.value.condition").isEqualTo("LOW_RISK");
        }
    }
}
