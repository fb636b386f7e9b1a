package com.signalfusion.fusion.service;

import com.signalfusion.common.economic.EconomicIndicators;
import com.signalfusion.common.economic.MarketCondition;
import com.signalfusion.common.model.SignalResult;
import com.signalfusion.fusion.FusionTestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class MarketContextServiceTest {

    @Test
    @DisplayName("fetched indicators are scored once per call")
    void scoresFetchedIndicators() {
        FusionTestFixtures fx = new FusionTestFixtures();
        fx.indicators.publish(new EconomicIndicators(26.0, 4.0, 4.5, 5.25, 75.0));

        StepVerifier.create(fx.marketContextService.assessMarketContext())
            .assertNext(result -> {
                assertEquals(SignalResult.Status.OK, result.status());
                assertEquals(6, result.value().riskScore());
                assertEquals(MarketCondition.HIGH_RISK, result.value().condition());
            })
            .verifyComplete();
        assertEquals(1, fx.indicators.calls());
    }

    @Test
    @DisplayName("gateway with nothing to report → UNAVAILABLE, not an error")
    void nothingPublished() {
        FusionTestFixtures fx = new FusionTestFixtures();

        StepVerifier.create(fx.marketContextService.assessMarketContext())
            .assertNext(result -> {
                assertEquals(SignalResult.Status.UNAVAILABLE, result.status());
                assertEquals(MarketCondition.LOW_RISK, result.value().condition());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("an empty fetch is treated like no indicators")
    void emptyFetch() {
        FusionTestFixtures fx = new FusionTestFixtures();
        MarketContextService service = new MarketContextService(
            Mono::empty, fx.config.economicContextAssessor(), fx.flowLogger);

        StepVerifier.create(service.assessMarketContext())
            .assertNext(result -> assertEquals(5, result.value().defaultedIndicators().size()))
            .verifyComplete();
    }

    @Test
    @DisplayName("caller-supplied indicators bypass the fetcher")
    void suppliedIndicators() {
        FusionTestFixtures fx = new FusionTestFixtures();

        StepVerifier.create(fx.marketContextService.assessMarketContext(new EconomicIndicators(15.0, 2.0, 3.5, 2.0, 95.0)))
            .assertNext(result -> assertEquals(MarketCondition.RISK_ON, result.value().condition()))
            .verifyComplete();
        assertEquals(0, fx.indicators.calls());
    }
}
