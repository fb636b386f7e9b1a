package com.signalfusion.fusion.adapter;

import com.signalfusion.common.trace.FusionTrace;
import com.signalfusion.fusion.config.FusionProperties;
import com.signalfusion.fusion.config.WebClientConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RemoteIndicatorFetcherTest {

    private MockWebServer server;
    private RemoteIndicatorFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        FusionProperties properties = new FusionProperties();
        properties.getGateway().setBaseUrl(server.url("/").toString().replaceAll("/$", ""));
        properties.getGateway().setResponseTimeoutSeconds(2);
        fetcher = new RemoteIndicatorFetcher(new WebClientConfig().gatewayWebClient(WebClient.builder(), properties));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("partial body → present fields decoded, absent ones left null; traceId forwarded")
    void partialBody() throws InterruptedException {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"vix\":18.5,\"inflation\":3.2,\"consumerSentiment\":77.1}"));

        StepVerifier.create(FusionTrace.bind(fetcher.fetch(), "trace-5"))
            .assertNext(indicators -> {
                assertEquals(18.5, indicators.vix(), 1e-9);
                assertNull(indicators.unemployment());
                assertEquals(List.of("unemployment", "fedFundsRate"), indicators.missing());
            })
            .verifyComplete();

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/api/v1/indicators", request.getPath());
        assertEquals("trace-5", request.getHeader(FusionTrace.HEADER));
    }

    @Test
    @DisplayName("server error → every indicator missing instead of an error signal")
    void serverErrorFallsBack() {
        server.enqueue(new MockResponse().setResponseCode(502));

        StepVerifier.create(fetcher.fetch())
            .assertNext(indicators -> assertEquals(5, indicators.missing().size()))
            .verifyComplete();
    }
}
