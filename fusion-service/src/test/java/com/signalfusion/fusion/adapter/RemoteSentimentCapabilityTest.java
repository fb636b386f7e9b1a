package com.signalfusion.fusion.adapter;

import com.signalfusion.common.model.ModelKind;
import com.signalfusion.common.model.SentimentReading;
import com.signalfusion.common.scoring.InferenceException;
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

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RemoteSentimentCapabilityTest {

    private MockWebServer server;
    private RemoteSentimentCapability capability;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        FusionProperties properties = new FusionProperties();
        properties.getInference().setBaseUrl(server.url("/").toString().replaceAll("/$", ""));
        properties.getInference().setResponseTimeoutSeconds(2);
        WebClient client = new WebClientConfig().inferenceWebClient(WebClient.builder(), properties);
        capability = new RemoteSentimentCapability(client, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("posts text and model kind, decodes the reading")
    void classifies() throws InterruptedException {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"label\":\"positive\",\"score\":0.93}"));

        SentimentReading reading = capability.classify("Earnings beat expectations", ModelKind.FINANCE);

        assertEquals("positive", reading.label());
        assertEquals(0.93, reading.score(), 1e-9);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        assertEquals("/api/v1/classify", request.getPath());
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"model\":\"finance\""));
        assertTrue(body.contains("\"text\":\"Earnings beat expectations\""));
    }

    @Test
    @DisplayName("server error → InferenceException carrying the model kind")
    void serverError() {
        server.enqueue(new MockResponse().setResponseCode(500));

        InferenceException e = assertThrows(InferenceException.class,
            () -> capability.classify("anything", ModelKind.GENERAL));
        assertEquals(ModelKind.GENERAL, e.getModelKind());
    }

    @Test
    @DisplayName("empty body → InferenceException")
    void emptyBody() {
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json"));

        assertThrows(InferenceException.class, () -> capability.classify("anything", ModelKind.FINANCE));
    }
}
