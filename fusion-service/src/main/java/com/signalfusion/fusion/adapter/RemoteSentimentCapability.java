package com.signalfusion.fusion.adapter;

import com.signalfusion.common.model.ModelKind;
import com.signalfusion.common.model.SentimentReading;
import com.signalfusion.common.scoring.InferenceException;
import com.signalfusion.common.scoring.SentimentCapability;
import com.signalfusion.fusion.config.FusionProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * {@link SentimentCapability} backed by the remote inference endpoint
 * ({@code POST /api/v1/classify} with {@code {text, model}}).
 *
 * <p>Blocking by contract: callers run it on {@code Schedulers.boundedElastic()}. Any
 * transport error, timeout or empty body becomes an {@link InferenceException}, which
 * {@code ItemAnalyzer} turns into a neutral, zero-confidence reading.
 */
@Component
public class RemoteSentimentCapability implements SentimentCapability {

    private final WebClient inferenceClient;
    private final Duration timeout;

    public RemoteSentimentCapability(@Qualifier("inferenceWebClient") WebClient inferenceClient,
                                     FusionProperties properties) {
        this.inferenceClient = inferenceClient;
        this.timeout         = Duration.ofSeconds(properties.getInference().getResponseTimeoutSeconds());
    }

    @Override
    public SentimentReading classify(String text, ModelKind kind) {
        SentimentReading reading;
        try {
            reading = inferenceClient.post()
                .uri("/api/v1/classify")
                .bodyValue(Map.of("text", text, "model", kind.code()))
                .retrieve()
                .bodyToMono(SentimentReading.class)
                .block(timeout);
        } catch (RuntimeException e) {
            throw new InferenceException(kind, "inference call failed: " + e.getMessage(), e);
        }
        if (reading == null || reading.label() == null) {
            throw new InferenceException(kind, "inference returned no reading");
        }
        return reading;
    }
}
