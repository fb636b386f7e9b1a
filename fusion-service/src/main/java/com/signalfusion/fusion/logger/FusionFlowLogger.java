package com.signalfusion.fusion.logger;

import com.signalfusion.common.model.CombinedSentiment;
import com.signalfusion.common.model.SignalResult;
import com.signalfusion.common.trace.FusionTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for the reactive fusion pipelines. Pure side-effects; never alters a pipeline.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: a REST operation was invoked</li>
 *   <li>{@link #ITEMS_FETCHED}: the gateway answered for one channel/scope</li>
 *   <li>{@link #ITEMS_SCORED}: relevance, both model readings and recency applied</li>
 *   <li>{@link #CATEGORIES_AGGREGATED}: category or channel scores computed</li>
 *   <li>{@link #SENTIMENT_FUSED}: combined sentiment produced</li>
 *   <li>{@link #SECTORS_RANKED}: sector ranking produced</li>
 *   <li>{@link #PORTFOLIO_ALLOCATED}: allocation, risk and execution plan assembled</li>
 *   <li>{@link #MARKET_CONTEXT_ASSESSED}: economic indicators scored (independent of the above)</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(FusionFlowLogger.SECTORS_RANKED))
 * </pre>
 */
@Component
public class FusionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(FusionFlowLogger.class);

    public static final String REQUEST_RECEIVED      = "REQUEST_RECEIVED";
    public static final String ITEMS_FETCHED         = "ITEMS_FETCHED";
    public static final String ITEMS_SCORED          = "ITEMS_SCORED";
    public static final String CATEGORIES_AGGREGATED = "CATEGORIES_AGGREGATED";
    public static final String SENTIMENT_FUSED       = "SENTIMENT_FUSED";
    public static final String SECTORS_RANKED        = "SECTORS_RANKED";
    public static final String PORTFOLIO_ALLOCATED   = "PORTFOLIO_ALLOCATED";
    public static final String MARKET_CONTEXT_ASSESSED = "MARKET_CONTEXT_ASSESSED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * The traceId comes from the signal's Context and is bridged into MDC for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = FusionTrace.current(signal.getContextView());
            FusionTrace.logScoped(traceId, () ->
                log.info("[FusionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        FusionTrace.logScoped(traceId, () ->
            log.info("[FusionFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /**
     * One-line summary of a fused sentiment: subject, status, score, label, confidence.
     * Degraded and unavailable results also log their reason.
     */
    public void logSentiment(SignalResult<CombinedSentiment> result, String traceId) {
        CombinedSentiment value = result.value();
        FusionTrace.logScoped(traceId, () ->
            log.info("[FusionFlow] stage={} subject={} status={} score={} label={} confidence={} reason={} traceId={}",
                     SENTIMENT_FUSED,
                     value != null ? value.subject() : "N/A",
                     result.status(),
                     value != null ? String.format("%.4f", value.score()) : "N/A",
                     value != null ? value.label() : "N/A",
                     value != null ? String.format("%.4f", value.confidence()) : "N/A",
                     result.reason() != null ? result.reason() : "-",
                     traceId)
        );
    }
}
