package com.signalfusion.common.scoring;

import com.signalfusion.common.model.ModelKind;
import com.signalfusion.common.model.SentimentReading;

/**
 * Injected sentiment inference. Given a text and the model to route to, returns a label
 * and its probability.
 *
 * <p>Implementations must be synchronous and side-effect free from the caller's point of
 * view. They may be local or remote; failures are reported by throwing
 * {@link InferenceException} (or any runtime exception), never by returning {@code null}.
 */
@FunctionalInterface
public interface SentimentCapability {

    SentimentReading classify(String text, ModelKind kind);
}
