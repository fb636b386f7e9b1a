package com.signalfusion.common.scoring;

import com.signalfusion.common.model.ModelKind;

/**
 * Thrown by a {@link SentimentCapability} when a model call cannot produce a reading.
 * {@link ItemAnalyzer} catches it and degrades the affected reading to neutral.
 */
public class InferenceException extends RuntimeException {
    private final ModelKind modelKind;

    public InferenceException(ModelKind modelKind, String message) {
        super("[" + modelKind + "] " + message);
        this.modelKind = modelKind;
    }

    public InferenceException(ModelKind modelKind, String message, Throwable cause) {
        super("[" + modelKind + "] " + message, cause);
        this.modelKind = modelKind;
    }

    public ModelKind getModelKind() {
        return modelKind;
    }
}
