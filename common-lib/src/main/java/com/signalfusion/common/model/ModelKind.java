package com.signalfusion.common.model;

/**
 * Which sentiment model a {@link com.signalfusion.common.scoring.SentimentCapability}
 * call is routed to.
 */
public enum ModelKind {
    /** Finance-specialised model; trusted more on financial text. */
    FINANCE,
    /** General-purpose model; dominates on non-financial text. */
    GENERAL;

    public String code() {
        return name().toLowerCase();
    }
}
