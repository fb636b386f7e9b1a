package com.signalfusion.common.exception;

/**
 * Raised when a fusion request or the static configuration behind it cannot be honoured.
 * Missing or noisy signal never raises this; it degrades to neutral values instead.
 *
 * <p>{@link Reason#INVALID_REQUEST} is the caller's fault and names the offending request
 * field when there is one. {@link Reason#INVALID_CONFIGURATION} covers tunables and the
 * sector catalog, which are fixed at startup.
 */
public class FusionException extends RuntimeException {

    public enum Reason { INVALID_REQUEST, INVALID_CONFIGURATION }

    private final Reason reason;
    private final String component;
    private final String field;

    private FusionException(Reason reason, String component, String field, String message, Throwable cause) {
        super(message, cause);
        this.reason    = reason;
        this.component = component;
        this.field     = field;
    }

    /** {@code "<field> must be <requirement> but was <value>"}. */
    public static FusionException invalidField(String component, String field, Object value, String requirement) {
        return new FusionException(Reason.INVALID_REQUEST, component, field,
            field + " must be " + requirement + " but was " + value, null);
    }

    public static FusionException invalidRequest(String component, String field, String message) {
        return new FusionException(Reason.INVALID_REQUEST, component, field, message, null);
    }

    public static FusionException invalidConfiguration(String component, String message) {
        return new FusionException(Reason.INVALID_CONFIGURATION, component, null, message, null);
    }

    public static FusionException invalidConfiguration(String component, String message, Throwable cause) {
        return new FusionException(Reason.INVALID_CONFIGURATION, component, null, message, cause);
    }

    public Reason getReason() {
        return reason;
    }

    public String getComponent() {
        return component;
    }

    /** Request field at fault, or {@code null} when the whole request or configuration is. */
    public String getField() {
        return field;
    }

    public boolean isCallerError() {
        return reason == Reason.INVALID_REQUEST;
    }
}
