package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status-tagged wrapper that lets callers tell a value computed from real signal apart
 * from one that was defaulted.
 *
 * <ul>
 *   <li>{@link Status#OK}: computed from the full set of inputs</li>
 *   <li>{@link Status#DEGRADED}: computed, but some inputs were missing or defaulted</li>
 *   <li>{@link Status#UNAVAILABLE}: no usable input; {@code value} holds a neutral default</li>
 * </ul>
 */
public record SignalResult<T>(
    @JsonProperty("status") Status status,
    @JsonProperty("value") T value,
    @JsonProperty("reason") String reason
) {
    public enum Status { OK, DEGRADED, UNAVAILABLE }

    public static <T> SignalResult<T> ok(T value) {
        return new SignalResult<>(Status.OK, value, null);
    }

    public static <T> SignalResult<T> degraded(T value, String reason) {
        return new SignalResult<>(Status.DEGRADED, value, reason);
    }

    public static <T> SignalResult<T> unavailable(T fallback, String reason) {
        return new SignalResult<>(Status.UNAVAILABLE, fallback, reason);
    }

    @JsonIgnore
    public boolean isOk() {
        return status == Status.OK;
    }

    @JsonIgnore
    public boolean isAvailable() {
        return status != Status.UNAVAILABLE;
    }
}
