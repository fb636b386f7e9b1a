package com.signalfusion.common.allocation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionPriority {
    HIGH("High"),
    MEDIUM("Medium");

    private final String label;

    ExecutionPriority(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
