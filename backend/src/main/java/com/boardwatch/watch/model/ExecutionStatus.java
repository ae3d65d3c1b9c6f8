package com.boardwatch.watch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionStatus {
    SUCCESS("success"),
    NO_ARTICLES("no_articles"),
    ERROR("error");

    private final String wireValue;

    ExecutionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static ExecutionStatus fromWireValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ExecutionStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
