package com.catalog.importer.imports.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImportJobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(ImportJobStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == RUNNING || next.isTerminal();
            default -> false;
        };
    }

    public static ImportJobStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return ImportJobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
