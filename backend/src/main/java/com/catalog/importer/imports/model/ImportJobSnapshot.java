package com.catalog.importer.imports.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of an import job's progress at one instant. Instances are only ever replaced
 * wholesale, so any reader sees every counter from the same batch.
 */
public record ImportJobSnapshot(
    String id,
    String filename,
    ImportJobStatus status,
    Integer totalRows,
    int processedRows,
    int createdCount,
    int updatedCount,
    int errorCount,
    String message,
    String error,
    List<RowError> errorDetails,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant updatedAt
) {
    public ImportJobSnapshot {
        errorDetails = errorDetails == null ? List.of() : List.copyOf(errorDetails);
    }

    public static ImportJobSnapshot pending(String id, String filename, Instant createdAt) {
        return new ImportJobSnapshot(
            id,
            filename,
            ImportJobStatus.PENDING,
            null,
            0,
            0,
            0,
            0,
            "Queued for processing",
            null,
            List.of(),
            createdAt,
            null,
            null,
            createdAt
        );
    }

    @JsonProperty("progress_percentage")
    public double progressPercentage() {
        if (totalRows == null || totalRows <= 0) {
            return 0.0;
        }
        double raw = (double) processedRows / totalRows * 100.0;
        double clamped = Math.max(0.0, Math.min(100.0, raw));
        return Math.round(clamped * 100.0) / 100.0;
    }
}
