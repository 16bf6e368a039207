package com.catalog.importer.imports.model;

public record ImportEventData(
    String jobId,
    String filename,
    ImportJobStatus status,
    Integer totalRows,
    int processedRows,
    int createdCount,
    int updatedCount,
    int errorCount,
    String message,
    String error
) {
    public static ImportEventData from(ImportJobSnapshot snapshot) {
        return new ImportEventData(
            snapshot.id(),
            snapshot.filename(),
            snapshot.status(),
            snapshot.totalRows(),
            snapshot.processedRows(),
            snapshot.createdCount(),
            snapshot.updatedCount(),
            snapshot.errorCount(),
            snapshot.message(),
            snapshot.error()
        );
    }
}
