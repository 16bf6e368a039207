package com.catalog.importer.imports.model;

public record ImportUploadResponse(
    String jobId,
    ImportJobStatus status,
    String message,
    String statusUrl,
    String streamUrl
) {}
