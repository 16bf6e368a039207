package com.catalog.importer.imports.model;

import java.util.List;

public record BatchUpsertResult(int createdCount, int updatedCount, List<RowError> rowErrors) {
    public BatchUpsertResult {
        rowErrors = rowErrors == null ? List.of() : List.copyOf(rowErrors);
    }

    public static BatchUpsertResult empty() {
        return new BatchUpsertResult(0, 0, List.of());
    }
}
