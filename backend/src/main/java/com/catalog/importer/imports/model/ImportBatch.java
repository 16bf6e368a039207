package com.catalog.importer.imports.model;

import java.util.List;

/**
 * A contiguous slice of the source file: the valid records in file order plus the rows that
 * failed to decode while the slice was being filled.
 */
public record ImportBatch(int sequence, List<ProductRecord> records, List<RowError> rowErrors) {
    public ImportBatch {
        records = List.copyOf(records);
        rowErrors = List.copyOf(rowErrors);
    }

    public int rowCount() {
        return records.size() + rowErrors.size();
    }
}
