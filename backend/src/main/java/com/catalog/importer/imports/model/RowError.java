package com.catalog.importer.imports.model;

/**
 * A problem with one source row. {@code row} is the 1-based position of the record in the
 * source file, counting the header as row 1.
 */
public record RowError(int row, String field, String reason) {}
