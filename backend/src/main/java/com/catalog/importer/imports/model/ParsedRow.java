package com.catalog.importer.imports.model;

/**
 * Outcome of decoding one CSV record: exactly one of {@code product} or {@code error} is set.
 */
public record ParsedRow(int rowNumber, ProductRecord product, RowError error) {

    public static ParsedRow valid(ProductRecord product) {
        return new ParsedRow(product.rowNumber(), product, null);
    }

    public static ParsedRow invalid(RowError error) {
        return new ParsedRow(error.row(), null, error);
    }

    public boolean isValid() {
        return product != null;
    }
}
