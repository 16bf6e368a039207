package com.catalog.importer.imports.model;

import java.util.Locale;

/**
 * Recognized CSV columns. The header name doubles as the {@code products} column name.
 */
public enum ProductColumn {
    SKU("sku", true),
    NAME("name", true),
    DESCRIPTION("description", false),
    PRICE("price", false),
    QUANTITY("quantity", false),
    IS_ACTIVE("is_active", false);

    private final String header;
    private final boolean required;

    ProductColumn(String header, boolean required) {
        this.header = header;
        this.required = required;
    }

    public String header() {
        return header;
    }

    public String columnName() {
        return header;
    }

    public boolean isRequired() {
        return required;
    }

    public static ProductColumn fromHeader(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ProductColumn column : values()) {
            if (column.header.equals(normalized)) {
                return column;
            }
        }
        return null;
    }
}
