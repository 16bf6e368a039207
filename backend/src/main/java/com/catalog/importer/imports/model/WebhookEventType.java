package com.catalog.importer.imports.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WebhookEventType {
    PRODUCT_CREATED("product.created", "Product Created"),
    PRODUCT_UPDATED("product.updated", "Product Updated"),
    PRODUCT_DELETED("product.deleted", "Product Deleted"),
    IMPORT_STARTED("import.started", "Import Started"),
    IMPORT_COMPLETED("import.completed", "Import Completed"),
    IMPORT_FAILED("import.failed", "Import Failed");

    private final String value;
    private final String label;

    WebhookEventType(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String label() {
        return label;
    }

    public static WebhookEventType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        for (WebhookEventType type : values()) {
            if (type.value.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }
}
