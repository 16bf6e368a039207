package com.catalog.importer.imports.csv;

import com.catalog.importer.imports.model.ParsedRow;
import com.catalog.importer.imports.model.ProductColumn;
import com.catalog.importer.imports.model.ProductRecord;
import com.catalog.importer.imports.model.RowError;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the raw values of one data row into a {@link ProductRecord}, or a {@link RowError}
 * naming the first offending field.
 */
final class ProductRowValidator {
    private static final char REPLACEMENT_CHAR = '\uFFFD';
    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "y", "t");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no", "n", "f");

    private ProductRowValidator() {
    }

    static ParsedRow validate(int rowNumber, Map<ProductColumn, String> values) {
        for (Map.Entry<ProductColumn, String> entry : values.entrySet()) {
            String value = entry.getValue();
            if (value != null && value.indexOf(REPLACEMENT_CHAR) >= 0) {
                return invalid(rowNumber, entry.getKey(), "Malformed character encoding");
            }
        }

        String sku = trimToNull(values.get(ProductColumn.SKU));
        if (sku == null) {
            return invalid(rowNumber, ProductColumn.SKU, "SKU is required");
        }
        String name = trimToNull(values.get(ProductColumn.NAME));
        if (name == null) {
            return invalid(rowNumber, ProductColumn.NAME, "Name is required");
        }
        String description = trimToNull(values.get(ProductColumn.DESCRIPTION));

        BigDecimal price = null;
        String rawPrice = trimToNull(values.get(ProductColumn.PRICE));
        if (rawPrice != null) {
            try {
                price = new BigDecimal(rawPrice);
            } catch (NumberFormatException e) {
                return invalid(rowNumber, ProductColumn.PRICE, "Invalid price format: " + rawPrice);
            }
            if (price.signum() < 0) {
                return invalid(rowNumber, ProductColumn.PRICE, "Price cannot be negative");
            }
        }

        int quantity = 0;
        String rawQuantity = trimToNull(values.get(ProductColumn.QUANTITY));
        if (rawQuantity != null) {
            try {
                quantity = Integer.parseInt(rawQuantity);
            } catch (NumberFormatException e) {
                return invalid(rowNumber, ProductColumn.QUANTITY, "Invalid quantity format: " + rawQuantity);
            }
            if (quantity < 0) {
                return invalid(rowNumber, ProductColumn.QUANTITY, "Quantity cannot be negative");
            }
        }

        boolean active = true;
        String rawActive = trimToNull(values.get(ProductColumn.IS_ACTIVE));
        if (rawActive != null) {
            String normalized = rawActive.toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(normalized)) {
                active = true;
            } else if (FALSE_VALUES.contains(normalized)) {
                active = false;
            } else {
                return invalid(rowNumber, ProductColumn.IS_ACTIVE, "Invalid boolean value: " + rawActive);
            }
        }

        return ParsedRow.valid(new ProductRecord(
            rowNumber,
            normalizeSku(sku),
            name,
            description,
            price,
            quantity,
            active
        ));
    }

    static String normalizeSku(String sku) {
        return sku == null ? null : sku.trim().toUpperCase(Locale.ROOT);
    }

    private static ParsedRow invalid(int rowNumber, ProductColumn column, String reason) {
        return ParsedRow.invalid(new RowError(rowNumber, column.header(), reason));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
