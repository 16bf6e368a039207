package com.catalog.importer.imports.csv;

/**
 * The file cannot be tokenized as CSV past some point (for example an unterminated quoted field).
 */
public class CsvFormatException extends RuntimeException {
    public CsvFormatException(String message) {
        super(message);
    }

    public CsvFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
