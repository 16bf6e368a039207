package com.catalog.importer.imports.csv;

/**
 * The file's header row lacks a required column. Fatal for the whole import.
 */
public class CsvHeaderException extends RuntimeException {
    public CsvHeaderException(String message) {
        super(message);
    }
}
