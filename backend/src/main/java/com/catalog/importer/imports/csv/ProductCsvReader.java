package com.catalog.importer.imports.csv;

import com.catalog.importer.imports.model.ParsedRow;
import com.catalog.importer.imports.model.ProductColumn;
import com.catalog.importer.imports.model.RowError;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Streams product rows out of a CSV byte stream one record at a time.
 *
 * <p>The first record is the header. Columns are matched by name, case-insensitively; unknown
 * columns are ignored and {@code sku} and {@code name} are required. Invalid bytes are decoded
 * as U+FFFD and reported per row rather than failing the file, and so is a record whose quoting
 * Commons CSV rejects. Only a quoted field left open at the end of the file is fatal.
 */
@Component
public class ProductCsvReader {
    private static final char BOM = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setIgnoreEmptyLines(true)
        .setTrim(true)
        .build();

    public CsvRowStream open(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        try {
            return open(in);
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    public CsvRowStream open(InputStream in) throws IOException {
        CsvRecordSplitter splitter = splitter(in);
        try {
            String headerText = splitter.next();
            List<String> header = headerText == null ? List.of() : headerValues(headerText);
            Map<ProductColumn, Integer> columnIndex = indexColumns(header);
            List<String> missing = EnumSet.allOf(ProductColumn.class).stream()
                .filter(ProductColumn::isRequired)
                .filter(column -> !columnIndex.containsKey(column))
                .map(ProductColumn::header)
                .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                throw new CsvHeaderException("Missing required column(s): " + String.join(", ", missing));
            }
            return new CsvRowStream(splitter, columnIndex, header.size());
        } catch (IOException | RuntimeException e) {
            splitter.close();
            throw e;
        }
    }

    /**
     * Counts data records (excluding the header) with the same record boundaries used for
     * importing, so the count always matches the number of rows the import will see.
     */
    public int countRecords(Path file) throws IOException {
        try (CsvRecordSplitter splitter = splitter(Files.newInputStream(file))) {
            int count = 0;
            while (splitter.next() != null) {
                count++;
            }
            return Math.max(0, count - 1);
        }
    }

    private static CsvRecordSplitter splitter(InputStream in) {
        return new CsvRecordSplitter(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
    }

    private List<String> headerValues(String text) {
        String stripped = !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
        try {
            CSVRecord record = decode(stripped);
            List<String> header = new ArrayList<>(record.size());
            for (String value : record) {
                header.add(value);
            }
            return header;
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new CsvFormatException("Unreadable CSV header: " + e.getMessage(), e);
        }
    }

    private Map<ProductColumn, Integer> indexColumns(List<String> header) {
        Map<ProductColumn, Integer> index = new EnumMap<>(ProductColumn.class);
        for (int i = 0; i < header.size(); i++) {
            ProductColumn column = ProductColumn.fromHeader(header.get(i));
            if (column != null && !index.containsKey(column)) {
                index.put(column, i);
            }
        }
        return index;
    }

    private static CSVRecord decode(String text) throws IOException {
        try (CSVParser parser = CSVParser.parse(text, FORMAT)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.size() != 1) {
                throw new IllegalStateException("expected one record, found " + records.size());
            }
            return records.get(0);
        }
    }

    /**
     * Lazy, single-pass sequence of decoded rows. Not restartable; close it when done.
     */
    public static final class CsvRowStream implements Iterator<ParsedRow>, Closeable {
        private final CsvRecordSplitter splitter;
        private final Map<ProductColumn, Integer> columnIndex;
        private final int expectedValues;
        private String pending;
        private boolean exhausted;
        // the header is record 1
        private int recordNumber = 1;

        private CsvRowStream(
            CsvRecordSplitter splitter,
            Map<ProductColumn, Integer> columnIndex,
            int expectedValues
        ) {
            this.splitter = splitter;
            this.columnIndex = columnIndex;
            this.expectedValues = expectedValues;
        }

        public Set<ProductColumn> columns() {
            return Collections.unmodifiableSet(columnIndex.isEmpty()
                ? EnumSet.noneOf(ProductColumn.class)
                : EnumSet.copyOf(columnIndex.keySet()));
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !exhausted) {
                try {
                    pending = splitter.next();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                exhausted = pending == null;
            }
            return pending != null;
        }

        @Override
        public ParsedRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String text = pending;
            pending = null;
            int rowNumber = ++recordNumber;

            CSVRecord record;
            try {
                record = decode(text);
            } catch (IOException | UncheckedIOException | IllegalStateException e) {
                return ParsedRow.invalid(new RowError(rowNumber, null, "Malformed quoted field"));
            }
            if (record.size() != expectedValues) {
                return ParsedRow.invalid(new RowError(
                    rowNumber,
                    null,
                    "Column count mismatch: expected " + expectedValues + " values, found " + record.size()
                ));
            }
            Map<ProductColumn, String> values = new EnumMap<>(ProductColumn.class);
            for (Map.Entry<ProductColumn, Integer> entry : columnIndex.entrySet()) {
                values.put(entry.getKey(), record.get(entry.getValue()));
            }
            return ProductRowValidator.validate(rowNumber, values);
        }

        @Override
        public void close() throws IOException {
            splitter.close();
        }
    }
}
