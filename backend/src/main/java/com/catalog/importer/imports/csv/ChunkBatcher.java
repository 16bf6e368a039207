package com.catalog.importer.imports.csv;

import com.catalog.importer.imports.model.ImportBatch;
import com.catalog.importer.imports.model.ParsedRow;
import com.catalog.importer.imports.model.ProductRecord;
import com.catalog.importer.imports.model.RowError;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Groups decoded rows into ordered batches of at most {@code maxRows} source rows. Row order is
 * kept within and across batches; only the last batch may be short.
 */
public class ChunkBatcher implements Iterator<ImportBatch> {
    private final Iterator<ParsedRow> rows;
    private final int maxRows;
    private int sequence;

    public ChunkBatcher(Iterator<ParsedRow> rows, int maxRows) {
        this.rows = rows;
        this.maxRows = Math.max(1, maxRows);
    }

    @Override
    public boolean hasNext() {
        return rows.hasNext();
    }

    @Override
    public ImportBatch next() {
        if (!rows.hasNext()) {
            throw new NoSuchElementException();
        }
        List<ProductRecord> records = new ArrayList<>(Math.min(maxRows, 1024));
        List<RowError> rowErrors = new ArrayList<>();
        while (records.size() + rowErrors.size() < maxRows && rows.hasNext()) {
            ParsedRow row = rows.next();
            if (row.isValid()) {
                records.add(row.product());
            } else {
                rowErrors.add(row.error());
            }
        }
        sequence++;
        return new ImportBatch(sequence, records, rowErrors);
    }
}
