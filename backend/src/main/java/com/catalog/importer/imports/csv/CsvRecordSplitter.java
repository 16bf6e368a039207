package com.catalog.importer.imports.csv;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * Cuts a CSV character stream into the raw text of one logical record at a time.
 *
 * <p>Boundaries follow RFC 4180 quoting as Commons CSV reads it: a quote opens a quoted field only
 * at the start of a field, a doubled quote inside it is literal, and line breaks inside quotes
 * belong to the record. Whatever follows a closing quote up to the next delimiter or line break
 * stays in the same record, so a badly quoted record never swallows the ones after it. Empty
 * lines are skipped.
 */
final class CsvRecordSplitter implements Closeable {
    private static final int NONE = -2;

    private final Reader reader;
    private final StringBuilder buffer = new StringBuilder();
    private int pushback = NONE;

    CsvRecordSplitter(Reader reader) {
        this.reader = reader;
    }

    /**
     * Returns the next non-empty record without its line terminator, or null at end of input.
     *
     * @throws CsvFormatException if the input ends inside a quoted field
     */
    String next() throws IOException {
        while (true) {
            buffer.setLength(0);
            boolean inQuotes = false;
            boolean fieldStart = true;
            int c;
            while ((c = read()) != -1) {
                if (inQuotes) {
                    buffer.append((char) c);
                    if (c == '"') {
                        int following = read();
                        if (following == '"') {
                            buffer.append('"');
                        } else {
                            inQuotes = false;
                            unread(following);
                        }
                    }
                    continue;
                }
                if (c == '\n' || c == '\r') {
                    if (c == '\r') {
                        int following = read();
                        if (following != '\n') {
                            unread(following);
                        }
                    }
                    break;
                }
                if (c == '"' && fieldStart) {
                    inQuotes = true;
                }
                fieldStart = c == ',';
                buffer.append((char) c);
            }
            if (inQuotes) {
                throw new CsvFormatException("Unterminated quoted field at end of file");
            }
            if (buffer.length() > 0) {
                return buffer.toString();
            }
            if (c == -1) {
                return null;
            }
        }
    }

    private int read() throws IOException {
        if (pushback != NONE) {
            int c = pushback;
            pushback = NONE;
            return c;
        }
        return reader.read();
    }

    private void unread(int c) {
        pushback = c;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
