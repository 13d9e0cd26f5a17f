package com.entity.matching.bulk;

import com.entity.matching.core.model.Row;
import com.entity.matching.core.model.StructuralException;
import com.entity.matching.core.model.Table;
import com.entity.matching.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV table loader.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * id,name,city
 * a1,"Beech, Ltd",Paris
 * a2,Dupas,
 * </pre>
 *
 * <p>The first line holds the field names. Values may be quoted, with {@code ""}
 * standing for a literal quote. Empty cells load as {@code null}. All other values
 * load as strings. Blank lines are skipped.</p>
 */
public class CsvTableLoader implements TableLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvTableLoader.class);
    private static final int PROGRESS_INTERVAL = 100;

    @Override
    public Table<String> load(Reader reader, String keyField, ProgressCallback callback) {
        if (keyField == null) {
            throw new IllegalArgumentException("keyField must not be null");
        }
        return read(reader, keyField, callback);
    }

    @Override
    public Table<Integer> loadNumbered(Reader reader, ProgressCallback callback) {
        return read(reader, null, callback);
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    @SuppressWarnings("unchecked")
    private <K extends Comparable<K>> Table<K> read(Reader reader, String keyField, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;

        try (LogContext ctx = LogContext.forTransfer("load", getFormat());
             BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = br.readLine();
            if (header == null) {
                throw new StructuralException("CSV input has no header line");
            }
            List<String> columns = parseLine(header, 1);
            int keyColumn = -1;
            if (keyField != null) {
                keyColumn = columns.indexOf(keyField);
                if (keyColumn < 0) {
                    throw new StructuralException("Key field '" + keyField + "' is not in header " + columns);
                }
            }
            List<String> fields = new ArrayList<>(columns);
            if (keyColumn >= 0) {
                fields.remove(keyColumn);
            }

            List<Row<K>> rows = new ArrayList<>();
            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                List<String> cells = parseLine(line, lineNumber);
                if (cells.size() != columns.size()) {
                    throw new StructuralException("Line " + lineNumber + " has " + cells.size()
                            + " cells but header has " + columns.size());
                }

                Map<String, Object> values = new LinkedHashMap<>();
                Object key = null;
                for (int i = 0; i < columns.size(); i++) {
                    String cell = cells.get(i);
                    if (i == keyColumn) {
                        key = cell;
                    } else {
                        values.put(columns.get(i), cell);
                    }
                }
                if (keyColumn >= 0) {
                    if (key == null) {
                        throw new StructuralException("Line " + lineNumber + " has no value for key field '"
                                + keyField + "'");
                    }
                } else {
                    key = rows.size();
                }
                rows.add(new Row<>((K) key, values));

                if (rows.size() % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(rows.size(), -1, "Loaded " + rows.size() + " rows");
                }
            }

            Table<K> table = Table.of(fields, rows);
            cb.onProgress(rows.size(), rows.size(), "Load completed");
            log.info("load.completed format={} rows={} fields={}", getFormat(), table.size(), fields.size());
            return table;
        } catch (IOException e) {
            log.error("load.failed format={} error={}", getFormat(), e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Splits one CSV line, handling quoted values. Empty unquoted cells become null.
     */
    static List<String> parseLine(String line, long lineNumber) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean wasQuoted = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"' && current.length() == 0 && !wasQuoted) {
                quoted = true;
                wasQuoted = true;
            } else if (c == ',') {
                cells.add(cell(current, wasQuoted));
                current.setLength(0);
                wasQuoted = false;
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new StructuralException("Line " + lineNumber + " has an unterminated quoted value");
        }
        cells.add(cell(current, wasQuoted));
        return cells;
    }

    private static String cell(StringBuilder current, boolean wasQuoted) {
        String value = wasQuoted ? current.toString() : current.toString().trim();
        return value.isEmpty() ? null : value;
    }
}
