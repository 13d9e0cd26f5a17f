package com.entity.matching.bulk;

import com.entity.matching.core.model.Table;

import java.io.Reader;

/**
 * Reads a {@link Table} from a specific format (CSV, JSON, ...).
 */
public interface TableLoader {

    /**
     * Loads a table keyed by the values of {@code keyField}. The key field is not
     * part of the resulting table's fields.
     *
     * @throws com.entity.matching.core.model.StructuralException if the input is malformed
     *         or a row lacks the key field
     * @throws java.io.UncheckedIOException if reading fails
     */
    Table<String> load(Reader reader, String keyField, ProgressCallback callback);

    /**
     * Loads a table keyed by row position, starting at 0.
     */
    Table<Integer> loadNumbered(Reader reader, ProgressCallback callback);

    default Table<String> load(Reader reader, String keyField) {
        return load(reader, keyField, ProgressCallback.NOOP);
    }

    default Table<Integer> loadNumbered(Reader reader) {
        return loadNumbered(reader, ProgressCallback.NOOP);
    }

    /**
     * Returns the format read by this loader (e.g., "csv", "json").
     */
    String getFormat();
}
