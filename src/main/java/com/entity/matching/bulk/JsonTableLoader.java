package com.entity.matching.bulk;

import com.entity.matching.core.model.Row;
import com.entity.matching.core.model.StructuralException;
import com.entity.matching.core.model.Table;
import com.entity.matching.logging.LogContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON table loader.
 *
 * <p>Accepts a JSON array of objects:</p>
 * <pre>
 * [
 *   {"id": "a1", "name": "Beech Ltd", "aliases": ["Beech", "BL"]},
 *   {"id": "a2", "name": "Dupas", "aliases": null}
 * ]
 * </pre>
 *
 * <p>or JSON Lines, one object per line. The fields of the first object define the
 * table's fields; every other object must carry the same ones. Strings, numbers and
 * booleans load as their Java counterparts, arrays as lists.</p>
 */
public class JsonTableLoader implements TableLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonTableLoader.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final ObjectMapper mapper;

    public JsonTableLoader() {
        this(new ObjectMapper());
    }

    public JsonTableLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

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
        return "json";
    }

    @SuppressWarnings("unchecked")
    private <K extends Comparable<K>> Table<K> read(Reader reader, String keyField, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;

        try (LogContext ctx = LogContext.forTransfer("load", getFormat())) {
            List<JsonNode> objects = readObjects(reader);
            List<String> fields = new ArrayList<>();
            List<Row<K>> rows = new ArrayList<>();

            for (JsonNode node : objects) {
                if (!node.isObject()) {
                    throw new StructuralException("Row " + rows.size() + " is not a JSON object: " + node);
                }
                Map<String, Object> values = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> field = it.next();
                    values.put(field.getKey(), toValue(field.getValue()));
                }

                Object key;
                if (keyField != null) {
                    if (!values.containsKey(keyField) || values.get(keyField) == null) {
                        throw new StructuralException("Row " + rows.size() + " has no value for key field '"
                                + keyField + "'");
                    }
                    key = String.valueOf(values.remove(keyField));
                } else {
                    key = rows.size();
                }
                if (rows.isEmpty()) {
                    fields.addAll(values.keySet());
                }
                rows.add(new Row<>((K) key, values));

                if (rows.size() % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(rows.size(), objects.size(), "Loaded " + rows.size() + " rows");
                }
            }

            Table<K> table = Table.of(fields, rows);
            cb.onProgress(rows.size(), rows.size(), "Load completed");
            log.info("load.completed format={} rows={} fields={}", getFormat(), table.size(), fields.size());
            return table;
        } catch (JsonProcessingException e) {
            log.error("load.failed format={} error={}", getFormat(), e.getOriginalMessage());
            throw new StructuralException("Malformed JSON input: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            log.error("load.failed format={} error={}", getFormat(), e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads either a top-level array or a sequence of root-level objects (JSON Lines).
     */
    private List<JsonNode> readObjects(Reader reader) throws IOException {
        List<JsonNode> objects = new ArrayList<>();
        try (MappingIterator<JsonNode> it = mapper.readerFor(JsonNode.class).readValues(reader)) {
            while (it.hasNextValue()) {
                JsonNode node = it.nextValue();
                if (node.isArray()) {
                    node.forEach(objects::add);
                } else {
                    objects.add(node);
                }
            }
        }
        return objects;
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : (Object) node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isArray()) {
            List<Object> elements = new ArrayList<>(node.size());
            node.forEach(element -> elements.add(toValue(element)));
            return elements;
        }
        return node.toString();
    }
}
