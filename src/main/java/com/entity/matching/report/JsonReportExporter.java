package com.entity.matching.report;

import com.entity.matching.core.model.DecisionSummary;
import com.entity.matching.logging.LogContext;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.lang.reflect.Array;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * JSON report exporter. Writes a single object with one array per section and an
 * optional {@code decision} object:
 *
 * <pre>
 * {
 *   "sections" : {
 *     "clusters" : [ { "group" : "0", "pairIndex" : 0, "score" : 0.95, "key" : "a1",
 *                      "fields" : { "name" : "Beech Ltd" } } ]
 *   },
 *   "decision" : { "matchThreshold" : 0.9, "matchedPairs" : 12, ... }
 * }
 * </pre>
 *
 * Lists and maps are written as JSON arrays and objects. Other values with no JSON
 * counterpart are written as strings.
 */
public class JsonReportExporter implements ReportExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonReportExporter.class);

    private final ObjectMapper mapper;

    public JsonReportExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonReportExporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public <K extends Comparable<K>> ExportResult export(Map<String, List<ReportRow<K>>> sections,
                                                         DecisionSummary decision, Writer writer) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode sectionsNode = root.putObject("sections");
        long totalRows = 0;

        try (LogContext ctx = LogContext.forTransfer("export", getFormat())) {
            for (Map.Entry<String, List<ReportRow<K>>> section : sections.entrySet()) {
                ArrayNode array = sectionsNode.putArray(section.getKey());
                for (ReportRow<K> row : section.getValue()) {
                    ObjectNode node = array.addObject();
                    node.put("group", row.group());
                    node.put("pairIndex", row.pairIndex());
                    node.put("score", row.score());
                    putValue(node, "key", row.rowKey());
                    ObjectNode fields = node.putObject("fields");
                    row.fields().forEach((field, value) -> putValue(fields, field, value));
                    totalRows++;
                }
            }

            if (decision != null) {
                ObjectNode node = root.putObject("decision");
                node.put("matchThreshold", decision.matchThreshold());
                node.put("matchedPairs", decision.matchedPairs());
                node.put("rowsA", decision.rowsA());
                node.put("rowsB", decision.rowsB());
                node.put("percentOfA", decision.percentOfA());
                node.put("percentOfB", decision.percentOfB());
            }

            mapper.writer()
                    .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                    .writeValue(writer, root);
            writer.flush();
        } catch (IOException e) {
            log.error("export.failed format={} error={}", getFormat(), e.getMessage());
            throw new UncheckedIOException(e);
        }

        ExportResult result = new ExportResult(sections.size(), totalRows);
        log.info("export.completed format={} result={}", getFormat(), result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private void putValue(ObjectNode node, String name, Object value) {
        node.set(name, toNode(value));
    }

    /**
     * Lists, arrays and maps keep their structure; values with no JSON counterpart,
     * such as dates, are written as strings.
     */
    private JsonNode toNode(Object value) {
        JsonNodeFactory factory = mapper.getNodeFactory();
        if (value == null) {
            return factory.nullNode();
        } else if (value instanceof String s) {
            return factory.textNode(s);
        } else if (value instanceof Integer i) {
            return factory.numberNode(i);
        } else if (value instanceof Long l) {
            return factory.numberNode(l);
        } else if (value instanceof Number n) {
            return factory.numberNode(n.doubleValue());
        } else if (value instanceof Boolean b) {
            return factory.booleanNode(b);
        } else if (value instanceof Collection<?> collection) {
            ArrayNode array = factory.arrayNode();
            for (Object element : collection) {
                array.add(toNode(element));
            }
            return array;
        } else if (value.getClass().isArray()) {
            ArrayNode array = factory.arrayNode();
            for (int i = 0; i < Array.getLength(value); i++) {
                array.add(toNode(Array.get(value, i)));
            }
            return array;
        } else if (value instanceof Map<?, ?> map) {
            ObjectNode object = factory.objectNode();
            map.forEach((key, element) -> object.set(String.valueOf(key), toNode(element)));
            return object;
        }
        return factory.textNode(String.valueOf(value));
    }
}
