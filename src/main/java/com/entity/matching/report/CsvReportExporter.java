package com.entity.matching.report;

import com.entity.matching.core.model.DecisionSummary;
import com.entity.matching.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CSV report exporter.
 *
 * <p>Output format:</p>
 * <pre>
 * # CLUSTERS
 * group,pairIndex,score,key,name,city
 * 0,0,0.9500,"a1","Beech Ltd","Paris"
 * 0,0,0.9500,"b7","Beech Limited","Paris"
 *
 * # DECISION
 * matchThreshold,matchedPairs,rowsA,rowsB,percentOfA,percentOfB
 * 0.900,12,40,38,30.00,31.58
 * </pre>
 *
 * <p>Field columns are taken from the first row of each section.</p>
 */
public class CsvReportExporter implements ReportExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvReportExporter.class);

    @Override
    public <K extends Comparable<K>> ExportResult export(Map<String, List<ReportRow<K>>> sections,
                                                         DecisionSummary decision, Writer writer) {
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        long totalRows = 0;
        boolean first = true;

        try (LogContext ctx = LogContext.forTransfer("export", getFormat())) {
            for (Map.Entry<String, List<ReportRow<K>>> section : sections.entrySet()) {
                if (!first) {
                    pw.println();
                }
                first = false;
                pw.println("# " + section.getKey().toUpperCase(Locale.ROOT));

                List<ReportRow<K>> rows = section.getValue();
                List<String> fields = rows.isEmpty() ? List.of() : List.copyOf(rows.get(0).fields().keySet());
                StringBuilder header = new StringBuilder("group,pairIndex,score,key");
                for (String field : fields) {
                    header.append(',').append(csvEscape(field));
                }
                pw.println(header);

                for (ReportRow<K> row : rows) {
                    StringBuilder line = new StringBuilder()
                            .append(csvEscape(row.group())).append(',')
                            .append(row.pairIndex()).append(',')
                            .append(String.format(Locale.ROOT, "%.4f", row.score())).append(',')
                            .append(csvEscape(String.valueOf(row.rowKey())));
                    for (String field : fields) {
                        Object value = row.fields().get(field);
                        line.append(',').append(csvEscape(value == null ? null : String.valueOf(value)));
                    }
                    pw.println(line);
                    totalRows++;
                }
                log.debug("export.section title={} rows={}", section.getKey(), rows.size());
            }

            if (decision != null) {
                if (!first) {
                    pw.println();
                }
                pw.println("# DECISION");
                pw.println("matchThreshold,matchedPairs,rowsA,rowsB,percentOfA,percentOfB");
                pw.println(String.format(Locale.ROOT, "%.3f,%d,%d,%d,%.2f,%.2f",
                        decision.matchThreshold(), decision.matchedPairs(), decision.rowsA(),
                        decision.rowsB(), decision.percentOfA(), decision.percentOfB()));
            }

            pw.flush();
            if (pw.checkError()) {
                throw new UncheckedIOException(new IOException("Failed writing CSV report"));
            }
        }

        ExportResult result = new ExportResult(sections.size(), totalRows);
        log.info("export.completed format={} result={}", getFormat(), result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
