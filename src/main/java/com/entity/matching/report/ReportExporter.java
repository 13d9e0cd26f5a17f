package com.entity.matching.report;

import com.entity.matching.core.model.DecisionSummary;

import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * Writes match reports in a specific format (CSV, JSON, ...).
 */
public interface ReportExporter {

    /**
     * Writes named report sections followed by the decision summary.
     *
     * @param sections section title to report rows, written in map order
     * @param decision the decision summary, or null to omit it
     * @param writer   destination; flushed but not closed
     * @return counts of what was written
     */
    <K extends Comparable<K>> ExportResult export(Map<String, List<ReportRow<K>>> sections,
                                                  DecisionSummary decision, Writer writer);

    /**
     * Returns the format produced by this exporter (e.g., "csv", "json").
     */
    String getFormat();
}
