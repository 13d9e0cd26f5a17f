package com.entity.matching.report;

/**
 * Result of a report export.
 *
 * @param sections     number of report sections written
 * @param rowsWritten  number of report rows written across all sections
 */
public record ExportResult(int sections, long rowsWritten) {

    @Override
    public String toString() {
        return "ExportResult{sections=" + sections + ", rows=" + rowsWritten + '}';
    }
}
