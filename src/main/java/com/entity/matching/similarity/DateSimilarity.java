package com.entity.matching.similarity;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Similarity between dates, hedging against common typing mistakes:
 * <ul>
 *   <li>dates less than {@code daysMaxDiff} days apart score {@code 1 - days / daysMaxDiff};</li>
 *   <li>same year with month and day swapped scores 0.5;</li>
 *   <li>same year and day falls back to Levenshtein similarity of the {@code yyyyMMdd} forms;</li>
 *   <li>anything else scores 0.</li>
 * </ul>
 * Accepts {@link LocalDate}, {@link LocalDateTime} and ISO-8601 date strings.
 */
public class DateSimilarity implements FieldSimilarity {

    private static final int DEFAULT_DAYS_MAX_DIFF = 30;
    private static final DateTimeFormatter COMPACT = DateTimeFormatter.BASIC_ISO_DATE;

    private final int daysMaxDiff;
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

    public DateSimilarity() {
        this(DEFAULT_DAYS_MAX_DIFF);
    }

    public DateSimilarity(int daysMaxDiff) {
        if (daysMaxDiff <= 0) {
            throw new IllegalArgumentException("daysMaxDiff must be positive");
        }
        this.daysMaxDiff = daysMaxDiff;
    }

    @Override
    public double similarity(Object a, Object b) {
        LocalDate d1 = toDate(a);
        LocalDate d2 = toDate(b);

        long days = Math.abs(ChronoUnit.DAYS.between(d1, d2));
        if (days < daysMaxDiff) {
            return 1.0 - (double) days / daysMaxDiff;
        }
        if (d1.getYear() == d2.getYear()
                && d1.getMonthValue() == d2.getDayOfMonth()
                && d1.getDayOfMonth() == d2.getMonthValue()) {
            return 0.5;
        }
        if (d1.getYear() == d2.getYear() && d1.getDayOfMonth() == d2.getDayOfMonth()) {
            return levenshtein.compute(d1.format(COMPACT), d2.format(COMPACT));
        }
        return 0.0;
    }

    @Override
    public String getName() {
        return "Date";
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        return LocalDate.parse(value.toString().trim());
    }
}
