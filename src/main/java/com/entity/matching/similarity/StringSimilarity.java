package com.entity.matching.similarity;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Base for similarities over text. Values are converted with {@link String#valueOf(Object)}
 * and stripped of diacritics before comparison, so "Zoë" and "Zoe" compare as equal.
 */
public interface StringSimilarity extends FieldSimilarity {

    Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    @Override
    default double similarity(Object a, Object b) {
        return compute(fold(String.valueOf(a)), fold(String.valueOf(b)));
    }

    /**
     * Decomposes accented characters and removes the combining marks.
     */
    static String fold(String s) {
        if (s == null) {
            return null;
        }
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }
}
