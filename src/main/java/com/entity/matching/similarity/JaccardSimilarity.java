package com.entity.matching.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token overlap: {@code |intersection| / |union|} of lower-cased tokens.
 * Useful for multi-word values such as addresses or organisation names.
 */
public class JaccardSimilarity implements StringSimilarity {

    private final Pattern separator;

    public JaccardSimilarity() {
        this("\\s+");
    }

    public JaccardSimilarity(String separatorPattern) {
        this.separator = Pattern.compile(separatorPattern);
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() && tokens2.isEmpty()) {
            return s1.equals(s2) ? 1.0 : 0.0;
        }
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int common = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                common++;
            }
        }
        return (double) common / (tokens1.size() + tokens2.size() - common);
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    private Set<String> tokenize(String s) {
        Set<String> tokens = new HashSet<>();
        for (String token : separator.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isBlank()) {
                tokens.add(token.trim());
            }
        }
        return tokens;
    }
}
