package com.entity.matching.similarity;

/**
 * Edit distance similarity: {@code 1 - distance / max(len1, len2)}.
 */
public class LevenshteinSimilarity implements StringSimilarity {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int distance = distance(s1, s2);
        return 1.0 - ((double) distance / Math.max(s1.length(), s2.length()));
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Wagner-Fischer with two rows sized on the shorter string.
     */
    static int distance(String s1, String s2) {
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i < previous.length; i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int cost = shorter.charAt(i - 1) == c ? 0 : 1;
                current[i] = Math.min(Math.min(current[i - 1] + 1, previous[i] + 1), previous[i - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[shorter.length()];
    }
}
