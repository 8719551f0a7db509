package com.delta.redirects.resolve.match;

import java.util.Locale;

/**
 * Confidence score between two codes, 0 to 100, derived from the Levenshtein distance
 * of their normalized forms.
 *
 * <p>Normalization lowercases the input and drops every {@code x} and every {@code kh},
 * so transliteration variants of the same product code ("kh" vs "x") compare equal.
 */
public final class SimilarityScorer {
    public static final double MAX_SCORE = 100.0;
    public static final double MIN_SCORE = 0.0;

    private SimilarityScorer() {
    }

    public static String normalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT)
            .replace("x", "")
            .replace("kh", "");
    }

    public static double similarity(String first, String second) {
        if (first == null || first.isEmpty() || second == null || second.isEmpty()) {
            return MIN_SCORE;
        }
        return similarityOfNormalized(normalize(first), normalize(second));
    }

    static double similarityOfNormalized(String first, String second) {
        if (first.equals(second)) {
            return MAX_SCORE;
        }
        int maxLength = Math.max(first.length(), second.length());
        if (maxLength == 0) {
            return MAX_SCORE;
        }
        int distance = levenshtein(first, second);
        double percent = (1.0 - (double) distance / maxLength) * 100.0;
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, percent));
    }

    public static int levenshtein(String first, String second) {
        if (first.isEmpty()) {
            return second.length();
        }
        if (second.isEmpty()) {
            return first.length();
        }
        // two rolling rows instead of the full matrix
        int[] previous = new int[second.length() + 1];
        int[] current = new int[second.length() + 1];
        for (int j = 0; j <= second.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= first.length(); i++) {
            current[0] = i;
            char left = first.charAt(i - 1);
            for (int j = 1; j <= second.length(); j++) {
                int cost = left == second.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(current[j - 1] + 1, previous[j] + 1),
                    previous[j - 1] + cost
                );
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[second.length()];
    }
}
