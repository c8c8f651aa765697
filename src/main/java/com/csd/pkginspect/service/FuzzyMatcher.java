package com.csd.pkginspect.service;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Locale;
import java.util.Optional;

/**
 * Case-insensitive similarity scoring used for package, field, ecosystem and option names.
 * The ratio is {@code 2 * LCS / (len(a) + len(b)) * 100}, so {@code reqeusts} vs {@code requests} scores 87.5.
 */
public final class FuzzyMatcher {

    public static final int DEFAULT_THRESHOLD = 95;
    public static final int LOOSE_THRESHOLD = 85;

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private FuzzyMatcher() {}

    public static double ratio(String a, String b) {
        if (a == null || b == null) {
            return 0;
        }
        String left = a.toLowerCase(Locale.ROOT);
        String right = b.toLowerCase(Locale.ROOT);
        int total = left.length() + right.length();
        if (total == 0) {
            return 100;
        }
        return 200.0 * LCS.apply(left, right) / total;
    }

    /**
     * Highest-scoring choice regardless of threshold. Ties keep the first candidate in iteration order.
     */
    public static Optional<String> bestCandidate(String query, Iterable<String> choices) {
        String best = null;
        double bestScore = -1;
        for (String choice : choices) {
            double score = ratio(query, choice);
            if (score > bestScore) {
                best = choice;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    public static Optional<String> bestMatch(String query, Iterable<String> choices, int minRatio) {
        if (query == null) {
            return Optional.empty();
        }
        return bestCandidate(query, choices).filter(c -> ratio(query, c) >= minRatio);
    }

    public static Optional<String> bestMatch(String query, Iterable<String> choices) {
        return bestMatch(query, choices, DEFAULT_THRESHOLD);
    }

    public static boolean matches(String query, String choice, int minRatio) {
        return ratio(query, choice) >= minRatio;
    }
}
