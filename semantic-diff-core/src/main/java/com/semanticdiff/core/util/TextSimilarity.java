package com.semanticdiff.core.util;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Locale;

/**
 * Case-insensitive string similarity based on the longest common subsequence.
 *
 * <p>The ratio is {@code 2 * lcs / (length(a) + length(b))}, so identical
 * strings score 1.0 and strings without a common character score 0.0.
 */
public final class TextSimilarity {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private TextSimilarity() {
        // Utility class
    }

    /**
     * Computes the similarity ratio of two strings.
     *
     * @param first first string (null treated as empty)
     * @param second second string (null treated as empty)
     * @return ratio in [0, 1]
     */
    public static double ratio(String first, String second) {
        String a = first == null ? "" : first.toLowerCase(Locale.ROOT);
        String b = second == null ? "" : second.toLowerCase(Locale.ROOT);
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * LCS.apply(a, b) / total;
    }
}
