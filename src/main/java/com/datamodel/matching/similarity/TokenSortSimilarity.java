package com.datamodel.matching.similarity;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Token-sort ratio: both strings are lowercased, split on whitespace, their tokens
 * sorted and re-joined, and the results compared by normalized Indel similarity
 * {@code (|a| + |b| - indel(a, b)) / (|a| + |b|)}.
 *
 * <p>Word order does not matter ("birth date" equals "date birth"); separators other
 * than whitespace are significant.</p>
 */
public class TokenSortSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }

        String sorted1 = sortTokens(s1);
        String sorted2 = sortTokens(s2);
        if (sorted1.equals(sorted2)) {
            return 1.0;
        }

        int totalLength = sorted1.length() + sorted2.length();
        int lcs = longestCommonSubsequence(sorted1, sorted2);
        // indel distance = |a| + |b| - 2 * lcs
        return (2.0 * lcs) / totalLength;
    }

    @Override
    public String getName() {
        return "TokenSort";
    }

    static String sortTokens(String s) {
        String[] tokens = WHITESPACE.split(s.trim().toLowerCase(Locale.ROOT));
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }

    /**
     * Length of the longest common subsequence, using two rolling rows.
     */
    private int longestCommonSubsequence(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int j = 1; j <= s2.length(); j++) {
            currentRow[0] = 0;
            char c2 = s2.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == c2) {
                    currentRow[i] = previousRow[i - 1] + 1;
                } else {
                    currentRow[i] = Math.max(currentRow[i - 1], previousRow[i]);
                }
            }
            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
