package com.raditha.merge.similarity;

/**
 * Calculates similarity using Levenshtein edit distance.
 * Space-optimized dynamic programming implementation.
 */
public class LevenshteinSimilarity {

    /**
     * Calculate Levenshtein-based similarity between two strings.
     *
     * @param s1 First string
     * @param s2 Second string
     * @return Similarity score (0.0 to 1.0)
     */
    public double calculate(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }

        if (s1.isEmpty() && s2.isEmpty()) {
            return 1.0;
        }

        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int distance = distance(s1, s2);
        int maxLength = Math.max(s1.length(), s2.length());

        // similarity = 1 - (distance / maxLength)
        return 1.0 - ((double) distance / maxLength);
    }

    /**
     * Compute Levenshtein edit distance using only O(min(m,n)) space.
     */
    public int distance(String s1, String s2) {
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;

        int m = shorter.length();
        int n = longer.length();

        // rolling rows
        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];

        for (int i = 0; i <= m; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            curr[0] = j;

            for (int i = 1; i <= m; i++) {
                if (shorter.charAt(i - 1) == longer.charAt(j - 1)) {
                    curr[i] = prev[i - 1];
                } else {
                    // Min of: delete, insert, replace
                    curr[i] = 1 + Math.min(Math.min(prev[i], curr[i - 1]), prev[i - 1]);
                }
            }

            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }

        return prev[m];
    }
}
