package com.captainsprep.engine.service.qa;

import java.util.Locale;

/**
 * Symmetric similarity in [0, 1]: {@code 2 * LCS(a, b) / (|a| + |b|)} over normalised text.
 */
public final class SimilarityRatio {

    private SimilarityRatio() {
    }

    public static String normalise(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    public static double ratio(String a, String b) {
        String left = normalise(a);
        String right = normalise(b);
        int total = left.length() + right.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * longestCommonSubsequence(left, right) / total;
    }

    static int longestCommonSubsequence(String a, String b) {
        if (a.length() < b.length()) {
            String swap = a;
            a = b;
            b = swap;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char c = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (c == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
