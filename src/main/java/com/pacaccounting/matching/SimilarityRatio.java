package com.pacaccounting.matching;

/**
 * Gestalt pattern matching (Ratcliff/Obershelp) similarity.
 * <p>
 * The ratio is {@code 2 * M / T}, where {@code T} is the total length of both strings and
 * {@code M} the number of characters in matching blocks. Blocks are found by taking the
 * longest common substring and recursing on the parts to its left and right. Among equally
 * long substrings the one starting earliest in the first string, then in the second, wins.
 */
public final class SimilarityRatio {

    private SimilarityRatio() {
    }

    public static double ratio(String a, String b) {
        String first = a == null ? "" : a;
        String second = b == null ? "" : b;
        int total = first.length() + second.length();
        if (total == 0) {
            return 1.0;
        }
        int matches = matchingCharacters(first, 0, first.length(), second, 0, second.length());
        return 2.0 * matches / total;
    }

    private static int matchingCharacters(String a, int aLow, int aHigh, String b, int bLow, int bHigh) {
        if (aLow >= aHigh || bLow >= bHigh) {
            return 0;
        }
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;

        // lengths[j] = length of the common suffix ending at a[i - 1], b[j - 1]
        int width = bHigh - bLow + 1;
        int[] previous = new int[width];
        int[] current = new int[width];
        for (int i = aLow; i < aHigh; i++) {
            char c = a.charAt(i);
            for (int j = bLow; j < bHigh; j++) {
                int column = j - bLow + 1;
                if (b.charAt(j) == c) {
                    int k = previous[column - 1] + 1;
                    current[column] = k;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                } else {
                    current[column] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        if (bestSize == 0) {
            return 0;
        }
        return bestSize
                + matchingCharacters(a, aLow, bestI, b, bLow, bestJ)
                + matchingCharacters(a, bestI + bestSize, aHigh, b, bestJ + bestSize, bHigh);
    }
}
