package com.example.hostguard.registry;

/**
 * Ratcliff/Obershelp "gestalt pattern matching" ratio: twice the number of
 * matching characters divided by the total length of both strings. The
 * matching characters are found by taking the longest common block and
 * recursing on the pieces to its left and right.
 */
public final class StringSimilarity {

    private StringSimilarity() {}

    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
    }

    private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        // longest common block inside a[aLo, aHi) x b[bLo, bHi), earliest in a on ties
        int bestA = aLo;
        int bestB = bLo;
        int bestLen = 0;
        int[] prev = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] cur = new int[bHi - bLo + 1];
            for (int j = bLo; j < bHi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int len = prev[j - bLo] + 1;
                    cur[j - bLo + 1] = len;
                    if (len > bestLen) {
                        bestLen = len;
                        bestA = i - len + 1;
                        bestB = j - len + 1;
                    }
                }
            }
            prev = cur;
        }
        if (bestLen == 0) {
            return 0;
        }
        return bestLen
                + matchingCharacters(a, aLo, bestA, b, bLo, bestB)
                + matchingCharacters(a, bestA + bestLen, aHi, b, bestB + bestLen, bHi);
    }
}
