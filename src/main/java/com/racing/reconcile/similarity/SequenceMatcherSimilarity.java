package com.racing.reconcile.similarity;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Ratcliff/Obershelp "gestalt" similarity.
 * Finds the longest common block, recurses on the unmatched text to either side of it,
 * and scores {@code 2 * matched / (|s1| + |s2|)}.
 */
public class SequenceMatcherSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchedCharacters(s1, s2) / total;
    }

    @Override
    public String getName() {
        return "SequenceMatcher";
    }

    /**
     * Sums the sizes of all matching blocks.
     */
    int matchedCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});

        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];

            int[] block = longestMatch(a, b, alo, ahi, blo, bhi);
            int i = block[0];
            int j = block[1];
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (alo < i && blo < j) {
                pending.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                pending.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    /**
     * Longest common block of {@code a[alo:ahi]} and {@code b[blo:bhi]}.
     * Ties go to the block starting earliest in {@code a}, then earliest in {@code b}.
     *
     * @return {start in a, start in b, size}
     */
    private int[] longestMatch(String a, String b, int alo, int ahi, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;

        // runLength[j + 1] = length of the common run ending at a[i], b[j]
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];

        for (int i = alo; i < ahi; i++) {
            for (int j = blo; j < bhi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int run = previous[j] + 1;
                    current[j + 1] = run;
                    if (run > bestSize) {
                        bestI = i - run + 1;
                        bestJ = j - run + 1;
                        bestSize = run;
                    }
                } else {
                    current[j + 1] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
            Arrays.fill(current, 0);
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
