package com.product.resolution.similarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp similarity: {@code 2 * M / T}, where M is the number of characters in matching
 * blocks and T the combined length of both strings.
 *
 * <p>Matching blocks are found by taking the longest common substring and recursing on the pieces to its
 * left and right. When several longest substrings exist, the one starting earliest in the first string
 * wins, then the one starting earliest in the second. No characters are treated as junk.</p>
 */
public class SequenceRatioSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int total = s1.length() + s2.length();
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        return 2.0 * matchingCharacters(s1, s2) / total;
    }

    @Override
    public String getName() {
        return "SequenceRatio";
    }

    /**
     * Sum of the sizes of all matching blocks between the two strings.
     */
    int matchingCharacters(String a, String b) {
        Map<Character, List<Integer>> positionsInB = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            positionsInB.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
        }

        int matched = 0;
        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, a.length(), 0, b.length()});
        while (!ranges.isEmpty()) {
            int[] r = ranges.pop();
            int alo = r[0], ahi = r[1], blo = r[2], bhi = r[3];
            int[] block = longestMatch(a, positionsInB, alo, ahi, blo, bhi);
            int i = block[0], j = block[1], size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (alo < i && blo < j) {
                ranges.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                ranges.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    /**
     * Longest common substring of {@code a[alo:ahi]} and {@code b[blo:bhi]} as {i, j, size}.
     * Dynamic programming over run lengths ending at each position of b.
     */
    private int[] longestMatch(String a, Map<Character, List<Integer>> positionsInB,
                               int alo, int ahi, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;
        Map<Integer, Integer> runEndingAt = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> next = new HashMap<>();
            List<Integer> positions = positionsInB.get(a.charAt(i));
            if (positions != null) {
                for (int j : positions) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }
                    int k = runEndingAt.getOrDefault(j - 1, 0) + 1;
                    next.put(j, k);
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            runEndingAt = next;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
