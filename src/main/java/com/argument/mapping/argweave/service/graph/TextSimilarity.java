package com.argument.mapping.argweave.service.graph;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fuzzy text similarity used for near-duplicate detection and premise clustering.
 *
 * Texts are normalized (lower case, punctuation stripped, whitespace collapsed),
 * their tokens sorted so that word order does not matter, and the two strings
 * compared with an Indel edit-distance ratio: 2 * LCS / (|a| + |b|).
 */
@Component
public class TextSimilarity {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String normalize(String text) {
        if (text == null) return "";
        String lowered = text.toLowerCase();
        String stripped = PUNCTUATION.matcher(lowered).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Similarity in [0, 1]. Blank input never matches anything.
     */
    public double tokenSortRatio(String first, String second) {
        String a = sortTokens(normalize(first));
        String b = sortTokens(normalize(second));
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        int lcs = longestCommonSubsequence(a, b);
        return (2.0 * lcs) / (a.length() + b.length());
    }

    private String sortTokens(String normalized) {
        if (normalized.isEmpty()) return normalized;
        return Arrays.stream(normalized.split(" "))
                .sorted()
                .collect(Collectors.joining(" "));
    }

    private int longestCommonSubsequence(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
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
