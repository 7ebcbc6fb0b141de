package com.racing.reconcile.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Order-insensitive token overlap: {@code |A ∩ B| / min(|A|, |B|)}.
 * "Verstappen Max" and "Max Verstappen" score 1.0, as does a surname against a full name.
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[\\s\\-]+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int shared = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                shared++;
            }
        }
        return (double) shared / Math.min(tokens1.size(), tokens2.size());
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    private Set<String> tokenize(String s) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : TOKEN_SEPARATOR.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isBlank()) {
                tokens.add(token.trim());
            }
        }
        return tokens;
    }
}
