package com.racing.reconcile.similarity;

import com.racing.reconcile.rules.DefaultNormalizationRules;
import com.racing.reconcile.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Scores how likely two driver names denote the same person.
 *
 * <p>Both names are reduced to matching keys (lowercase, single-spaced, without generational
 * suffixes or accents). Equal keys score 1.0. Otherwise the configured
 * {@link SimilarityAlgorithm} decides, except that a key contained in the other key
 * scores at least {@value #CONTAINMENT_FLOOR}, which covers initials and shortened names.</p>
 */
public class NameSimilarity implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(NameSimilarity.class);

    public static final double CONTAINMENT_FLOOR = 0.9;

    private final SimilarityAlgorithm algorithm;
    private final NormalizationEngine keyEngine;

    public NameSimilarity() {
        this(new SequenceMatcherSimilarity());
    }

    public NameSimilarity(SimilarityAlgorithm algorithm) {
        this(algorithm, DefaultNormalizationRules.matchingKeyEngine());
    }

    public NameSimilarity(SimilarityAlgorithm algorithm, NormalizationEngine keyEngine) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm is required");
        this.keyEngine = Objects.requireNonNull(keyEngine, "keyEngine is required");
    }

    /**
     * Returns the key a name is compared by.
     */
    public String matchingKey(String name) {
        return keyEngine.normalize(name);
    }

    @Override
    public double compute(String name1, String name2) {
        String key1 = matchingKey(name1);
        String key2 = matchingKey(name2);
        if (key1.isEmpty() || key2.isEmpty()) {
            return 0.0;
        }
        if (key1.equals(key2)) {
            return 1.0;
        }

        double score = algorithm.compute(key1, key2);
        if (key1.contains(key2) || key2.contains(key1)) {
            score = Math.max(score, CONTAINMENT_FLOOR);
        }
        score = Math.min(1.0, Math.max(0.0, score));

        log.debug("Name similarity '{}' vs '{}' ({}): {}", key1, key2, algorithm.getName(), score);
        return score;
    }

    @Override
    public String getName() {
        return "Name(" + algorithm.getName() + ")";
    }

    public SimilarityAlgorithm getAlgorithm() {
        return algorithm;
    }
}
