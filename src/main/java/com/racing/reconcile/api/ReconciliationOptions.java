package com.racing.reconcile.api;

import com.racing.reconcile.core.model.SourcePriority;
import com.racing.reconcile.similarity.SequenceMatcherSimilarity;
import com.racing.reconcile.similarity.SimilarityAlgorithm;
import com.racing.reconcile.similarity.TokenSetSimilarity;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Options for a reconciliation run: the driver-name similarity threshold, the algorithm
 * behind it, and the source priority table.
 */
public class ReconciliationOptions {

    public static final String THRESHOLD_PROPERTY = "reconcile.similarity-threshold";
    public static final String ALGORITHM_PROPERTY = "reconcile.similarity-algorithm";
    public static final String PRIORITY_PROPERTY_PREFIX = "reconcile.priority.";

    private static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;

    private final double similarityThreshold;
    private final SimilarityAlgorithm similarityAlgorithm;
    private final SourcePriority sourcePriority;

    private ReconciliationOptions(Builder builder) {
        this.similarityThreshold = builder.similarityThreshold;
        this.similarityAlgorithm = builder.similarityAlgorithm;
        this.sourcePriority = builder.sourcePriority;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public SimilarityAlgorithm getSimilarityAlgorithm() {
        return similarityAlgorithm;
    }

    public SourcePriority getSourcePriority() {
        return sourcePriority;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options that only accept near-identical names.
     */
    public static ReconciliationOptions strict() {
        return builder().similarityThreshold(0.95).build();
    }

    /**
     * Reads options from properties. Recognized keys:
     * <pre>
     * reconcile.similarity-threshold=0.85
     * reconcile.similarity-algorithm=sequence | token-set
     * reconcile.priority.&lt;source&gt;=&lt;score&gt;
     * </pre>
     * Keys that are absent keep their defaults.
     *
     * @throws IllegalArgumentException when a value is malformed or out of range
     */
    public static ReconciliationOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String threshold = properties.getProperty(THRESHOLD_PROPERTY);
        if (threshold != null) {
            builder.similarityThreshold(parseDouble(THRESHOLD_PROPERTY, threshold));
        }
        String algorithm = properties.getProperty(ALGORITHM_PROPERTY);
        if (algorithm != null) {
            builder.similarityAlgorithm(algorithmNamed(algorithm));
        }
        SourcePriority.Builder priorities = SourcePriority.builder(SourcePriority.defaults());
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(PRIORITY_PROPERTY_PREFIX)) {
                String source = key.substring(PRIORITY_PROPERTY_PREFIX.length());
                priorities.priority(source, parseInt(key, properties.getProperty(key)));
            }
        }
        return builder.sourcePriority(priorities.build()).build();
    }

    private static SimilarityAlgorithm algorithmNamed(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "sequence":
                return new SequenceMatcherSimilarity();
            case "token-set":
                return new TokenSetSimilarity();
            default:
                throw new IllegalArgumentException("Unknown similarity algorithm: " + name);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private SimilarityAlgorithm similarityAlgorithm = new SequenceMatcherSimilarity();
        private SourcePriority sourcePriority = SourcePriority.defaults();

        public Builder similarityThreshold(double similarityThreshold) {
            if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
                throw new IllegalArgumentException("similarityThreshold must be between 0.0 and 1.0");
            }
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder similarityAlgorithm(SimilarityAlgorithm similarityAlgorithm) {
            this.similarityAlgorithm = Objects.requireNonNull(similarityAlgorithm, "similarityAlgorithm is required");
            return this;
        }

        public Builder sourcePriority(SourcePriority sourcePriority) {
            this.sourcePriority = Objects.requireNonNull(sourcePriority, "sourcePriority is required");
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{" +
                "similarityThreshold=" + similarityThreshold +
                ", similarityAlgorithm=" + similarityAlgorithm.getName() +
                ", sourcePriority=" + sourcePriority +
                '}';
    }
}
