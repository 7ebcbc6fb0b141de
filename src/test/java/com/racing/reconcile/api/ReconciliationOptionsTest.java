package com.racing.reconcile.api;

import com.racing.reconcile.core.model.SourcePriority;
import com.racing.reconcile.similarity.SequenceMatcherSimilarity;
import com.racing.reconcile.similarity.TokenSetSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationOptionsTest {

    @Test
    @DisplayName("Defaults should use 0.85 and the sequence matcher")
    void testDefaults() {
        ReconciliationOptions options = ReconciliationOptions.defaults();

        assertEquals(0.85, options.getSimilarityThreshold());
        assertTrue(options.getSimilarityAlgorithm() instanceof SequenceMatcherSimilarity);
        assertEquals(SourcePriority.defaults(), options.getSourcePriority());
    }

    @Test
    @DisplayName("Strict options should raise the threshold")
    void testStrict() {
        assertEquals(0.95, ReconciliationOptions.strict().getSimilarityThreshold());
    }

    @Test
    @DisplayName("Builder should validate the threshold")
    void testThresholdValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> ReconciliationOptions.builder().similarityThreshold(1.01));
        assertThrows(IllegalArgumentException.class,
                () -> ReconciliationOptions.builder().similarityThreshold(-0.5));
        assertThrows(NullPointerException.class,
                () -> ReconciliationOptions.builder().sourcePriority(null));
    }

    @Test
    @DisplayName("Should read options from properties")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(ReconciliationOptions.THRESHOLD_PROPERTY, "0.9");
        properties.setProperty(ReconciliationOptions.ALGORITHM_PROPERTY, "token-set");
        properties.setProperty("reconcile.priority.wikipedia", "11");
        properties.setProperty("reconcile.priority.motorsportstats", "5");

        ReconciliationOptions options = ReconciliationOptions.fromProperties(properties);

        assertEquals(0.9, options.getSimilarityThreshold());
        assertTrue(options.getSimilarityAlgorithm() instanceof TokenSetSimilarity);
        assertEquals(11, options.getSourcePriority().priorityOf("wikipedia"));
        assertEquals(5, options.getSourcePriority().priorityOf("motorsportstats"));
        assertEquals(10, options.getSourcePriority().priorityOf("ergast"));
    }

    @Test
    @DisplayName("Empty properties should yield the defaults")
    void testEmptyProperties() {
        ReconciliationOptions options = ReconciliationOptions.fromProperties(new Properties());

        assertEquals(0.85, options.getSimilarityThreshold());
        assertEquals(SourcePriority.defaults(), options.getSourcePriority());
    }

    @Test
    @DisplayName("Malformed properties should be rejected")
    void testMalformedProperties() {
        Properties badAlgorithm = new Properties();
        badAlgorithm.setProperty(ReconciliationOptions.ALGORITHM_PROPERTY, "levenshtein");
        assertThrows(IllegalArgumentException.class, () -> ReconciliationOptions.fromProperties(badAlgorithm));

        Properties badThreshold = new Properties();
        badThreshold.setProperty(ReconciliationOptions.THRESHOLD_PROPERTY, "high");
        assertThrows(IllegalArgumentException.class, () -> ReconciliationOptions.fromProperties(badThreshold));

        Properties outOfRange = new Properties();
        outOfRange.setProperty(ReconciliationOptions.THRESHOLD_PROPERTY, "1.5");
        assertThrows(IllegalArgumentException.class, () -> ReconciliationOptions.fromProperties(outOfRange));

        Properties badPriority = new Properties();
        badPriority.setProperty("reconcile.priority.ergast", "-1");
        assertThrows(IllegalArgumentException.class, () -> ReconciliationOptions.fromProperties(badPriority));
    }
}
