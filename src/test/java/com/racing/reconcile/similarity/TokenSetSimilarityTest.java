package com.racing.reconcile.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenSetSimilarityTest {

    private final TokenSetSimilarity similarity = new TokenSetSimilarity();

    @Test
    @DisplayName("Token order should not matter")
    void testOrderInsensitive() {
        assertEquals(1.0, similarity.compute("Verstappen Max", "Max Verstappen"));
    }

    @Test
    @DisplayName("A subset of tokens should score 1.0")
    void testSubset() {
        assertEquals(1.0, similarity.compute("Verstappen", "Max Verstappen"));
    }

    @Test
    @DisplayName("Hyphens should separate tokens")
    void testHyphen() {
        assertEquals(1.0, similarity.compute("Jean-Eric Vergne", "jean eric vergne"));
    }

    @Test
    @DisplayName("Partial overlap should score against the smaller set")
    void testPartialOverlap() {
        assertEquals(0.5, similarity.compute("Nico Rosberg", "Keke Rosberg"));
        assertEquals(0.0, similarity.compute("Max Verstappen", "Lewis Hamilton"));
    }

    @Test
    @DisplayName("Should handle null and empty input")
    void testEdgeCases() {
        assertEquals(0.0, similarity.compute(null, "a"));
        assertEquals(0.0, similarity.compute("", "a"));
        assertEquals(1.0, similarity.compute("", ""));
        assertEquals("TokenSet", similarity.getName());
    }
}
