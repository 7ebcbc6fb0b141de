package com.racing.reconcile.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RaceKeyTest {

    @Test
    @DisplayName("Should parse slash and dash forms")
    void testParse() {
        assertEquals(new RaceKey(2023, 1), RaceKey.parse("2023/1"));
        assertEquals(new RaceKey(2021, 22), RaceKey.parse(" 2021-22 "));
        assertEquals("2023/1", new RaceKey(2023, 1).toString());
    }

    @ParameterizedTest
    @DisplayName("Should reject malformed keys")
    @ValueSource(strings = {"", "2023", "2023/1/2", "abc/1", "2023/x"})
    void testParseInvalid(String text) {
        assertNull(RaceKey.parse(text));
    }

    @Test
    @DisplayName("Should order by year then round")
    void testOrdering() {
        assertTrue(new RaceKey(2022, 22).compareTo(new RaceKey(2023, 1)) < 0);
        assertTrue(new RaceKey(2023, 2).compareTo(new RaceKey(2023, 1)) > 0);
        assertEquals(0, new RaceKey(2023, 1).compareTo(new RaceKey(2023, 1)));
    }
}
