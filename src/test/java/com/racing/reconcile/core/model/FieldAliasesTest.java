package com.racing.reconcile.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldAliasesTest {

    private final FieldAliases aliases = FieldAliases.defaults();

    @Test
    @DisplayName("Should read driver fields under their per-source names")
    void testDriverAliases() {
        RawRecord openF1 = RawRecord.of("full_name", "Max VERSTAPPEN", "name_acronym", "VER", "driver_number", 1);

        assertEquals("Max VERSTAPPEN", aliases.string(openF1, EntityType.DRIVER, FieldAliases.NAME));
        assertEquals("VER", aliases.string(openF1, EntityType.DRIVER, FieldAliases.CODE));
        assertEquals(1, aliases.integer(openF1, EntityType.DRIVER, FieldAliases.NUMBER));
    }

    @Test
    @DisplayName("First present alias should win")
    void testFirstPresentAliasWins() {
        RawRecord record = RawRecord.of("name", " ", "full_name", "Lewis Hamilton", "permanentNumber", "44");

        assertEquals("Lewis Hamilton", aliases.string(record, EntityType.DRIVER, FieldAliases.NAME));
        assertEquals("Lewis Hamilton", aliases.value(record, EntityType.DRIVER, FieldAliases.NAME));
        assertEquals(44, aliases.integer(record, EntityType.DRIVER, FieldAliases.NUMBER));
    }

    @Test
    @DisplayName("Race year should accept season")
    void testRaceAliases() {
        RawRecord ergast = RawRecord.of("season", "2023", "round", "1", "raceName", "Bahrain Grand Prix");

        assertEquals(2023, aliases.integer(ergast, EntityType.RACE, FieldAliases.YEAR));
        assertEquals(1, aliases.integer(ergast, EntityType.RACE, FieldAliases.ROUND));
        assertEquals("Bahrain Grand Prix", aliases.string(ergast, EntityType.RACE, FieldAliases.NAME));
    }

    @Test
    @DisplayName("Unknown fields should fall back to their own name")
    void testUnknownField() {
        assertEquals(List.of("grid"), aliases.aliases(EntityType.RESULT, "grid"));
        assertNull(aliases.value(RawRecord.of("other", 1), EntityType.RESULT, "grid"));
    }
}
