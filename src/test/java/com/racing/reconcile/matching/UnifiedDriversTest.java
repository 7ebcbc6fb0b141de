package com.racing.reconcile.matching;

import com.racing.reconcile.core.model.UnifiedDriver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnifiedDriversTest {

    private List<UnifiedDriver> drivers() {
        UnifiedDriver max = UnifiedDriver.builder().unifiedId(1).fullName("Max Verstappen").build();
        max.linkSource("ergast", "max_verstappen");
        max.linkSource("openf1", 1);
        UnifiedDriver lewis = UnifiedDriver.builder().unifiedId(3).fullName("Lewis Hamilton").build();
        lewis.linkSource("ergast", "hamilton");
        return List.of(max, lewis);
    }

    @Test
    @DisplayName("Should find drivers by source id compared as text")
    void testFindBySourceId() {
        List<UnifiedDriver> drivers = drivers();

        assertEquals(1, UnifiedDrivers.findBySourceId(drivers, "openf1", "1").orElseThrow().getUnifiedId());
        assertEquals(1, UnifiedDrivers.findBySourceId(drivers, "openf1", 1).orElseThrow().getUnifiedId());
        assertEquals(3, UnifiedDrivers.findBySourceId(drivers, "ergast", "hamilton").orElseThrow().getUnifiedId());
        assertTrue(UnifiedDrivers.findBySourceId(drivers, "openf1", 44).isEmpty());
        assertTrue(UnifiedDrivers.findBySourceId(drivers, "fia", "1").isEmpty());
        assertTrue(UnifiedDrivers.findBySourceId(drivers, "openf1", null).isEmpty());
    }

    @Test
    @DisplayName("Should find drivers by unified id")
    void testFindById() {
        assertEquals("Lewis Hamilton", UnifiedDrivers.findById(drivers(), 3).orElseThrow().getFullName());
        assertTrue(UnifiedDrivers.findById(drivers(), 2).isEmpty());
    }

    @Test
    @DisplayName("Next id should follow the largest id")
    void testNextId() {
        assertEquals(4, UnifiedDrivers.nextId(drivers()));
        assertEquals(1, UnifiedDrivers.nextId(List.of()));
    }
}
