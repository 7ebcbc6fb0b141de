package com.racing.reconcile.merge;

import com.racing.reconcile.core.model.Conflict;
import com.racing.reconcile.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConflictResolverTest {

    @Mock
    private MetricsService metrics;

    @Test
    @DisplayName("Empty input should resolve to null")
    void testEmpty() {
        ConflictResolver resolver = new ConflictResolver();

        assertNull(resolver.resolve(List.of(), List.of()));
        assertNull(resolver.resolve((List<Object>) null, null));
    }

    @Test
    @DisplayName("A single value should win")
    void testSingleValue() {
        assertEquals("Finished", new ConflictResolver().resolve(List.of("Finished"), List.of(6)));
    }

    @Test
    @DisplayName("Highest priority should win even when listed last")
    void testHighestPriorityWins() {
        ConflictResolver resolver = new ConflictResolver();

        assertEquals("a", resolver.resolve(List.of("c", "b", "a"), List.of(3, 6, 10)));
        assertEquals("2", resolver.resolve(List.of("1", "2"), List.of(6, 10)));
    }

    @Test
    @DisplayName("Equal priorities should be won by the first value")
    void testStableTies() {
        assertEquals("first", new ConflictResolver().resolve(List.of("first", "second"), List.of(8, 8)));
    }

    @Test
    @DisplayName("Null and blank values should be ignored")
    void testAbsentValuesIgnored() {
        ConflictResolver resolver = new ConflictResolver();

        assertEquals("57", resolver.resolve(Arrays.asList(null, " ", "57"), List.of(10, 9, 3)));
        assertNull(resolver.resolve(Arrays.asList((String) null, ""), List.of(10, 9)));
    }

    @Test
    @DisplayName("Values without a priority should rank as 0")
    void testMissingPriority() {
        assertEquals("ranked", new ConflictResolver().resolve(List.of("unranked", "ranked"), List.of(0, 1)));
        assertEquals("first", new ConflictResolver().resolve(List.of("first", "second"), List.of()));
    }

    @Test
    @DisplayName("Contested named fields should be counted")
    void testContestedFieldCounted() {
        ConflictResolver resolver = new ConflictResolver(metrics);

        Integer position = resolver.resolve("position", List.of(
                new Conflict.Candidate<>(2, "statsf1", 6),
                new Conflict.Candidate<>(1, "ergast", 10)));

        assertEquals(1, position);
        verify(metrics).incrementConflictResolved("position");
    }

    @Test
    @DisplayName("Agreeing named fields should not be counted")
    void testAgreementNotCounted() {
        ConflictResolver resolver = new ConflictResolver(metrics);

        Integer laps = resolver.resolve("laps", List.of(
                new Conflict.Candidate<>(57, "ergast", 10),
                new Conflict.Candidate<>(57, "openf1", 8)));

        assertEquals(57, laps);
        verifyNoInteractions(metrics);
    }
}
