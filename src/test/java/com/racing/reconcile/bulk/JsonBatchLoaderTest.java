package com.racing.reconcile.bulk;

import com.racing.reconcile.api.SourceBatch;
import com.racing.reconcile.core.model.RaceKey;
import com.racing.reconcile.core.model.RawRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonBatchLoaderTest {

    private static final String BATCH = """
            {
              "drivers": {
                "ergast": [
                  {"driver_id": "max_verstappen", "name": "Max Verstappen", "code": "VER", "number": 33}
                ],
                "openf1": [
                  {"driver_number": 1, "full_name": "Max VERSTAPPEN", "name_acronym": "VER"}
                ]
              },
              "constructors": {
                "ergast": [{"name": "Red Bull", "nationality": "Austrian"}]
              },
              "races": {
                "ergast": [
                  {"season": 2023, "round": 1, "raceName": "Bahrain GP", "Circuit": {"circuitId": "bahrain"}}
                ]
              },
              "results": {
                "2023/1": {
                  "ergast": [{"driver_id": "max_verstappen", "position": 1, "points": 25.0}]
                }
              }
            }
            """;

    private JsonBatchLoader loader;

    @BeforeEach
    void setUp() {
        loader = new JsonBatchLoader();
    }

    @Test
    @DisplayName("Should load every section of a batch")
    void testLoad() {
        SourceBatch batch = loader.load(new StringReader(BATCH));

        assertEquals(List.of("ergast", "openf1"), List.copyOf(batch.getDrivers().keySet()));
        RawRecord max = batch.getDrivers().get("ergast").get(0);
        assertEquals("Max Verstappen", max.getString("name"));
        assertEquals(33, max.getInteger("number"));

        assertEquals(1, batch.getConstructors().get("ergast").size());

        RawRecord race = batch.getRaces().get("ergast").get(0);
        assertEquals("bahrain", race.getMap("Circuit").get("circuitId"));

        Map<String, List<RawRecord>> results = batch.getResults().get(new RaceKey(2023, 1));
        assertNotNull(results);
        assertEquals(25.0, results.get("ergast").get(0).getDouble("points"));
        assertEquals(5, batch.recordCount());
    }

    @Test
    @DisplayName("Should load from a file")
    void testLoadPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("batch.json");
        Files.writeString(file, BATCH);

        assertEquals(5, loader.load(file).recordCount());
    }

    @Test
    @DisplayName("Should load from a stream")
    void testLoadStream() {
        SourceBatch batch = loader.load(new ByteArrayInputStream(BATCH.getBytes(StandardCharsets.UTF_8)));

        assertEquals(2, batch.getDrivers().size());
    }

    @Test
    @DisplayName("Missing sections should be empty")
    void testMissingSections() {
        SourceBatch batch = loader.load(new StringReader("""
                {"drivers": {"ergast": [{"name": "Lando Norris"}]}}
                """));

        assertEquals(1, batch.recordCount());
        assertTrue(batch.getRaces().isEmpty());
        assertTrue(batch.getResults().isEmpty());
    }

    @Test
    @DisplayName("Should skip malformed entries and race keys")
    void testSkipMalformed() {
        SourceBatch batch = loader.load(new StringReader("""
                {
                  "drivers": {"ergast": [{"name": "Lando Norris"}, "not-a-record", 42], "fia": {"name": "x"}},
                  "races": [],
                  "results": {"round-one": {"ergast": [{"driver_id": "norris"}]}}
                }
                """));

        assertEquals(1, batch.getDrivers().get("ergast").size());
        assertTrue(batch.getDrivers().get("fia").isEmpty());
        assertTrue(batch.getRaces().isEmpty());
        assertTrue(batch.getResults().isEmpty());
    }

    @Test
    @DisplayName("Invalid JSON should raise BatchLoadException")
    void testInvalidJson() {
        assertThrows(BatchLoadException.class, () -> loader.load(new StringReader("{\"drivers\": ")));
    }

    @Test
    @DisplayName("Non-object documents should raise BatchLoadException")
    void testNonObjectDocument() {
        assertThrows(BatchLoadException.class, () -> loader.load(new StringReader("[1, 2, 3]")));
    }

    @Test
    @DisplayName("Missing files should raise BatchLoadException")
    void testMissingFile(@TempDir Path dir) {
        BatchLoadException e = assertThrows(BatchLoadException.class,
                () -> loader.load(dir.resolve("absent.json")));
        assertTrue(e.getMessage().contains("absent.json"));
    }
}
