package com.racing.reconcile.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.racing.reconcile.api.SourceBatch;
import com.racing.reconcile.core.model.RaceKey;
import com.racing.reconcile.core.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a batch of fetched records from JSON.
 *
 * <p>Expected format:</p>
 * <pre>
 * {
 *   "drivers":      { "ergast": [ {"name": "Max Verstappen", "code": "VER"} ], "openf1": [ ... ] },
 *   "constructors": { "ergast": [ {"name": "Red Bull"} ] },
 *   "races":        { "ergast": [ {"season": 2023, "round": 1, "raceName": "Bahrain GP"} ] },
 *   "results":      { "2023/1": { "ergast": [ {"driver_id": "max_verstappen", "position": 1} ] } }
 * }
 * </pre>
 *
 * <p>Every section is optional. Entries that are not JSON objects are skipped, as are
 * result sections whose race key does not read as {@code year/round}.</p>
 */
public class JsonBatchLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonBatchLoader.class);
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonBatchLoader() {
        this(new ObjectMapper());
    }

    public JsonBatchLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SourceBatch load(Path path) {
        try (Reader reader = Files.newBufferedReader(path)) {
            return load(reader);
        } catch (IOException e) {
            throw new BatchLoadException("Could not read batch file " + path + ": " + e.getMessage(), e);
        }
    }

    public SourceBatch load(InputStream input) {
        try {
            return fromTree(objectMapper.readTree(input));
        } catch (IOException e) {
            throw new BatchLoadException("Could not parse batch: " + e.getMessage(), e);
        }
    }

    public SourceBatch load(Reader reader) {
        try {
            return fromTree(objectMapper.readTree(reader));
        } catch (JsonProcessingException e) {
            throw new BatchLoadException("Could not parse batch: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new BatchLoadException("Could not read batch: " + e.getMessage(), e);
        }
    }

    private SourceBatch fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new BatchLoadException("Batch document must be a JSON object");
        }
        SourceBatch.Builder batch = SourceBatch.builder();

        forEachSource(root.path("drivers"), "drivers", batch::drivers);
        forEachSource(root.path("constructors"), "constructors", batch::constructors);
        forEachSource(root.path("races"), "races", batch::races);

        JsonNode results = root.path("results");
        Iterator<Map.Entry<String, JsonNode>> races = results.fields();
        while (races.hasNext()) {
            Map.Entry<String, JsonNode> race = races.next();
            RaceKey key = RaceKey.parse(race.getKey());
            if (key == null) {
                log.warn("batch.results.badRaceKey key='{}'", race.getKey());
                continue;
            }
            forEachSource(race.getValue(), "results " + key, (source, records) -> batch.results(key, source, records));
        }

        SourceBatch built = batch.build();
        log.info("batch.loaded records={}", built.recordCount());
        return built;
    }

    private void forEachSource(JsonNode section, String sectionName, SourceSink sink) {
        if (section.isMissingNode() || section.isNull()) {
            return;
        }
        if (!section.isObject()) {
            log.warn("batch.section.ignored section={} reason=not-an-object", sectionName);
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> sources = section.fields();
        while (sources.hasNext()) {
            Map.Entry<String, JsonNode> source = sources.next();
            sink.accept(source.getKey(), toRecords(source.getValue(), sectionName, source.getKey()));
        }
    }

    private List<RawRecord> toRecords(JsonNode array, String sectionName, String source) {
        List<RawRecord> records = new ArrayList<>();
        if (!array.isArray()) {
            log.warn("batch.source.ignored section={} source={} reason=not-an-array", sectionName, source);
            return records;
        }
        for (JsonNode node : array) {
            if (!node.isObject()) {
                log.debug("Skipping non-object entry in {} from {}", sectionName, source);
                continue;
            }
            records.add(RawRecord.of(objectMapper.convertValue(node, RECORD_TYPE)));
        }
        return records;
    }

    @FunctionalInterface
    private interface SourceSink {
        void accept(String source, List<RawRecord> records);
    }
}
