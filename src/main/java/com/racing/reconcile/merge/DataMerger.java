package com.racing.reconcile.merge;

import com.racing.reconcile.core.model.Conflict;
import com.racing.reconcile.core.model.EntityType;
import com.racing.reconcile.core.model.FieldAliases;
import com.racing.reconcile.core.model.RaceKey;
import com.racing.reconcile.core.model.RawRecord;
import com.racing.reconcile.core.model.SourcePriority;
import com.racing.reconcile.core.model.UnifiedConstructor;
import com.racing.reconcile.core.model.UnifiedDriver;
import com.racing.reconcile.core.model.UnifiedRace;
import com.racing.reconcile.core.model.UnifiedResult;
import com.racing.reconcile.matching.DriverMatcher;
import com.racing.reconcile.matching.UnifiedDrivers;
import com.racing.reconcile.metrics.MetricsService;
import com.racing.reconcile.metrics.NoOpMetricsService;
import com.racing.reconcile.rules.DataNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds unified drivers, constructors, races and results from the records of several
 * sources, resolving field conflicts by source priority.
 *
 * <p>Sources are always visited in descending priority, stable on ties, so the first
 * source to describe an entity is the most authoritative one. Later sources only add
 * their ids and fill fields that are still empty.</p>
 *
 * <p>Every call works on its own collections; the merger keeps no state between calls.</p>
 */
public class DataMerger {
    private static final Logger log = LoggerFactory.getLogger(DataMerger.class);

    private final SourcePriority sourcePriority;
    private final DriverMatcher driverMatcher;
    private final DataNormalizer normalizer;
    private final ConflictResolver conflictResolver;
    private final FieldAliases aliases;
    private final MetricsService metrics;

    public DataMerger() {
        this(SourcePriority.defaults(), new DriverMatcher(), new DataNormalizer(),
                FieldAliases.defaults(), new NoOpMetricsService());
    }

    public DataMerger(SourcePriority sourcePriority, DriverMatcher driverMatcher, DataNormalizer normalizer,
                      FieldAliases aliases, MetricsService metrics) {
        this.sourcePriority = Objects.requireNonNull(sourcePriority, "sourcePriority is required");
        this.driverMatcher = Objects.requireNonNull(driverMatcher, "driverMatcher is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.aliases = Objects.requireNonNull(aliases, "aliases is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.conflictResolver = new ConflictResolver(metrics);
    }

    public SourcePriority getSourcePriority() {
        return sourcePriority;
    }

    /**
     * Merges drivers through the {@link DriverMatcher}.
     */
    public List<UnifiedDriver> mergeDrivers(Map<String, List<RawRecord>> driversBySource) {
        return mergeDrivers(driversBySource, List.of());
    }

    /**
     * Merges drivers on top of an already unified set.
     */
    public List<UnifiedDriver> mergeDrivers(Map<String, List<RawRecord>> driversBySource,
                                            List<UnifiedDriver> existingDrivers) {
        log.info("Merging drivers from {} sources", sizeOf(driversBySource));
        metrics.recordBatchSize(EntityType.DRIVER, countRecords(driversBySource));
        List<UnifiedDriver> drivers = driverMatcher.createUnifiedDrivers(ordered(driversBySource), existingDrivers);
        log.info("Merged {} drivers", drivers.size());
        return drivers;
    }

    /**
     * Merges constructors by exact normalized name.
     */
    public List<UnifiedConstructor> mergeConstructors(Map<String, List<RawRecord>> constructorsBySource) {
        log.info("Merging constructors from {} sources", sizeOf(constructorsBySource));
        metrics.recordBatchSize(EntityType.CONSTRUCTOR, countRecords(constructorsBySource));

        List<UnifiedConstructor> unified = new ArrayList<>();
        Map<String, UnifiedConstructor> byName = new HashMap<>();

        for (Map.Entry<String, List<RawRecord>> entry : sourcePriority.orderSources(nullSafe(constructorsBySource))) {
            String source = entry.getKey();
            for (RawRecord constructor : recordsOf(entry)) {
                String name = aliases.string(constructor, EntityType.CONSTRUCTOR, FieldAliases.NAME);
                String normalizedName = normalizer.normalizeName(name);
                if (normalizedName.isEmpty()) {
                    log.debug("Skipping {} constructor record without a name: {}", source, constructor);
                    metrics.incrementRecordSkipped(EntityType.CONSTRUCTOR);
                    continue;
                }

                Object sourceId = aliases.value(constructor, EntityType.CONSTRUCTOR, FieldAliases.ID);
                String nationality = aliases.string(constructor, EntityType.CONSTRUCTOR, FieldAliases.NATIONALITY);
                UnifiedConstructor existing = byName.get(normalizedName);
                if (existing != null) {
                    existing.linkSource(source, sourceId);
                    existing.fillNationality(nationality);
                    metrics.incrementEntityMatched(EntityType.CONSTRUCTOR, "name");
                } else {
                    int constructorId = unified.size() + 1;
                    UnifiedConstructor created = new UnifiedConstructor(constructorId,
                            aliases.string(constructor, EntityType.CONSTRUCTOR, FieldAliases.REF),
                            name, normalizedName, nationality);
                    created.linkSource(source, sourceId);
                    unified.add(created);
                    byName.put(normalizedName, created);
                    metrics.incrementEntityCreated(EntityType.CONSTRUCTOR);
                }
            }
        }

        log.info("Merged {} constructors", unified.size());
        return unified;
    }

    /**
     * Merges races by their (year, round) natural key.
     */
    public List<UnifiedRace> mergeRaces(Map<String, List<RawRecord>> racesBySource) {
        log.info("Merging races from {} sources", sizeOf(racesBySource));
        metrics.recordBatchSize(EntityType.RACE, countRecords(racesBySource));

        List<UnifiedRace> unified = new ArrayList<>();
        Map<RaceKey, UnifiedRace> byKey = new HashMap<>();

        for (Map.Entry<String, List<RawRecord>> entry : sourcePriority.orderSources(nullSafe(racesBySource))) {
            String source = entry.getKey();
            for (RawRecord race : recordsOf(entry)) {
                RaceKey key = raceKeyOf(race);
                if (key == null) {
                    log.debug("Skipping {} race record without year and round: {}", source, race);
                    metrics.incrementRecordSkipped(EntityType.RACE);
                    continue;
                }

                Object sourceRaceId = aliases.value(race, EntityType.RACE, FieldAliases.ID);
                String name = aliases.string(race, EntityType.RACE, FieldAliases.NAME);
                String date = aliases.string(race, EntityType.RACE, FieldAliases.DATE);
                UnifiedRace existing = byKey.get(key);
                if (existing != null) {
                    existing.fillName(name);
                    existing.fillDate(date);
                    existing.linkSource(source, sourceRaceId);
                    metrics.incrementEntityMatched(EntityType.RACE, "natural-key");
                } else {
                    UnifiedRace created = new UnifiedRace(unified.size() + 1, key, name, date,
                            aliases.value(race, EntityType.RACE, FieldAliases.CIRCUIT_ID), circuitRefOf(race));
                    created.linkSource(source, sourceRaceId);
                    unified.add(created);
                    byKey.put(key, created);
                    metrics.incrementEntityCreated(EntityType.RACE);
                }
            }
        }

        log.info("Merged {} races", unified.size());
        return unified;
    }

    /**
     * Picks the value of the highest-priority source among parallel lists of values and
     * priorities; see {@link ConflictResolver#resolve(List, List)}.
     */
    public <T> T resolveConflict(List<T> values, List<Integer> priorities) {
        return conflictResolver.resolve(values, priorities);
    }

    /**
     * Merges one race's classification, grouping rows by the {@code driver_id} each source
     * reported.
     */
    public List<UnifiedResult> mergeResults(Map<String, List<RawRecord>> resultsBySource, int raceId) {
        return mergeResults(resultsBySource, raceId, null);
    }

    /**
     * Merges one race's classification. When unified drivers are given, each source's
     * {@code driver_id} is first mapped onto the unified driver carrying that source id,
     * so rows from different sources about the same driver are grouped together.
     */
    public List<UnifiedResult> mergeResults(Map<String, List<RawRecord>> resultsBySource, int raceId,
                                            List<UnifiedDriver> drivers) {
        log.info("Merging results for race {}", raceId);
        metrics.recordBatchSize(EntityType.RESULT, countRecords(resultsBySource));

        Map<DriverKey, List<Contribution>> byDriver = new LinkedHashMap<>();
        for (Map.Entry<String, List<RawRecord>> entry : sourcePriority.orderSources(nullSafe(resultsBySource))) {
            String source = entry.getKey();
            for (RawRecord result : recordsOf(entry)) {
                DriverKey driverKey = driverKeyOf(result, source, drivers);
                if (driverKey == null) {
                    log.debug("Skipping {} result without a driver id: {}", source, result);
                    metrics.incrementRecordSkipped(EntityType.RESULT);
                    continue;
                }
                byDriver.computeIfAbsent(driverKey, k -> new ArrayList<>()).add(new Contribution(result, source));
            }
        }

        List<UnifiedResult> unified = new ArrayList<>(byDriver.size());
        byDriver.forEach((driverKey, contributions) -> unified.add(contributions.size() == 1
                ? singleSourceResult(raceId, driverKey.driverId(), contributions.get(0))
                : multiSourceResult(raceId, driverKey.driverId(), contributions)));

        log.info("Merged {} results", unified.size());
        return unified;
    }

    private UnifiedResult singleSourceResult(int raceId, String driverKey, Contribution contribution) {
        RawRecord result = contribution.record();
        String source = contribution.source();
        return new UnifiedResult(
                raceId,
                driverKey,
                normalizer.normalizePosition(field(result, FieldAliases.POSITION)),
                toPoints(field(result, FieldAliases.POINTS)),
                normalizer.normalizeStatus(aliases.string(result, EntityType.RESULT, FieldAliases.STATUS)),
                normalizer.alignLapNumber(field(result, FieldAliases.LAPS), source),
                aliases.string(result, EntityType.RESULT, FieldAliases.TIME),
                List.of(source));
    }

    private UnifiedResult multiSourceResult(int raceId, String driverKey, List<Contribution> contributions) {
        Integer position = resolveField(FieldAliases.POSITION, contributions,
                c -> normalizer.normalizePosition(field(c.record(), FieldAliases.POSITION)));
        Double points = resolveField(FieldAliases.POINTS, contributions,
                c -> toPoints(field(c.record(), FieldAliases.POINTS)));
        String rawStatus = resolveField(FieldAliases.STATUS, contributions,
                c -> aliases.string(c.record(), EntityType.RESULT, FieldAliases.STATUS));
        Integer laps = resolveField(FieldAliases.LAPS, contributions,
                c -> normalizer.alignLapNumber(field(c.record(), FieldAliases.LAPS), c.source()));
        String time = resolveField(FieldAliases.TIME, contributions,
                c -> aliases.string(c.record(), EntityType.RESULT, FieldAliases.TIME));

        List<String> sources = new ArrayList<>(contributions.size());
        for (Contribution contribution : contributions) {
            sources.add(contribution.source());
        }
        return new UnifiedResult(raceId, driverKey, position, points,
                normalizer.normalizeStatus(rawStatus), laps, time, sources);
    }

    private <T> T resolveField(String field, List<Contribution> contributions, Function<Contribution, T> extractor) {
        List<Conflict.Candidate<T>> candidates = new ArrayList<>(contributions.size());
        for (Contribution contribution : contributions) {
            candidates.add(new Conflict.Candidate<>(extractor.apply(contribution), contribution.source(),
                    sourcePriority.priorityOf(contribution.source())));
        }
        return conflictResolver.resolve(field, candidates);
    }

    /**
     * Mapped rows group by unified driver. Without unified drivers, rows group by the raw id
     * across sources; with them, an unmapped raw id only groups within its own source.
     */
    private DriverKey driverKeyOf(RawRecord result, String source, List<UnifiedDriver> drivers) {
        Object driverId = aliases.value(result, EntityType.RESULT, FieldAliases.DRIVER_ID);
        if (driverId == null) {
            return null;
        }
        String rawId = driverId.toString().trim();
        if (drivers == null) {
            return DriverKey.raw(null, rawId);
        }
        return UnifiedDrivers.findBySourceId(drivers, source, driverId)
                .map(driver -> DriverKey.unified(driver.getUnifiedId()))
                .orElseGet(() -> {
                    log.debug("No unified driver carries {} id {}", source, rawId);
                    return DriverKey.raw(source, rawId);
                });
    }

    private RaceKey raceKeyOf(RawRecord race) {
        Integer year = aliases.integer(race, EntityType.RACE, FieldAliases.YEAR);
        Integer round = aliases.integer(race, EntityType.RACE, FieldAliases.ROUND);
        if (year == null || round == null || year <= 0 || round <= 0) {
            return null;
        }
        return new RaceKey(year, round);
    }

    private String circuitRefOf(RawRecord race) {
        for (String alias : aliases.aliases(EntityType.RACE, FieldAliases.CIRCUIT)) {
            Map<String, Object> circuit = race.getMap(alias);
            if (circuit != null) {
                Object circuitId = circuit.get("circuitId");
                if (RawRecord.isPresent(circuitId)) {
                    return circuitId.toString();
                }
                continue;
            }
            String circuitRef = race.getString(alias);
            if (circuitRef != null) {
                return circuitRef;
            }
        }
        return null;
    }

    private Object field(RawRecord record, String field) {
        return aliases.value(record, EntityType.RESULT, field);
    }

    private static Double toPoints(Object value) {
        if (value instanceof Number number) {
            double points = number.doubleValue();
            return Double.isFinite(points) ? points : null;
        }
        if (value instanceof CharSequence text) {
            try {
                double points = Double.parseDouble(text.toString().trim());
                return Double.isFinite(points) ? points : null;
            } catch (NumberFormatException e) {
                log.debug("Unparseable points value '{}'", text);
                return null;
            }
        }
        return null;
    }

    private Map<String, List<RawRecord>> ordered(Map<String, List<RawRecord>> bySource) {
        Map<String, List<RawRecord>> ordered = new LinkedHashMap<>();
        for (Map.Entry<String, List<RawRecord>> entry : sourcePriority.orderSources(nullSafe(bySource))) {
            ordered.put(entry.getKey(), recordsOf(entry));
        }
        return ordered;
    }

    private static List<RawRecord> recordsOf(Map.Entry<String, List<RawRecord>> entry) {
        if (entry.getValue() == null) {
            return List.of();
        }
        List<RawRecord> records = new ArrayList<>(entry.getValue().size());
        for (RawRecord record : entry.getValue()) {
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    private static Map<String, List<RawRecord>> nullSafe(Map<String, List<RawRecord>> bySource) {
        return bySource != null ? bySource : Map.of();
    }

    private static int sizeOf(Map<String, ?> bySource) {
        return bySource != null ? bySource.size() : 0;
    }

    private static int countRecords(Map<String, List<RawRecord>> bySource) {
        int count = 0;
        for (List<RawRecord> records : nullSafe(bySource).values()) {
            count += records != null ? records.size() : 0;
        }
        return count;
    }

    private record Contribution(RawRecord record, String source) {
    }

    private record DriverKey(Integer unifiedId, String source, String rawId) {

        static DriverKey unified(int unifiedId) {
            return new DriverKey(unifiedId, null, null);
        }

        static DriverKey raw(String source, String rawId) {
            return new DriverKey(null, source, rawId);
        }

        String driverId() {
            return unifiedId != null ? String.valueOf(unifiedId) : rawId;
        }
    }
}
