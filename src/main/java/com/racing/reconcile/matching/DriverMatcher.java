package com.racing.reconcile.matching;

import com.racing.reconcile.core.model.EntityType;
import com.racing.reconcile.core.model.FieldAliases;
import com.racing.reconcile.core.model.MatchResult;
import com.racing.reconcile.core.model.RawRecord;
import com.racing.reconcile.core.model.UnifiedDriver;
import com.racing.reconcile.metrics.MetricsService;
import com.racing.reconcile.metrics.NoOpMetricsService;
import com.racing.reconcile.rules.DataNormalizer;
import com.racing.reconcile.similarity.NameSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether a driver record from a source denotes a driver already in the unified set.
 *
 * <p>Matching order:</p>
 * <ol>
 *   <li>identical three-letter code: match, whatever the names say</li>
 *   <li>identical car number: match only if the names are also similar enough</li>
 *   <li>best name similarity at or above the threshold</li>
 * </ol>
 * <p>Anything else, near misses included, is no match and the caller creates a new
 * unified driver.</p>
 */
public class DriverMatcher {
    private static final Logger log = LoggerFactory.getLogger(DriverMatcher.class);

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;

    private final NameSimilarity similarity;
    private final double threshold;
    private final DataNormalizer normalizer;
    private final FieldAliases aliases;
    private final MetricsService metrics;

    public DriverMatcher() {
        this(new NameSimilarity(), DEFAULT_SIMILARITY_THRESHOLD);
    }

    public DriverMatcher(NameSimilarity similarity, double threshold) {
        this(similarity, threshold, new DataNormalizer(), FieldAliases.defaults(), new NoOpMetricsService());
    }

    public DriverMatcher(NameSimilarity similarity, double threshold, DataNormalizer normalizer,
                         FieldAliases aliases, MetricsService metrics) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be between 0.0 and 1.0, got " + threshold);
        }
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.threshold = threshold;
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.aliases = Objects.requireNonNull(aliases, "aliases is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Matches a driver record against the drivers unified so far.
     *
     * @return the match, or {@link MatchResult#noMatch()} when the record has no name or
     *         no existing driver qualifies
     */
    public MatchResult matchDriver(RawRecord record, List<UnifiedDriver> existingDrivers) {
        String name = aliases.string(record, EntityType.DRIVER, FieldAliases.NAME);
        if (name == null || existingDrivers == null || existingDrivers.isEmpty()) {
            return MatchResult.noMatch();
        }
        String code = normalizer.normalizeDriverCode(aliases.string(record, EntityType.DRIVER, FieldAliases.CODE));
        Integer number = aliases.integer(record, EntityType.DRIVER, FieldAliases.NUMBER);

        if (code != null) {
            for (UnifiedDriver existing : existingDrivers) {
                if (code.equals(existing.getCode())) {
                    log.debug("Matched driver '{}' to unified {} by code {}", name, existing.getUnifiedId(), code);
                    return MatchResult.byCode(existing);
                }
            }
        }

        if (number != null) {
            for (UnifiedDriver existing : existingDrivers) {
                if (number.equals(existing.getNumber())) {
                    double score = similarity.compute(name, existing.getFullName());
                    if (score >= threshold) {
                        log.debug("Matched driver '{}' to unified {} by number {} (similarity: {})",
                                name, existing.getUnifiedId(), number, score);
                        return MatchResult.byNumber(existing, score);
                    }
                }
            }
        }

        UnifiedDriver best = null;
        double bestScore = 0.0;
        for (UnifiedDriver existing : existingDrivers) {
            String existingName = existing.getFullName();
            if (existingName == null || existingName.isBlank()) {
                continue;
            }
            double score = similarity.compute(name, existingName);
            if (score > bestScore) {
                bestScore = score;
                best = existing;
            }
        }
        metrics.recordSimilarityScore(bestScore);

        if (best != null && bestScore >= threshold) {
            log.debug("Matched driver '{}' to unified {} by name (similarity: {})",
                    name, best.getUnifiedId(), String.format(Locale.ROOT, "%.2f", bestScore));
            return MatchResult.byName(best, bestScore);
        }
        return MatchResult.noMatch(bestScore);
    }

    /**
     * Builds unified drivers from scratch. Sources are visited in the map's iteration order.
     */
    public List<UnifiedDriver> createUnifiedDrivers(Map<String, List<RawRecord>> recordsBySource) {
        return createUnifiedDrivers(recordsBySource, List.of());
    }

    /**
     * Extends an existing unified set with more records. Ids continue after the largest
     * existing id, so re-running a batch against its own output creates no duplicates.
     *
     * @return the existing drivers followed by any newly created ones
     */
    public List<UnifiedDriver> createUnifiedDrivers(Map<String, List<RawRecord>> recordsBySource,
                                                    List<UnifiedDriver> existingDrivers) {
        List<UnifiedDriver> unified = new ArrayList<>(existingDrivers != null ? existingDrivers : List.of());
        Map<Integer, UnifiedDriver> byId = new HashMap<>();
        for (UnifiedDriver driver : unified) {
            byId.put(driver.getUnifiedId(), driver);
        }
        int nextId = UnifiedDrivers.nextId(unified);
        if (recordsBySource == null) {
            return unified;
        }

        for (Map.Entry<String, List<RawRecord>> entry : recordsBySource.entrySet()) {
            String source = entry.getKey();
            List<RawRecord> records = entry.getValue() != null ? entry.getValue() : List.of();
            for (RawRecord record : records) {
                if (record == null) {
                    continue;
                }
                String name = aliases.string(record, EntityType.DRIVER, FieldAliases.NAME);
                if (name == null) {
                    log.debug("Skipping {} driver record without a name: {}", source, record);
                    metrics.incrementRecordSkipped(EntityType.DRIVER);
                    continue;
                }

                MatchResult match = matchDriver(record, unified);
                if (match.hasMatch()) {
                    UnifiedDriver existing = byId.get(match.unifiedId());
                    attach(existing, record, source, name);
                    metrics.incrementEntityMatched(EntityType.DRIVER, match.reason().name().toLowerCase(Locale.ROOT));
                } else {
                    UnifiedDriver created = create(nextId++, record, source, name);
                    unified.add(created);
                    byId.put(created.getUnifiedId(), created);
                    metrics.incrementEntityCreated(EntityType.DRIVER);
                }
            }
        }

        log.info("Created {} unified drivers", unified.size());
        return unified;
    }

    private void attach(UnifiedDriver existing, RawRecord record, String source, String name) {
        existing.linkSource(source, aliases.value(record, EntityType.DRIVER, FieldAliases.ID));
        existing.fillFullName(collapse(name));
        existing.fillCode(normalizer.normalizeDriverCode(aliases.string(record, EntityType.DRIVER, FieldAliases.CODE)));
        existing.fillNumber(aliases.integer(record, EntityType.DRIVER, FieldAliases.NUMBER));
        existing.fillNationality(aliases.string(record, EntityType.DRIVER, FieldAliases.NATIONALITY));
        existing.fillDateOfBirth(aliases.string(record, EntityType.DRIVER, FieldAliases.DATE_OF_BIRTH));
    }

    private UnifiedDriver create(int unifiedId, RawRecord record, String source, String name) {
        String fullName = collapse(name);
        String[] parts = splitName(fullName);
        UnifiedDriver driver = UnifiedDriver.builder()
                .unifiedId(unifiedId)
                .driverRef(aliases.string(record, EntityType.DRIVER, FieldAliases.REF))
                .forename(parts[0])
                .surname(parts[1])
                .fullName(fullName)
                .code(normalizer.normalizeDriverCode(aliases.string(record, EntityType.DRIVER, FieldAliases.CODE)))
                .number(aliases.integer(record, EntityType.DRIVER, FieldAliases.NUMBER))
                .nationality(aliases.string(record, EntityType.DRIVER, FieldAliases.NATIONALITY))
                .dateOfBirth(aliases.string(record, EntityType.DRIVER, FieldAliases.DATE_OF_BIRTH))
                .build();
        driver.linkSource(source, aliases.value(record, EntityType.DRIVER, FieldAliases.ID));
        return driver;
    }

    /**
     * Splits a full name into forename and surname. The last token is the surname;
     * a single token is a surname with an empty forename.
     */
    static String[] splitName(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return new String[]{"", ""};
        }
        String trimmed = fullName.trim();
        int lastSpace = trimmed.lastIndexOf(' ');
        if (lastSpace < 0) {
            return new String[]{"", trimmed};
        }
        return new String[]{trimmed.substring(0, lastSpace).trim(), trimmed.substring(lastSpace + 1)};
    }

    private static String collapse(String name) {
        return name.trim().replaceAll("\\s+", " ");
    }
}
