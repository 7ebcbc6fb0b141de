package com.racing.reconcile.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table of source field names accepted for each logical field of each entity type.
 * Aliases are tried in order and the first present value wins.
 */
public final class FieldAliases {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String REF = "ref";
    public static final String CODE = "code";
    public static final String NUMBER = "number";
    public static final String NATIONALITY = "nationality";
    public static final String DATE_OF_BIRTH = "date_of_birth";
    public static final String YEAR = "year";
    public static final String ROUND = "round";
    public static final String DATE = "date";
    public static final String CIRCUIT_ID = "circuit_id";
    public static final String CIRCUIT = "circuit";
    public static final String DRIVER_ID = "driver_id";
    public static final String POSITION = "position";
    public static final String POINTS = "points";
    public static final String STATUS = "status";
    public static final String LAPS = "laps";
    public static final String TIME = "time";

    private static final FieldAliases DEFAULTS = createDefaults();

    private final Map<EntityType, Map<String, List<String>>> aliases;

    private FieldAliases(Map<EntityType, Map<String, List<String>>> aliases) {
        this.aliases = aliases;
    }

    public static FieldAliases defaults() {
        return DEFAULTS;
    }

    private static FieldAliases createDefaults() {
        Map<EntityType, Map<String, List<String>>> table = new EnumMap<>(EntityType.class);

        Map<String, List<String>> driver = new LinkedHashMap<>();
        driver.put(ID, List.of("id", "driver_id", "driverId"));
        driver.put(NAME, List.of("name", "full_name"));
        driver.put(REF, List.of("driver_ref", "driverRef"));
        driver.put(CODE, List.of("code", "driver_code", "name_acronym"));
        driver.put(NUMBER, List.of("number", "driver_number", "permanentNumber"));
        driver.put(NATIONALITY, List.of("nationality"));
        driver.put(DATE_OF_BIRTH, List.of("date_of_birth", "dob", "dateOfBirth"));
        table.put(EntityType.DRIVER, Collections.unmodifiableMap(driver));

        Map<String, List<String>> constructor = new LinkedHashMap<>();
        constructor.put(ID, List.of("id", "constructor_id", "constructorId"));
        constructor.put(NAME, List.of("name", "team_name"));
        constructor.put(REF, List.of("constructor_ref", "constructorRef"));
        constructor.put(NATIONALITY, List.of("nationality"));
        table.put(EntityType.CONSTRUCTOR, Collections.unmodifiableMap(constructor));

        Map<String, List<String>> race = new LinkedHashMap<>();
        race.put(ID, List.of("id", "race_id", "raceId"));
        race.put(YEAR, List.of("year", "season"));
        race.put(ROUND, List.of("round"));
        race.put(NAME, List.of("name", "raceName"));
        race.put(DATE, List.of("date"));
        race.put(CIRCUIT_ID, List.of("circuit_id"));
        race.put(CIRCUIT, List.of("circuit", "Circuit"));
        table.put(EntityType.RACE, Collections.unmodifiableMap(race));

        Map<String, List<String>> result = new LinkedHashMap<>();
        result.put(DRIVER_ID, List.of("driver_id", "driverId"));
        result.put(POSITION, List.of("position"));
        result.put(POINTS, List.of("points"));
        result.put(STATUS, List.of("status"));
        result.put(LAPS, List.of("laps"));
        result.put(TIME, List.of("time"));
        table.put(EntityType.RESULT, Collections.unmodifiableMap(result));

        return new FieldAliases(Collections.unmodifiableMap(table));
    }

    /**
     * Returns the aliases for a logical field, or the field name itself when the table
     * has no entry for it.
     */
    public List<String> aliases(EntityType type, String field) {
        Map<String, List<String>> byField = aliases.get(type);
        if (byField == null) {
            return List.of(field);
        }
        return byField.getOrDefault(field, List.of(field));
    }

    /**
     * Returns the first present aliased value, or {@code null}.
     */
    public Object value(RawRecord record, EntityType type, String field) {
        for (String alias : aliases(type, field)) {
            Object value = record.get(alias);
            if (RawRecord.isPresent(value)) {
                return value;
            }
        }
        return null;
    }

    public String string(RawRecord record, EntityType type, String field) {
        for (String alias : aliases(type, field)) {
            String value = record.getString(alias);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public Integer integer(RawRecord record, EntityType type, String field) {
        for (String alias : aliases(type, field)) {
            Integer value = record.getInteger(alias);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
