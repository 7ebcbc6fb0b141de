package com.racing.reconcile.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical race, identified by its (year, round) natural key.
 */
public class UnifiedRace {
    private final int raceId;
    private final RaceKey key;
    private String name;
    private String date;
    private final Object circuitId;
    private final String circuitRef;
    private final SourceLinks sourceLinks = new SourceLinks("_race_id");

    public UnifiedRace(int raceId, RaceKey key, String name, String date,
                       Object circuitId, String circuitRef) {
        this.raceId = raceId;
        this.key = Objects.requireNonNull(key, "key is required");
        this.name = name;
        this.date = date;
        this.circuitId = circuitId;
        this.circuitRef = circuitRef;
    }

    public int getRaceId() {
        return raceId;
    }

    public RaceKey getKey() {
        return key;
    }

    public int getYear() {
        return key.year();
    }

    public int getRound() {
        return key.round();
    }

    public String getName() {
        return name;
    }

    public String getDate() {
        return date;
    }

    public Object getCircuitId() {
        return circuitId;
    }

    public String getCircuitRef() {
        return circuitRef;
    }

    public void fillName(String name) {
        if ((this.name == null || this.name.isBlank()) && name != null && !name.isBlank()) {
            this.name = name;
        }
    }

    public void fillDate(String date) {
        if ((this.date == null || this.date.isBlank()) && date != null && !date.isBlank()) {
            this.date = date;
        }
    }

    public void linkSource(String source, Object sourceRaceId) {
        sourceLinks.link(source, sourceRaceId);
    }

    public Object getSourceRaceId(String source) {
        return sourceLinks.idFor(source);
    }

    public boolean hasSource(String source) {
        return sourceLinks.contains(source);
    }

    public List<String> getSources() {
        return sourceLinks.sources();
    }

    /**
     * Source race ids keyed as {@code <source>_race_id}.
     */
    public Map<String, Object> getSourceIdFields() {
        return sourceLinks.asFields();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnifiedRace that = (UnifiedRace) o;
        return raceId == that.raceId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(raceId);
    }

    @Override
    public String toString() {
        return "UnifiedRace{" +
                "raceId=" + raceId +
                ", key=" + key +
                ", name='" + name + '\'' +
                ", date='" + date + '\'' +
                ", sources=" + getSources() +
                '}';
    }
}
