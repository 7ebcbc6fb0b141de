package com.racing.reconcile.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical constructor (team), identified by its normalized name.
 */
public class UnifiedConstructor {
    private final int constructorId;
    private final String constructorRef;
    private final String name;
    private final String normalizedName;
    private String nationality;
    private final SourceLinks sourceLinks = new SourceLinks("_id");

    public UnifiedConstructor(int constructorId, String constructorRef, String name,
                              String normalizedName, String nationality) {
        this.constructorId = constructorId;
        this.constructorRef = constructorRef != null ? constructorRef : "constructor_" + constructorId;
        this.name = Objects.requireNonNull(name, "name is required");
        this.normalizedName = Objects.requireNonNull(normalizedName, "normalizedName is required");
        this.nationality = nationality;
    }

    public int getConstructorId() {
        return constructorId;
    }

    public String getConstructorRef() {
        return constructorRef;
    }

    public String getName() {
        return name;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getNationality() {
        return nationality;
    }

    public void fillNationality(String nationality) {
        if ((this.nationality == null || this.nationality.isBlank())
                && nationality != null && !nationality.isBlank()) {
            this.nationality = nationality;
        }
    }

    public void linkSource(String source, Object sourceId) {
        sourceLinks.link(source, sourceId);
    }

    public Object getSourceId(String source) {
        return sourceLinks.idFor(source);
    }

    public List<String> getSources() {
        return sourceLinks.sources();
    }

    public Map<String, Object> getSourceIdFields() {
        return sourceLinks.asFields();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnifiedConstructor that = (UnifiedConstructor) o;
        return constructorId == that.constructorId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(constructorId);
    }

    @Override
    public String toString() {
        return "UnifiedConstructor{" +
                "constructorId=" + constructorId +
                ", constructorRef='" + constructorRef + '\'' +
                ", name='" + name + '\'' +
                ", nationality='" + nationality + '\'' +
                ", sources=" + getSources() +
                '}';
    }
}
