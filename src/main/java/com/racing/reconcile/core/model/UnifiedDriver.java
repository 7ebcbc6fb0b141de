package com.racing.reconcile.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical driver aggregated from every source that reported the same real-world person.
 * The {@code unifiedId} never changes once assigned; later sources only fill empty fields.
 */
public class UnifiedDriver {
    private final int unifiedId;
    private final String driverRef;
    private String forename;
    private String surname;
    private String fullName;
    private String code;
    private Integer number;
    private String nationality;
    private String dateOfBirth;
    private final SourceLinks sourceLinks = new SourceLinks("_id");

    private UnifiedDriver(Builder builder) {
        this.unifiedId = builder.unifiedId;
        this.driverRef = builder.driverRef != null ? builder.driverRef : "driver_" + builder.unifiedId;
        this.forename = builder.forename;
        this.surname = builder.surname;
        this.fullName = builder.fullName;
        this.code = builder.code;
        this.number = builder.number;
        this.nationality = builder.nationality;
        this.dateOfBirth = builder.dateOfBirth;
    }

    public int getUnifiedId() {
        return unifiedId;
    }

    public String getDriverRef() {
        return driverRef;
    }

    public String getForename() {
        return forename;
    }

    public String getSurname() {
        return surname;
    }

    public String getFullName() {
        return fullName;
    }

    public String getCode() {
        return code;
    }

    public Integer getNumber() {
        return number;
    }

    public String getNationality() {
        return nationality;
    }

    public String getDateOfBirth() {
        return dateOfBirth;
    }

    public void fillFullName(String fullName) {
        if (isBlank(this.fullName) && !isBlank(fullName)) {
            this.fullName = fullName;
        }
    }

    public void fillCode(String code) {
        if (isBlank(this.code) && !isBlank(code)) {
            this.code = code;
        }
    }

    public void fillNumber(Integer number) {
        if (this.number == null && number != null) {
            this.number = number;
        }
    }

    public void fillNationality(String nationality) {
        if (isBlank(this.nationality) && !isBlank(nationality)) {
            this.nationality = nationality;
        }
    }

    public void fillDateOfBirth(String dateOfBirth) {
        if (isBlank(this.dateOfBirth) && !isBlank(dateOfBirth)) {
            this.dateOfBirth = dateOfBirth;
        }
    }

    public void linkSource(String source, Object sourceId) {
        sourceLinks.link(source, sourceId);
    }

    /**
     * Returns the id this driver carries in the given source, or {@code null}.
     */
    public Object getSourceId(String source) {
        return sourceLinks.idFor(source);
    }

    public boolean hasSource(String source) {
        return sourceLinks.contains(source);
    }

    public List<String> getSources() {
        return sourceLinks.sources();
    }

    /**
     * Source ids keyed as {@code <source>_id}.
     */
    public Map<String, Object> getSourceIdFields() {
        return sourceLinks.asFields();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnifiedDriver that = (UnifiedDriver) o;
        return unifiedId == that.unifiedId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(unifiedId);
    }

    @Override
    public String toString() {
        return "UnifiedDriver{" +
                "unifiedId=" + unifiedId +
                ", driverRef='" + driverRef + '\'' +
                ", fullName='" + fullName + '\'' +
                ", code='" + code + '\'' +
                ", number=" + number +
                ", sources=" + getSources() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer unifiedId;
        private String driverRef;
        private String forename;
        private String surname;
        private String fullName;
        private String code;
        private Integer number;
        private String nationality;
        private String dateOfBirth;

        public Builder unifiedId(int unifiedId) {
            this.unifiedId = unifiedId;
            return this;
        }

        public Builder driverRef(String driverRef) {
            this.driverRef = driverRef;
            return this;
        }

        public Builder forename(String forename) {
            this.forename = forename;
            return this;
        }

        public Builder surname(String surname) {
            this.surname = surname;
            return this;
        }

        public Builder fullName(String fullName) {
            this.fullName = fullName;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder number(Integer number) {
            this.number = number;
            return this;
        }

        public Builder nationality(String nationality) {
            this.nationality = nationality;
            return this;
        }

        public Builder dateOfBirth(String dateOfBirth) {
            this.dateOfBirth = dateOfBirth;
            return this;
        }

        public UnifiedDriver build() {
            Objects.requireNonNull(unifiedId, "unifiedId is required");
            return new UnifiedDriver(this);
        }
    }
}
