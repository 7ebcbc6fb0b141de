package com.racing.reconcile.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex substitution applied to a name during normalization.
 * Rules are ordered by priority; a lower number runs first.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        int flags = builder.caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        this.pattern = Pattern.compile(builder.pattern, flags);
        this.replacement = builder.replacement;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private boolean caseSensitive;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        /**
         * Rules match case-insensitively unless this is set.
         */
        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
