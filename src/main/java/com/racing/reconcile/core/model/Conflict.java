package com.racing.reconcile.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The competing values several sources gave for one field of one unified entity.
 * Resolution picks the highest-priority present value; equal priorities keep input order.
 *
 * @param field      logical field name
 * @param candidates values in the order they were supplied
 */
public record Conflict<T>(String field, List<Candidate<T>> candidates) {

    public Conflict {
        Objects.requireNonNull(field, "field is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    /**
     * Returns the winning candidate, or {@code null} when no candidate carries a value.
     */
    public Candidate<T> winner() {
        List<Candidate<T>> present = new ArrayList<>();
        for (Candidate<T> candidate : candidates) {
            if (RawRecord.isPresent(candidate.value())) {
                present.add(candidate);
            }
        }
        if (present.isEmpty()) {
            return null;
        }
        // List.sort is stable
        present.sort(Comparator.comparingInt((Candidate<T> c) -> c.priority()).reversed());
        return present.get(0);
    }

    public T resolve() {
        Candidate<T> winner = winner();
        return winner != null ? winner.value() : null;
    }

    /**
     * Returns true when two or more present candidates disagree.
     */
    public boolean isContested() {
        Object first = null;
        for (Candidate<T> candidate : candidates) {
            if (!RawRecord.isPresent(candidate.value())) {
                continue;
            }
            if (first == null) {
                first = candidate.value();
            } else if (!first.equals(candidate.value())) {
                return true;
            }
        }
        return false;
    }

    /**
     * One source's value for the field. {@code source} may be {@code null} when only the
     * priority is known.
     */
    public record Candidate<T>(T value, String source, int priority) {
    }
}
