package com.racing.reconcile.merge;

import com.racing.reconcile.core.model.Conflict;
import com.racing.reconcile.metrics.MetricsService;
import com.racing.reconcile.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Picks one value among several sources' values for the same field: the present value
 * from the highest-priority source. Equal priorities are won by the value listed first.
 */
public class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private final MetricsService metrics;

    public ConflictResolver() {
        this(new NoOpMetricsService());
    }

    public ConflictResolver(MetricsService metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Resolves parallel lists of values and priorities. Null and blank values are ignored;
     * a value without a matching priority ranks as priority 0.
     *
     * @return the winning value, or {@code null} when no value is present
     */
    public <T> T resolve(List<T> values, List<Integer> priorities) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        List<Conflict.Candidate<T>> candidates = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Integer priority = priorities != null && i < priorities.size() ? priorities.get(i) : null;
            candidates.add(new Conflict.Candidate<>(values.get(i), null, priority != null ? priority : 0));
        }
        return new Conflict<>("value", candidates).resolve();
    }

    /**
     * Resolves one named field. Fields on which present values disagree are counted.
     */
    public <T> T resolve(String field, List<Conflict.Candidate<T>> candidates) {
        Conflict<T> conflict = new Conflict<>(field, candidates);
        Conflict.Candidate<T> winner = conflict.winner();
        if (winner != null && conflict.isContested()) {
            metrics.incrementConflictResolved(field);
            log.debug("Conflict on '{}' resolved to {} from {} (priority {})",
                    field, winner.value(), winner.source(), winner.priority());
        }
        return winner != null ? winner.value() : null;
    }
}
