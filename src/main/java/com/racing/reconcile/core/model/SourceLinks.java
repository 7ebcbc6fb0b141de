package com.racing.reconcile.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-source foreign keys carried by a unified entity.
 * A source is listed as soon as it contributes, even when its record had no id.
 */
public final class SourceLinks {

    private final String fieldSuffix;
    private final Map<String, Object> ids = new LinkedHashMap<>();

    SourceLinks(String fieldSuffix) {
        this.fieldSuffix = fieldSuffix;
    }

    /**
     * Links a source. An existing id for that source is replaced only by a present one.
     */
    void link(String source, Object sourceId) {
        if (!ids.containsKey(source) || RawRecord.isPresent(sourceId)) {
            ids.put(source, RawRecord.isPresent(sourceId) ? sourceId : null);
        }
    }

    Object idFor(String source) {
        return ids.get(source);
    }

    boolean contains(String source) {
        return ids.containsKey(source);
    }

    List<String> sources() {
        return Collections.unmodifiableList(new ArrayList<>(ids.keySet()));
    }

    /**
     * Returns {@code <source><suffix>} keys, e.g. {@code ergast_id} or {@code statsf1_race_id}.
     */
    Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        ids.forEach((source, id) -> fields.put(source + fieldSuffix, id));
        return Collections.unmodifiableMap(fields);
    }
}
