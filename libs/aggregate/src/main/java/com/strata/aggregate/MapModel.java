package com.strata.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Open-ended state: a mutable map of named values with an {@code id} entry.
 */
public class MapModel implements Model {

    public static final String ID = "id";

    private final Map<String, Object> values = new LinkedHashMap<>();

    @Override
    public String id() {
        Object id = values.get(ID);
        return id == null ? null : id.toString();
    }

    /** Value stored under {@code key}, or null. */
    public Object get(String key) {
        return values.get(key);
    }

    /** Stores {@code value} under {@code key}; returns this model. */
    public MapModel put(String key, Object value) {
        values.put(key, value);
        return this;
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    /** Read-only view of all values. */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "MapModel" + values;
    }
}
