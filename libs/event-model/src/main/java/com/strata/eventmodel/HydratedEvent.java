package com.strata.eventmodel;

import com.fasterxml.jackson.annotation.JsonAnyGetter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An event rebuilt from a stored name and JSON payload when its Java type is not known
 * statically.
 *
 * <p>The event reports the stored name as its identity and exposes the payload's top-level fields
 * as its own properties, so it serializes, matches and renders like the original event did.
 */
public final class HydratedEvent implements Event {

    private final String name;
    private final Map<String, Object> fields;

    /**
     * @param name the event's type identity (e.g. "AccountOpened")
     * @param fields top-level payload fields, copied
     */
    public HydratedEvent(String name, Map<String, Object> fields) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        this.name = name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(
                fields == null ? Map.of() : fields));
    }

    @Override
    public String eventName() {
        return name;
    }

    /** All payload fields, keyed by name, in payload order. */
    @JsonAnyGetter
    public Map<String, Object> fields() {
        return fields;
    }

    /** Value of a single field, or null when the payload did not carry it. */
    public Object field(String fieldName) {
        return fields.get(fieldName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HydratedEvent other)) {
            return false;
        }
        return name.equals(other.name) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fields);
    }

    @Override
    public String toString() {
        return name + fields;
    }
}
