package com.strata.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * Rebuilds events from a stored type name and JSON payload, and exposes the structural (JSON)
 * view of events that field comparisons and debug renderings work on.
 *
 * <p>The {@code JavaTimeModule} is registered so that {@code Instant} and friends travel as ISO 8601
 * strings; the {@code Jdk8Module} writes an {@code Optional} field as its value, or null when empty.
 */
public final class EventHydrator {

    private static final ObjectMapper MAPPER = createMapper();

    private static final TypeReference<Map<String, Object>> FIELD_MAP = new TypeReference<>() {};

    private EventHydrator() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Creates an event named {@code name} carrying every top-level field of the JSON object in
     * {@code payload}.
     *
     * @param name the event's type identity
     * @param payload a JSON object
     * @throws EventHydrationException if the payload is not a well-formed JSON object
     */
    public static HydratedEvent hydrate(String name, String payload) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        JsonNode tree = readObject(name, payload);
        return new HydratedEvent(name, MAPPER.convertValue(tree, FIELD_MAP));
    }

    /**
     * Deserializes the payload straight into a known event type.
     *
     * @throws EventHydrationException if the payload is malformed or does not bind to the type
     */
    public static <T extends Event> T hydrateAs(String payload, Class<T> type) {
        try {
            return MAPPER.readValue(payload, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventHydrationException(
                    "Failed to hydrate event of type " + type.getSimpleName(), e);
        }
    }

    /**
     * Converts an event into another type by its fields: a hydrated event into the statically
     * known type it was stored from, or an event of one class into a same-named class.
     *
     * @throws EventHydrationException if the fields do not bind to the type
     */
    public static <T extends Event> T as(Event event, Class<T> type) {
        try {
            return MAPPER.convertValue(fieldsOf(event), type);
        } catch (IllegalArgumentException e) {
            throw new EventHydrationException(
                    "Failed to convert event '" + event.eventName() + "' to " + type.getSimpleName(), e);
        }
    }

    /**
     * Structural view of an event: its serialized properties as a JSON object.
     *
     * @throws EventHydrationException if the event cannot be serialized
     */
    public static ObjectNode fieldsOf(Event event) {
        JsonNode tree;
        try {
            tree = MAPPER.valueToTree(event);
        } catch (IllegalArgumentException e) {
            throw new EventHydrationException("Failed to read fields of event " + event.eventName(), e);
        }
        if (tree instanceof ObjectNode node) {
            return node;
        }
        return MAPPER.createObjectNode();
    }

    /**
     * Structural view of an arbitrary value, for comparing expected field values against
     * {@link #fieldsOf(Event)}.
     */
    public static JsonNode toTree(Object value) {
        return MAPPER.valueToTree(value);
    }

    /** Pretty-printed JSON of an event, for diagnostics. */
    public static String render(Event event) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventHydrationException("Failed to render event " + event.eventName(), e);
        }
    }

    private static JsonNode readObject(String name, String payload) {
        if (payload == null) {
            throw new EventHydrationException("Payload for event '" + name + "' is null", null);
        }
        JsonNode tree;
        try {
            tree = MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new EventHydrationException("Failed to parse payload for event '" + name + "'", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new EventHydrationException(
                    "Payload for event '" + name + "' is not a JSON object", null);
        }
        return tree;
    }

    /**
     * Exception thrown when an event cannot be hydrated or rendered.
     */
    public static class EventHydrationException extends RuntimeException {
        public EventHydrationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
