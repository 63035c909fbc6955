package com.strata.eventmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventHydrator")
class EventHydratorTest {

    public record AccountOpened(String id, String owner, List<String> tags) implements Event {}

    public record Stamped(String id, Instant at) implements Event {}

    public record Renamed(String id, Optional<String> nickname) implements Event {}

    @Nested
    @DisplayName("hydrate(name, payload)")
    class HydrateByName {

        @Test
        @DisplayName("names the event and copies every top-level field")
        void copiesFields() {
            var event = EventHydrator.hydrate("AccountOpened",
                    "{\"id\":\"acc-1\",\"owner\":\"marz\",\"tags\":[\"film\",\"tech\"],\"limit\":250}");

            assertThat(event.eventName()).isEqualTo("AccountOpened");
            assertThat(event.fields()).containsOnlyKeys("id", "owner", "tags", "limit");
            assertThat(event.field("owner")).isEqualTo("marz");
            assertThat(event.field("tags")).isEqualTo(List.of("film", "tech"));
            assertThat(event.field("limit")).isEqualTo(250);
        }

        @Test
        @DisplayName("keeps nested objects as maps")
        void nestedObjects() {
            var event = EventHydrator.hydrate("Moved", "{\"to\":{\"city\":\"Lagos\"}}");
            assertThat(event.field("to")).isEqualTo(Map.of("city", "Lagos"));
        }

        @Test
        @DisplayName("throws on malformed JSON")
        void malformed() {
            assertThatThrownBy(() -> EventHydrator.hydrate("Created", "not-json{"))
                    .isInstanceOf(EventHydrator.EventHydrationException.class);
        }

        @Test
        @DisplayName("throws when the payload is not an object")
        void notAnObject() {
            assertThatThrownBy(() -> EventHydrator.hydrate("Created", "[1,2]"))
                    .isInstanceOf(EventHydrator.EventHydrationException.class)
                    .hasMessageContaining("not a JSON object");
            assertThatThrownBy(() -> EventHydrator.hydrate("Created", ""))
                    .isInstanceOf(EventHydrator.EventHydrationException.class);
        }

        @Test
        @DisplayName("rejects a blank name")
        void blankName() {
            assertThatThrownBy(() -> EventHydrator.hydrate(" ", "{}"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("typed conversion")
    class Typed {

        @Test
        @DisplayName("hydrateAs() binds the payload to a known record")
        void hydrateAs() {
            var event = EventHydrator.hydrateAs(
                    "{\"id\":\"acc-1\",\"owner\":\"marz\",\"tags\":[\"a\"]}", AccountOpened.class);
            assertThat(event).isEqualTo(new AccountOpened("acc-1", "marz", List.of("a")));
        }

        @Test
        @DisplayName("as() converts a hydrated event to its stored type")
        void convertsHydrated() {
            var hydrated = EventHydrator.hydrate("AccountOpened", "{\"id\":\"acc-1\",\"owner\":\"marz\"}");
            var typed = EventHydrator.as(hydrated, AccountOpened.class);

            assertThat(typed.id()).isEqualTo("acc-1");
            assertThat(typed.owner()).isEqualTo("marz");
            assertThat(typed.tags()).isNull();
        }

        @Test
        @DisplayName("instants travel as ISO 8601 strings")
        void instants() {
            var at = Instant.parse("2022-04-11T10:15:30Z");
            var fields = EventHydrator.fieldsOf(new Stamped("s-1", at));
            assertThat(fields.get("at").asText()).isEqualTo("2022-04-11T10:15:30Z");
        }
    }

    @Nested
    @DisplayName("fieldsOf() / render()")
    class Views {

        @Test
        @DisplayName("record components become fields")
        void recordFields() {
            var fields = EventHydrator.fieldsOf(new AccountOpened("acc-1", "marz", List.of("x")));
            assertThat(fields.get("id").asText()).isEqualTo("acc-1");
            assertThat(fields.get("tags").isArray()).isTrue();
            assertThat(fields.has("eventName")).isFalse();
        }

        @Test
        @DisplayName("hydrated fields flatten to top level")
        void hydratedFields() {
            var hydrated = EventHydrator.hydrate("Created", "{\"id\":\"c-1\"}");
            var fields = EventHydrator.fieldsOf(hydrated);
            assertThat(fields.get("id").asText()).isEqualTo("c-1");
            assertThat(fields.has("fields")).isFalse();
        }

        @Test
        @DisplayName("render() pretty-prints the event")
        void render() {
            var json = EventHydrator.render(new AccountOpened("acc-1", "marz", List.of()));
            assertThat(json).startsWith("{").contains("\"owner\" : \"marz\"").contains("\n");
        }

        @Test
        @DisplayName("Optional fields read as their value, or null when empty")
        void optionalFields() {
            var present = EventHydrator.fieldsOf(new Renamed("a-1", Optional.of("marz")));
            var empty = EventHydrator.fieldsOf(new Renamed("a-1", Optional.empty()));

            assertThat(present.get("nickname").asText()).isEqualTo("marz");
            assertThat(empty.get("nickname").isNull()).isTrue();
            assertThat(EventHydrator.render(new Renamed("a-1", Optional.of("marz"))))
                    .contains("\"nickname\" : \"marz\"");
        }

        @Test
        @DisplayName("Optional fields bind back from JSON")
        void optionalBinding() {
            var typed = EventHydrator.hydrateAs("{\"id\":\"a-1\",\"nickname\":\"marz\"}", Renamed.class);
            assertThat(typed.nickname()).contains("marz");
        }
    }
}
