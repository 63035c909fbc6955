package com.strata.eventmodel;

/**
 * A domain event: an immutable record of something that happened to an aggregate.
 *
 * <p>An event's identity is its {@link #eventName()}. Two events are of the same kind when their
 * names match; their fields (the Jackson-visible properties of the implementation) are compared
 * only when an assertion asks for it.
 *
 * <p>Implementations are normally Java records:
 *
 * <pre>{@code
 * public record AccountOpened(String id, String owner) implements Event {}
 * }</pre>
 */
public interface Event {

    /**
     * The type identity of this event. Defaults to {@link Events#nameOf(Class)} of the implementing
     * class: the {@link EventName} value when present, otherwise the simple name, so
     * {@code AccountOpened} above is named {@code "AccountOpened"}.
     *
     * <p>Rename a class's events with {@link EventName} rather than by overriding this method;
     * overriding is for events whose name is not fixed by their class, like {@link HydratedEvent}.
     */
    default String eventName() {
        return Events.nameOf(getClass());
    }
}
