package com.strata.eventmodel;

/**
 * An event annotated with the metadata it was stored under. Used as an alternate replay input.
 *
 * @param event the wrapped event
 * @param metadata storage id and stream index
 * @param <E> the event base type
 */
public record EventNode<E extends Event>(E event, NodeMetadata metadata) {

    public EventNode {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata must not be null");
        }
    }

    /** Convenience factory. */
    public static <E extends Event> EventNode<E> of(E event, String id, long index) {
        return new EventNode<>(event, new NodeMetadata(id, index));
    }
}
