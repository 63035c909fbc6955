package com.strata.eventmodel;

/**
 * Persistence metadata attached to an event when it is read back from a stream.
 *
 * @param id storage identifier of the stored event
 * @param index position of the event within its stream, starting at 0
 */
public record NodeMetadata(String id, long index) {

    public NodeMetadata {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }
}
