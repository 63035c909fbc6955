package com.strata.aggregate;

/**
 * Projected state of an aggregate. The engine never reads it; only event handlers do.
 */
public interface Model {

    /** Identifier of the entity this state describes, or null before the creating event. */
    String id();
}
