package com.strata.aggregate;

import com.strata.eventmodel.Event;

import java.util.List;

/**
 * Listener for aggregate lifecycle steps. All methods default to no-ops.
 */
public interface AggregateObserver {

    /** Observer that ignores everything. */
    AggregateObserver NOOP = new AggregateObserver() {};

    /**
     * Called after an event has been dispatched.
     *
     * @param fromHistory true when the event was replayed rather than newly applied
     */
    default void onApply(AggregateRoot<?, ?> aggregate, Event event, boolean fromHistory) {}

    /** Called after {@code commit()} cleared the given events. */
    default void onCommit(AggregateRoot<?, ?> aggregate, List<? extends Event> committed) {}

    /** Called after {@code uncommit()} discarded the given events. */
    default void onUncommit(AggregateRoot<?, ?> aggregate, List<? extends Event> discarded) {}

    /**
     * Called when {@code fail()} is invoked.
     *
     * @param handled true when a failure handler was installed
     */
    default void onFailure(AggregateRoot<?, ?> aggregate, RuntimeException error, boolean handled) {}
}
