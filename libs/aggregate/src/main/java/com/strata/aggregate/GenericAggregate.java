package com.strata.aggregate;

import com.strata.eventmodel.Event;

import java.util.function.Consumer;

/**
 * Aggregate with open-ended state and no handlers of its own. Records and replays any event;
 * handlers can still be added by name with {@link #handle(String, Consumer)}.
 */
public class GenericAggregate extends AggregateRoot<MapModel, Event> {

    public GenericAggregate() {
        super(new MapModel());
    }

    public GenericAggregate(String id) {
        super(id, new MapModel());
    }

    /** Registers a handler for events named {@code eventName}; returns this aggregate. */
    public GenericAggregate handle(String eventName, Consumer<? super Event> handler) {
        on(eventName, handler);
        return this;
    }
}
