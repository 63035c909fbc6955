package com.strata.aggregate;

import com.strata.eventmodel.Event;
import com.strata.eventmodel.EventHydrator;
import com.strata.eventmodel.Events;
import com.strata.eventmodel.HydratedEvent;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Dispatch table from event identity to state handler, built once per aggregate instance.
 *
 * <p>Lookup is by exact event name. A handler registered for a class receives instances of that
 * class; any other event carrying the same name, such as a {@link HydratedEvent} or a same-named
 * class from another aggregate, is converted to the class by its fields first. An instance whose
 * {@link Event#eventName()} differs from its class's name still reaches the handler registered for
 * its exact class.
 *
 * @param <E> the aggregate's event base type
 */
public final class EventHandlers<E extends Event> {

    private final Map<String, Registration> handlers = new LinkedHashMap<>();
    private final Map<Class<?>, Registration> byType = new HashMap<>();

    /**
     * Registers {@code handler} for events of {@code type}, under the name instances of the type
     * report by default.
     *
     * @throws IllegalStateException if a handler is already registered under that name
     */
    public <T extends E> EventHandlers<E> on(Class<T> type, Consumer<? super T> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        Registration registration = new Registration(type, erase(handler));
        register(Events.nameOf(type), registration);
        byType.put(type, registration);
        return this;
    }

    /**
     * Registers {@code handler} for every event named {@code eventName}, whatever its class.
     *
     * @throws IllegalStateException if a handler is already registered under that name
     */
    public EventHandlers<E> on(String eventName, Consumer<? super E> handler) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName must not be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        register(eventName, new Registration(null, erase(handler)));
        return this;
    }

    /**
     * Invokes the handler registered for the event's name.
     *
     * @return false when no handler is registered, in which case nothing happens
     * @throws EventHydrator.EventHydrationException if the registered handler expects a class the
     *     event's fields do not bind to
     */
    public boolean dispatch(E event) {
        Registration registration = handlers.get(event.eventName());
        if (registration == null) {
            registration = byType.get(event.getClass());
        }
        if (registration == null) {
            return false;
        }
        registration.handler().accept(adapt(event, registration.type()));
        return true;
    }

    /** Whether a handler is registered for {@code eventName}. */
    public boolean handles(String eventName) {
        return handlers.containsKey(eventName);
    }

    /** Registered event names, in registration order. */
    public Set<String> eventNames() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    private void register(String eventName, Registration registration) {
        if (handlers.containsKey(eventName)) {
            throw new IllegalStateException("A handler for event '" + eventName + "' is already registered");
        }
        handlers.put(eventName, registration);
    }

    private static Object adapt(Event event, Class<? extends Event> type) {
        if (type == null || type.isInstance(event)) {
            return event;
        }
        return EventHydrator.as(event, type);
    }

    @SuppressWarnings("unchecked")
    private static Consumer<Object> erase(Consumer<?> handler) {
        return (Consumer<Object>) handler;
    }

    private record Registration(Class<? extends Event> type, Consumer<Object> handler) {}
}
