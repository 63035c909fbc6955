package com.strata.eventmodel;

import java.util.List;

/**
 * Identity helpers shared by the aggregate engine and the assertion toolkit.
 */
public final class Events {

    private Events() {
        // utility class
    }

    /** Identity of an event instance. */
    public static String nameOf(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        return event.eventName();
    }

    /**
     * Identity that instances of the given class report by default: its {@link EventName} value,
     * or its simple name.
     */
    public static String nameOf(Class<? extends Event> type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        EventName name = type.getAnnotation(EventName.class);
        if (name != null && !name.value().isBlank()) {
            return name.value();
        }
        return type.getSimpleName();
    }

    /** Identities of the given events, in order. */
    public static List<String> namesOf(List<? extends Event> events) {
        return events.stream().map(Events::nameOf).toList();
    }

    /** Number of times {@code name} occurs in {@code names}. */
    public static int occurrences(List<String> names, String name) {
        int count = 0;
        for (String candidate : names) {
            if (candidate.equals(name)) {
                count++;
            }
        }
        return count;
    }
}
