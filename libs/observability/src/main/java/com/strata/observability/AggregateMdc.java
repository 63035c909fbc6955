package com.strata.observability;

import com.strata.aggregate.AggregateRoot;
import org.slf4j.MDC;

import java.util.function.Supplier;

/**
 * Scopes SLF4J MDC keys identifying an aggregate around a unit of work, so every log line written
 * while loading, mutating or committing it carries the aggregate's id and type.
 *
 * <p>Previous MDC values are restored when the scope ends, so scopes nest.
 */
public final class AggregateMdc {

    /** MDC key for the aggregate id. */
    public static final String MDC_AGGREGATE_ID = "aggregateId";

    /** MDC key for the aggregate type (simple class name). */
    public static final String MDC_AGGREGATE_TYPE = "aggregateType";

    private AggregateMdc() {
        // utility class
    }

    /**
     * Runs {@code work} with the aggregate's MDC keys set.
     *
     * @throws IllegalArgumentException if aggregate is null
     */
    public static void runWithAggregate(AggregateRoot<?, ?> aggregate, Runnable work) {
        callWithAggregate(aggregate, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Computes a value with the aggregate's MDC keys set.
     *
     * @throws IllegalArgumentException if aggregate is null
     */
    public static <T> T callWithAggregate(AggregateRoot<?, ?> aggregate, Supplier<T> work) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate must not be null");
        }
        String previousId = MDC.get(MDC_AGGREGATE_ID);
        String previousType = MDC.get(MDC_AGGREGATE_TYPE);
        try {
            MDC.put(MDC_AGGREGATE_ID, aggregate.getId());
            MDC.put(MDC_AGGREGATE_TYPE, aggregate.getClass().getSimpleName());
            return work.get();
        } finally {
            restore(MDC_AGGREGATE_ID, previousId);
            restore(MDC_AGGREGATE_TYPE, previousType);
        }
    }

    private static void restore(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
