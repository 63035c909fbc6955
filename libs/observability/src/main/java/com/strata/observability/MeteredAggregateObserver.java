package com.strata.observability;

import com.strata.aggregate.AggregateObserver;
import com.strata.aggregate.AggregateRoot;
import com.strata.eventmodel.Event;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.List;

/**
 * Counts aggregate lifecycle steps in a Micrometer registry.
 *
 * <p>Every meter is tagged with {@code service} and {@code aggregate} (the aggregate's simple class
 * name). Install one instance per service and share it between aggregates:
 *
 * <pre>{@code
 * var observer = new MeteredAggregateObserver(registry, "accounts-svc");
 * account.setObserver(observer);
 * }</pre>
 */
public final class MeteredAggregateObserver implements AggregateObserver {

    public static final String EVENTS_APPLIED = "strata.aggregate.events.applied";
    public static final String EVENTS_COMMITTED = "strata.aggregate.events.committed";
    public static final String EVENTS_DISCARDED = "strata.aggregate.events.discarded";
    public static final String FAILURES = "strata.aggregate.failures";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_AGGREGATE = "aggregate";
    public static final String TAG_SOURCE = "source";
    public static final String TAG_HANDLED = "handled";

    public static final String SOURCE_LIVE = "live";
    public static final String SOURCE_HISTORY = "history";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a tag
     */
    public MeteredAggregateObserver(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    @Override
    public void onApply(AggregateRoot<?, ?> aggregate, Event event, boolean fromHistory) {
        counter(EVENTS_APPLIED, "Events dispatched to aggregate state handlers", aggregate,
                TAG_SOURCE, fromHistory ? SOURCE_HISTORY : SOURCE_LIVE)
                .increment();
    }

    @Override
    public void onCommit(AggregateRoot<?, ?> aggregate, List<? extends Event> committed) {
        if (!committed.isEmpty()) {
            counter(EVENTS_COMMITTED, "Uncommitted events cleared after being stored", aggregate)
                    .increment(committed.size());
        }
    }

    @Override
    public void onUncommit(AggregateRoot<?, ?> aggregate, List<? extends Event> discarded) {
        if (!discarded.isEmpty()) {
            counter(EVENTS_DISCARDED, "Uncommitted events discarded without being stored", aggregate)
                    .increment(discarded.size());
        }
    }

    @Override
    public void onFailure(AggregateRoot<?, ?> aggregate, RuntimeException error, boolean handled) {
        counter(FAILURES, "Failures routed through aggregates", aggregate,
                TAG_HANDLED, Boolean.toString(handled))
                .increment();
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    private Counter counter(String name, String description, AggregateRoot<?, ?> aggregate, String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName, TAG_AGGREGATE, aggregate.getClass().getSimpleName());
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return Counter.builder(name)
                .description(description)
                .tags(tags)
                .register(registry);
    }
}
