package com.strata.aggregate;

/**
 * Callback an aggregate routes failures to, typically installed by whoever holds a lock on the
 * aggregate so that it can release it. A handler may rethrow.
 */
@FunctionalInterface
public interface AggregateFailureHandler {

    void handle(RuntimeException error);
}
