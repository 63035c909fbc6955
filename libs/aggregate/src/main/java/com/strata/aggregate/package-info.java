/**
 * In-memory event-sourced aggregates.
 *
 * <p>{@link com.strata.aggregate.AggregateRoot} records applied events until they are committed
 * (stored by the caller) or uncommitted (discarded), rebuilds state by replaying history, and
 * routes failures to an optional handler so that a lock holder can clean up. Storage and locking
 * stay outside this package.
 *
 * @see com.strata.aggregate.testing.AggregateCheck
 */
package com.strata.aggregate;
