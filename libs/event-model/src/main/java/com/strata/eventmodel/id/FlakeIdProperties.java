package com.strata.eventmodel.id;

import java.time.Instant;

/**
 * Configuration for {@link FlakeIdGenerator}.
 *
 * <h2>Configuration sources</h2>
 *
 * <p>{@link #load()} resolves each value from a system property first, then an environment
 * variable, then the default:
 *
 * <pre>
 * strata.flake.worker-id / STRATA_FLAKE_WORKER_ID   default 0
 * strata.flake.epoch     / STRATA_FLAKE_EPOCH       default 2020-01-01T00:00:00Z (ISO 8601 or epoch millis)
 * </pre>
 *
 * @param workerId id of this process among concurrent generators, 0..1023
 * @param epochMillis start of the generator's clock, in Unix milliseconds
 */
public record FlakeIdProperties(int workerId, long epochMillis) {

    /** Largest worker id that fits the 10 worker bits. */
    public static final int MAX_WORKER_ID = 1023;

    /** Default epoch: 2020-01-01T00:00:00Z. */
    public static final long DEFAULT_EPOCH_MILLIS = Instant.parse("2020-01-01T00:00:00Z").toEpochMilli();

    public static final String WORKER_ID_PROPERTY = "strata.flake.worker-id";
    public static final String WORKER_ID_ENV = "STRATA_FLAKE_WORKER_ID";
    public static final String EPOCH_PROPERTY = "strata.flake.epoch";
    public static final String EPOCH_ENV = "STRATA_FLAKE_EPOCH";

    public FlakeIdProperties {
        if (workerId < 0 || workerId > MAX_WORKER_ID) {
            throw new IllegalArgumentException("workerId must be between 0 and " + MAX_WORKER_ID);
        }
        if (epochMillis < 0) {
            throw new IllegalArgumentException("epochMillis must be >= 0");
        }
        if (epochMillis > System.currentTimeMillis()) {
            throw new IllegalArgumentException("epochMillis must not be in the future");
        }
    }

    /** Worker 0 on the default epoch. */
    public static FlakeIdProperties defaults() {
        return new FlakeIdProperties(0, DEFAULT_EPOCH_MILLIS);
    }

    /** Resolves the configuration from system properties and the environment. */
    public static FlakeIdProperties load() {
        String workerId = lookup(WORKER_ID_PROPERTY, WORKER_ID_ENV);
        String epoch = lookup(EPOCH_PROPERTY, EPOCH_ENV);
        return new FlakeIdProperties(
                workerId == null ? 0 : parseWorkerId(workerId),
                epoch == null ? DEFAULT_EPOCH_MILLIS : parseEpoch(epoch));
    }

    private static String lookup(String property, String env) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(env);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseWorkerId(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("workerId must be an integer, got '" + value + "'", e);
        }
    }

    static long parseEpoch(String value) {
        if (value.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(value);
        }
        try {
            return Instant.parse(value).toEpochMilli();
        } catch (java.time.format.DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "epoch must be epoch millis or an ISO 8601 instant, got '" + value + "'", e);
        }
    }
}
