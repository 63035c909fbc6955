package com.strata.eventmodel.id;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Flake id generator: 64-bit ids made of a millisecond timestamp, a worker id and a per-millisecond
 * sequence, rendered as fixed-width decimal strings.
 *
 * <pre>
 * | 1 bit unused | 41 bits millis since epoch | 10 bits worker | 12 bits sequence |
 * </pre>
 *
 * <p>Ids are zero-padded to {@value #WIDTH} digits, so lexicographic order equals numeric order
 * and therefore creation order. Thread-safe.
 */
public final class FlakeIdGenerator implements IdProvider {

    private static final Logger log = LoggerFactory.getLogger(FlakeIdGenerator.class);

    static final int WORKER_BITS = 10;
    static final int SEQUENCE_BITS = 12;
    static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    /** Decimal width of {@link Long#MAX_VALUE}. */
    static final int WIDTH = 19;

    private final FlakeIdProperties properties;
    private final Clock clock;

    private long lastTimestamp = -1L;
    private long sequence = 0L;

    public FlakeIdGenerator(FlakeIdProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public FlakeIdGenerator(FlakeIdProperties properties, Clock clock) {
        if (properties == null) {
            throw new IllegalArgumentException("properties must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.properties = properties;
        this.clock = clock;
    }

    /** Generator configured from system properties and the environment. */
    public static FlakeIdGenerator fromEnvironment() {
        return new FlakeIdGenerator(FlakeIdProperties.load());
    }

    @Override
    public String next() {
        return format(nextLong());
    }

    /** Next id in numeric form. */
    public synchronized long nextLong() {
        long timestamp = currentMillis();
        if (timestamp < lastTimestamp) {
            // clock moved backwards; keep issuing from the last seen millisecond
            log.warn("Clock moved backwards by {} ms, holding at last timestamp", lastTimestamp - timestamp);
            timestamp = lastTimestamp;
        }

        if (timestamp == lastTimestamp) {
            sequence = (sequence + 1) & MAX_SEQUENCE;
            if (sequence == 0) {
                timestamp = awaitNextMillis(lastTimestamp);
            }
        } else {
            sequence = 0L;
        }

        lastTimestamp = timestamp;
        return (timestamp << (WORKER_BITS + SEQUENCE_BITS))
                | ((long) properties.workerId() << SEQUENCE_BITS)
                | sequence;
    }

    /** Configuration this generator runs with. */
    public FlakeIdProperties properties() {
        return properties;
    }

    static String format(long id) {
        String digits = Long.toString(id);
        if (digits.length() >= WIDTH) {
            return digits;
        }
        return "0".repeat(WIDTH - digits.length()) + digits;
    }

    private long currentMillis() {
        return clock.millis() - properties.epochMillis();
    }

    private long awaitNextMillis(long last) {
        long timestamp = currentMillis();
        while (timestamp <= last) {
            Thread.onSpinWait();
            timestamp = currentMillis();
        }
        return timestamp;
    }
}
