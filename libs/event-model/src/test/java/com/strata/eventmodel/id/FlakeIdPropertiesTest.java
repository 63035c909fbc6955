package com.strata.eventmodel.id;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FlakeIdProperties")
class FlakeIdPropertiesTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(FlakeIdProperties.WORKER_ID_PROPERTY);
        System.clearProperty(FlakeIdProperties.EPOCH_PROPERTY);
    }

    @Test
    @DisplayName("defaults to worker 0 on 2020-01-01")
    void defaults() {
        var props = FlakeIdProperties.defaults();
        assertThat(props.workerId()).isZero();
        assertThat(props.epochMillis()).isEqualTo(Instant.parse("2020-01-01T00:00:00Z").toEpochMilli());
    }

    @Test
    @DisplayName("load() reads system properties")
    void loadsSystemProperties() {
        System.setProperty(FlakeIdProperties.WORKER_ID_PROPERTY, "17");
        System.setProperty(FlakeIdProperties.EPOCH_PROPERTY, "2021-06-01T00:00:00Z");

        var props = FlakeIdProperties.load();

        assertThat(props.workerId()).isEqualTo(17);
        assertThat(props.epochMillis()).isEqualTo(Instant.parse("2021-06-01T00:00:00Z").toEpochMilli());
    }

    @Test
    @DisplayName("epoch may be given in epoch millis")
    void epochMillis() {
        assertThat(FlakeIdProperties.parseEpoch("1600000000000")).isEqualTo(1600000000000L);
    }

    @Test
    @DisplayName("rejects out-of-range worker ids")
    void workerRange() {
        assertThatThrownBy(() -> new FlakeIdProperties(-1, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FlakeIdProperties(1024, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects an epoch in the future")
    void futureEpoch() {
        long tomorrow = System.currentTimeMillis() + 86_400_000L;
        assertThatThrownBy(() -> new FlakeIdProperties(0, tomorrow))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("future");
    }

    @Test
    @DisplayName("rejects malformed values")
    void malformed() {
        System.setProperty(FlakeIdProperties.WORKER_ID_PROPERTY, "abc");
        assertThatThrownBy(FlakeIdProperties::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerId");

        System.clearProperty(FlakeIdProperties.WORKER_ID_PROPERTY);
        System.setProperty(FlakeIdProperties.EPOCH_PROPERTY, "yesterday");
        assertThatThrownBy(FlakeIdProperties::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("epoch");
    }
}
