package com.architecture.memory.flowgrade.config;

import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulingConfigTest {

    @Test
    void expiryClockRunsInUtc() {
        assertThat(new SchedulingConfig().clock().getZone()).isEqualTo(ZoneOffset.UTC);
    }
}
