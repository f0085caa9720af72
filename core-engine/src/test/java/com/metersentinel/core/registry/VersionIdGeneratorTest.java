package com.metersentinel.core.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link VersionIdGenerator}.
 */
class VersionIdGeneratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("Should format the clock time as the version id")
    void shouldFormatTimestamp() {
        assertThat(new VersionIdGenerator(CLOCK, null).next()).isEqualTo("v20240305_101530");
    }

    @Test
    @DisplayName("Should add an increasing suffix within the same second")
    void shouldSuffixWithinSameSecond() {
        VersionIdGenerator ids = new VersionIdGenerator(CLOCK, null);

        assertThat(ids.next()).isEqualTo("v20240305_101530");
        assertThat(ids.next()).isEqualTo("v20240305_101530_1");
        assertThat(ids.next()).isEqualTo("v20240305_101530_2");
    }

    @Test
    @DisplayName("Should stay above a seed issued by a clock that was ahead")
    void shouldStayAboveSeed() {
        VersionIdGenerator ids = new VersionIdGenerator(CLOCK, "v20250101_000000_3");

        assertThat(ids.next()).isEqualTo("v20250101_000000_4");
    }

    @Test
    @DisplayName("Should order suffixes numerically")
    void shouldCompareSuffixesNumerically() {
        assertThat(VersionIdGenerator.compare("v20240305_101530_10", "v20240305_101530_9")).isPositive();
        assertThat(VersionIdGenerator.compare("v20240305_101530", "v20240305_101530_1")).isNegative();
        assertThat(VersionIdGenerator.compare("v20240306_000000", "v20240305_235959_99")).isPositive();
    }
}
