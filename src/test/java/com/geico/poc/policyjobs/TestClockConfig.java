package com.geico.poc.policyjobs;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;

/**
 * Replaces the system clock with a {@link MutableClock} in Spring tests.
 */
@TestConfiguration
public class TestClockConfig {

    public static final Instant START = Instant.parse("2024-01-15T12:00:00Z");

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(START);
    }
}
