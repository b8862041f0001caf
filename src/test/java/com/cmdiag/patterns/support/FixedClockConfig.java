package com.cmdiag.patterns.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.ZoneOffset;

@TestConfiguration
public class FixedClockConfig {

    @Bean
    @Primary
    public Clock fixedClock() {
        return Clock.fixed(SampleFixtures.START.plusHours(12).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }
}
