package com.cmdiag.patterns;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Pattern recognition engine for system-health telemetry.
 *
 * Hosts the template matcher, cluster discovery and sequence analysis pipeline
 * together with the in-memory pattern registry.
 */
@SpringBootApplication
@EnableScheduling
public class PatternEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatternEngineApplication.class, args);
    }
}
