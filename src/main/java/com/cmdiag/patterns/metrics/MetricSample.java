package com.cmdiag.patterns.metrics;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One immutable telemetry snapshot for a monitored system.
 * Produced by the metrics-source collaborator; the engine only reads it.
 */
@Value
@Builder
@Jacksonized
public class MetricSample {

    LocalDateTime timestamp;
    String systemId;

    /** CPU usage in percent (0-100) */
    double cpuUsage;

    /** Memory usage in percent (0-100) */
    double memoryUsagePercent;

    /** Failed requests as a fraction of all requests */
    double errorRate;

    /** Average response time in milliseconds */
    double avgResponseTime;

    double activeUsers;

    /** Requests per second */
    double throughput;

    double authFailures;

    /**
     * Readings without a dedicated field (gc_frequency, cpu_wait, disk_io, ...).
     */
    @Singular
    Map<String, Double> extraReadings;
}
