package com.cmdiag.patterns.metrics;

import java.util.List;

/**
 * Metric names understood by signatures, conditions and the sequence analyzer.
 */
public final class MetricNames {

    public static final String CPU_USAGE = "cpu_usage";
    public static final String MEMORY_USAGE = "memory_usage";
    public static final String ERROR_RATE = "error_rate";
    public static final String RESPONSE_TIME = "response_time";
    public static final String ACTIVE_USERS = "active_users";
    public static final String THROUGHPUT = "throughput";
    public static final String AUTH_FAILURES = "auth_failures";
    public static final String HOUR_OF_DAY = "hour_of_day";
    public static final String DAY_OF_WEEK = "day_of_week";

    /** Metrics inspected when synthesizing a signature from a cluster */
    public static final List<String> CLUSTER_METRICS = List.of(
            CPU_USAGE, MEMORY_USAGE, ERROR_RATE, RESPONSE_TIME);

    /** Metrics scanned for repeating and anomalous sub-sequences */
    public static final List<String> SEQUENCE_METRICS = List.of(
            CPU_USAGE, MEMORY_USAGE, RESPONSE_TIME, ERROR_RATE);

    private MetricNames() {}
}
