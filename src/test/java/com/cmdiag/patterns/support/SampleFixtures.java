package com.cmdiag.patterns.support;

import com.cmdiag.patterns.metrics.MetricSample;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Synthetic telemetry series for tests.
 */
public final class SampleFixtures {

    public static final String SYSTEM_ID = "cm-prod-01";
    public static final LocalDateTime START = LocalDateTime.of(2024, 3, 4, 0, 0);

    private SampleFixtures() {}

    /**
     * Baseline reading: every field set, nothing characteristic about it.
     */
    public static MetricSample.MetricSampleBuilder baseline(LocalDateTime timestamp) {
        return MetricSample.builder()
                .timestamp(timestamp)
                .systemId(SYSTEM_ID)
                .cpuUsage(35)
                .memoryUsagePercent(50)
                .errorRate(0.01)
                .avgResponseTime(120)
                .activeUsers(40)
                .throughput(200)
                .authFailures(0);
    }

    /**
     * {@code count} samples one minute apart; the customizer receives the index
     * and a baseline builder.
     */
    public static List<MetricSample> series(int count,
            BiFunction<Integer, MetricSample.MetricSampleBuilder, MetricSample.MetricSampleBuilder> customizer) {
        List<MetricSample> samples = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            samples.add(customizer.apply(i, baseline(START.plusMinutes(i))).build());
        }
        return samples;
    }

    public static List<MetricSample> constant(int count) {
        return series(count, (i, b) -> b);
    }

    /**
     * Memory rising linearly from 40% to 90% while the collector runs more
     * than ten times a minute.
     */
    public static List<MetricSample> memoryLeak(int count) {
        return memoryLeak(count, SYSTEM_ID);
    }

    public static List<MetricSample> memoryLeak(int count, String systemId) {
        return series(count, (i, b) -> b
                .systemId(systemId)
                .memoryUsagePercent(40 + 50.0 * i / (count - 1))
                .extraReading("gc_frequency", 15.0));
    }

    /**
     * One sample per value of the given metric field, one minute apart.
     */
    public static List<MetricSample> cpuSeries(double... cpu) {
        return series(cpu.length, (i, b) -> b.cpuUsage(cpu[i]));
    }
}
