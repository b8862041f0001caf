package com.cmdiag.patterns.metrics;

import java.util.List;

/**
 * Resolves metric names to numeric readings.
 * Unknown names and missing readings resolve to 0.
 */
public final class MetricExtractor {

    private MetricExtractor() {}

    public static double value(MetricSample sample, String metric) {
        if (sample == null || metric == null) {
            return 0;
        }

        switch (metric) {
            case MetricNames.CPU_USAGE:
                return sample.getCpuUsage();
            case MetricNames.MEMORY_USAGE:
                return sample.getMemoryUsagePercent();
            case MetricNames.ERROR_RATE:
                return sample.getErrorRate();
            case MetricNames.RESPONSE_TIME:
                return sample.getAvgResponseTime();
            case MetricNames.ACTIVE_USERS:
                return sample.getActiveUsers();
            case MetricNames.THROUGHPUT:
                return sample.getThroughput();
            case MetricNames.AUTH_FAILURES:
                return sample.getAuthFailures();
            case MetricNames.HOUR_OF_DAY:
                return sample.getTimestamp() != null ? sample.getTimestamp().getHour() : 0;
            case MetricNames.DAY_OF_WEEK:
                return dayOfWeek(sample);
            default:
                Double extra = sample.getExtraReadings() != null ? sample.getExtraReadings().get(metric) : null;
                return extra != null ? extra : 0;
        }
    }

    public static double[] values(List<MetricSample> samples, String metric) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            values[i] = value(samples.get(i), metric);
        }
        return values;
    }

    /**
     * Day of week with Sunday = 0 ... Saturday = 6.
     */
    static int dayOfWeek(MetricSample sample) {
        if (sample.getTimestamp() == null) {
            return 0;
        }
        return sample.getTimestamp().getDayOfWeek().getValue() % 7;
    }
}
