package com.cmdiag.patterns.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Typed binding for the {@code pattern.*} heuristics.
 * Every numeric constant used by the detection pipeline lives here so it can be tuned
 * without touching the algorithms.
 */
@Configuration
@ConfigurationProperties(prefix = "pattern")
@Data
public class PatternEngineProperties {

    private Behavior behavior = new Behavior();
    private Condition condition = new Condition();
    private Template template = new Template();
    private Discovery discovery = new Discovery();
    private Sequence sequence = new Sequence();
    private Anomaly anomaly = new Anomaly();
    private Impact impact = new Impact();
    private Registry registry = new Registry();
    private Scan scan = new Scan();
    private Buffer buffer = new Buffer();

    @Data
    public static class Behavior {
        /** Coefficient of variation above which a series is oscillating */
        private double oscillationCv = 0.3;
        /** Absolute OLS slope above which a series is trending */
        private double slopeThreshold = 0.01;
    }

    @Data
    public static class Condition {
        /** Absolute tolerance for eq/ne comparisons */
        private double equalityTolerance = 0.01;
    }

    @Data
    public static class Template {
        private int defaultTimeWindow = 60;
        /** Window step = windowSize / stepDivisor (25% overlap by default) */
        private int stepDivisor = 4;
        private double behaviorWeight = 0.5;
        private double thresholdWeight = 0.3;
        private double rateWeight = 0.2;
        private double rateTolerance = 0.1;
        private double conditionWeight = 0.1;
        private double frequencyWeight = 0.2;
        /** Default frequency variance as a fraction of the interval */
        private double defaultVarianceFraction = 0.1;
        /** Sporadic when stddev(gaps) exceeds this fraction of mean(gaps) */
        private double sporadicFactor = 0.5;
    }

    @Data
    public static class Discovery {
        private int minSamples = 10;
        private int maxClusters = 5;
        private int samplesPerCluster = 10;
        private int minClusterSize = 5;
        private int kmeansMaxIterations = 100;
        private long kmeansSeed = 42L;
        private double dbscanEps = 0.5;
        private int dbscanMinPoints = 5;
        /** stddev/mean below which a metric characterizes a cluster */
        private double characteristicCv = 0.2;
        private double hourStdDevLimit = 3.0;
        private int hourBand = 2;
        private double confidence = 0.7;
        private double occurrenceScore = 0.8;
    }

    @Data
    public static class Sequence {
        private int minLength = 10;
        private int maxLength = 100;
        private int lengthStep = 10;
        /** Longest candidate is seriesLength / lengthDivisor */
        private int lengthDivisor = 3;
        private double similarityThreshold = 0.8;
    }

    @Data
    public static class Anomaly {
        private int windowSize = 20;
        private double scoreThreshold = 2.0;
        private int mergeGap = 5;
        /** Anomaly score mapped to [0,1] by dividing by this scale */
        private double scoreScale = 5.0;
    }

    @Data
    public static class Impact {
        private double securityWeight = 3.0;
        private double errorWeight = 2.5;
        private double performanceWeight = 2.0;
        private double usageWeight = 1.0;
        private double workflowWeight = 0.5;
        private double criticalAbove = 3.0;
        private double highAbove = 2.0;
        private double mediumAbove = 1.0;
    }

    @Data
    public static class Registry {
        /** Registered patterns above this confidence are promoted to templates */
        private double promotionThreshold = 0.8;
        private double minConfidenceFactor = 0.8;
    }

    @Data
    public static class Scan {
        private int minSamples = 10;
        private boolean enabled = false;
        private long intervalMs = 900_000L;
        private int lookbackMinutes = 1440;
        private boolean autoRegister = false;
    }

    @Data
    public static class Buffer {
        private int maxSamplesPerSystem = 10_000;
        private int retentionDays = 30;
    }
}
