package com.cmdiag.patterns.matching;

import com.cmdiag.patterns.metrics.MetricNames;
import com.cmdiag.patterns.model.Behavior;
import com.cmdiag.patterns.model.ConditionOperator;
import com.cmdiag.patterns.model.FrequencyType;
import com.cmdiag.patterns.model.MetricPattern;
import com.cmdiag.patterns.model.PatternFrequency;
import com.cmdiag.patterns.model.PatternSignature;
import com.cmdiag.patterns.model.PatternTemplate;
import com.cmdiag.patterns.model.PatternType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import static com.cmdiag.patterns.model.PatternCondition.and;
import static com.cmdiag.patterns.model.PatternCondition.leaf;
import static com.cmdiag.patterns.model.PatternCondition.or;

/**
 * Process-wide catalog of pattern templates.
 *
 * Starts with the built-in signatures and grows when the registry promotes
 * high-confidence patterns. Scans iterate over {@link #snapshot()} so a
 * registration during an in-flight scan never affects that scan.
 */
@Component
@Slf4j
public class TemplateCatalog {

    public static final String MEMORY_LEAK = "memory-leak";
    public static final String CPU_SPIKE = "cpu-spike";
    public static final String CASCADING_FAILURE = "cascading-failure";
    public static final String PEAK_HOURS = "peak-hours";
    public static final String BRUTE_FORCE = "brute-force";
    public static final String BATCH_PROCESSING = "batch-processing";

    private final List<PatternTemplate> templates = new CopyOnWriteArrayList<>();
    private final AtomicLong version = new AtomicLong();

    @PostConstruct
    public void init() {
        registerBuiltInTemplates();
        log.info("Template catalog initialized with {} templates", templates.size());
    }

    /**
     * Add a template, replacing any template with the same id.
     */
    public synchronized void add(PatternTemplate template) {
        templates.removeIf(t -> t.getId().equals(template.getId()));
        templates.add(template);
        version.incrementAndGet();
    }

    /**
     * Immutable copy of the current catalog.
     */
    public List<PatternTemplate> snapshot() {
        return List.copyOf(templates);
    }

    public Optional<PatternTemplate> find(String templateId) {
        return templates.stream()
                .filter(t -> t.getId().equals(templateId))
                .findFirst();
    }

    public int size() {
        return templates.size();
    }

    /**
     * Incremented on every change.
     */
    public long version() {
        return version.get();
    }

    private void registerBuiltInTemplates() {
        // Performance
        add(PatternTemplate.builder()
                .id(MEMORY_LEAK)
                .name("Memory Leak Pattern")
                .description("Gradual memory increase without corresponding decrease")
                .type(PatternType.PERFORMANCE)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder()
                                .metric(MetricNames.MEMORY_USAGE)
                                .behavior(Behavior.INCREASE)
                                // deliberate gate: growth that levels off below 75% is not a leak
                                .threshold(75.0)
                                .rate(0.02) // percentage points per sample
                                .build())
                        .condition(and(
                                leaf(MetricNames.MEMORY_USAGE, ConditionOperator.GT, 50),
                                leaf("gc_frequency", ConditionOperator.GT, 10)))
                        .timeWindow(180)
                        .build())
                .minConfidence(0.7)
                .build());

        add(PatternTemplate.builder()
                .id(CPU_SPIKE)
                .name("CPU Spike Pattern")
                .description("Sudden CPU usage spikes followed by normal levels")
                .type(PatternType.PERFORMANCE)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder()
                                .metric(MetricNames.CPU_USAGE)
                                .behavior(Behavior.OSCILLATING)
                                .threshold(80.0)
                                .build())
                        .condition(or(
                                leaf(MetricNames.CPU_USAGE, ConditionOperator.GT, 90),
                                leaf("cpu_wait", ConditionOperator.GT, 30)))
                        .timeWindow(30)
                        .frequency(PatternFrequency.builder()
                                .type(FrequencyType.RECURRING)
                                .interval(60.0)
                                .variance(10.0)
                                .build())
                        .build())
                .minConfidence(0.75)
                .build());

        // Error
        add(PatternTemplate.builder()
                .id(CASCADING_FAILURE)
                .name("Cascading Failure Pattern")
                .description("Errors spreading across multiple components")
                .type(PatternType.ERROR)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder()
                                .metric(MetricNames.ERROR_RATE)
                                .behavior(Behavior.INCREASE)
                                .rate(0.1)
                                .build())
                        .metric(MetricPattern.builder()
                                .metric(MetricNames.RESPONSE_TIME)
                                .behavior(Behavior.INCREASE)
                                .rate(0.2)
                                .build())
                        .condition(and(
                                leaf(MetricNames.ERROR_RATE, ConditionOperator.GT, 0.05),
                                leaf("active_connections", ConditionOperator.LT, 100)))
                        .timeWindow(15)
                        .build())
                .minConfidence(0.8)
                .build());

        // Usage
        add(PatternTemplate.builder()
                .id(PEAK_HOURS)
                .name("Peak Usage Hours")
                .description("Regular high usage during business hours")
                .type(PatternType.USAGE)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder()
                                .metric(MetricNames.ACTIVE_USERS)
                                .behavior(Behavior.INCREASE)
                                .threshold(0.7)
                                .build())
                        .metric(MetricPattern.builder()
                                .metric(MetricNames.THROUGHPUT)
                                .behavior(Behavior.INCREASE)
                                .threshold(0.7)
                                .build())
                        .condition(and(
                                leaf(MetricNames.HOUR_OF_DAY, ConditionOperator.GTE, 9),
                                leaf(MetricNames.HOUR_OF_DAY, ConditionOperator.LTE, 17)))
                        .frequency(PatternFrequency.builder()
                                .type(FrequencyType.PERIODIC)
                                .interval(1440.0) // daily
                                .build())
                        .build())
                .minConfidence(0.85)
                .build());

        // Security
        add(PatternTemplate.builder()
                .id(BRUTE_FORCE)
                .name("Brute Force Attack Pattern")
                .description("Multiple failed authentication attempts from same source")
                .type(PatternType.SECURITY)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder()
                                .metric(MetricNames.AUTH_FAILURES)
                                .behavior(Behavior.INCREASE)
                                .threshold(10.0)
                                .build())
                        .condition(and(
                                leaf("unique_ips", ConditionOperator.LT, 5),
                                leaf("auth_success_rate", ConditionOperator.LT, 0.1)))
                        .timeWindow(10)
                        .build())
                .minConfidence(0.9)
                .build());

        // Workflow
        add(PatternTemplate.builder()
                .id(BATCH_PROCESSING)
                .name("Batch Processing Pattern")
                .description("Regular spikes in activity for batch jobs")
                .type(PatternType.WORKFLOW)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder()
                                .metric(MetricNames.CPU_USAGE)
                                .behavior(Behavior.INCREASE)
                                .threshold(60.0)
                                .build())
                        .metric(MetricPattern.builder()
                                .metric("disk_io")
                                .behavior(Behavior.INCREASE)
                                .threshold(0.7)
                                .build())
                        .condition(or(
                                leaf(MetricNames.HOUR_OF_DAY, ConditionOperator.EQ, 2),
                                leaf(MetricNames.HOUR_OF_DAY, ConditionOperator.EQ, 14)))
                        .frequency(PatternFrequency.builder()
                                .type(FrequencyType.PERIODIC)
                                .interval(720.0) // every 12 hours
                                .build())
                        .build())
                .minConfidence(0.8)
                .build());
    }
}
