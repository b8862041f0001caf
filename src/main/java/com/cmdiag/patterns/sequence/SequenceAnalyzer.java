package com.cmdiag.patterns.sequence;

import com.cmdiag.patterns.analysis.SeriesStats;
import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.metrics.MetricExtractor;
import com.cmdiag.patterns.metrics.MetricNames;
import com.cmdiag.patterns.metrics.MetricSample;
import com.cmdiag.patterns.model.AnomalyContext;
import com.cmdiag.patterns.model.Behavior;
import com.cmdiag.patterns.model.FrequencyType;
import com.cmdiag.patterns.model.ImpactLevel;
import com.cmdiag.patterns.model.MetricPattern;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternFrequency;
import com.cmdiag.patterns.model.PatternIds;
import com.cmdiag.patterns.model.PatternOccurrence;
import com.cmdiag.patterns.model.PatternSignature;
import com.cmdiag.patterns.model.PatternType;
import com.cmdiag.patterns.model.SequenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-metric time-series analysis: repeating sub-sequences found with DTW and
 * anomalous sub-sequences found against a rolling baseline.
 *
 * The repeating search is the most expensive step of a scan.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SequenceAnalyzer {

    private final PatternEngineProperties properties;

    /**
     * Analyze each sequence metric in isolation; a failure on one metric is
     * logged and the others still run.
     */
    public List<Pattern> analyze(List<MetricSample> samples) {
        List<Pattern> patterns = new ArrayList<>();
        if (samples.isEmpty()) {
            return patterns;
        }

        for (String metric : MetricNames.SEQUENCE_METRICS) {
            try {
                double[] values = MetricExtractor.values(samples, metric);

                List<SequenceMatch> sequences = findRepeatingSequences(values);
                if (!sequences.isEmpty()) {
                    patterns.add(createSequencePattern(metric, sequences, samples));
                }

                List<AnomalyMatch> anomalies = findAnomalousSequences(values);
                if (!anomalies.isEmpty()) {
                    patterns.add(createAnomalyPattern(metric, anomalies, samples));
                }
            } catch (RuntimeException e) {
                log.warn("Sequence analysis failed for metric {}: {}", metric, e.getMessage());
            }
        }

        return patterns;
    }

    /**
     * For each candidate length, record the first later window similar enough
     * to the window at each start position, then merge overlapping results.
     */
    public List<SequenceMatch> findRepeatingSequences(double[] values) {
        PatternEngineProperties.Sequence config = properties.getSequence();
        List<SequenceMatch> sequences = new ArrayList<>();
        int maxLength = Math.min(config.getMaxLength(), values.length / config.getLengthDivisor());

        for (int length = config.getMinLength(); length <= maxLength; length += config.getLengthStep()) {
            for (int i = 0; i < values.length - length * 2; i++) {
                double[] first = SeriesStats.slice(values, i, i + length);

                for (int j = i + length; j < values.length - length; j++) {
                    double[] second = SeriesStats.slice(values, j, j + length);
                    double similarity = 1 - DynamicTimeWarping.distance(first, second) / length;

                    if (similarity > config.getSimilarityThreshold()) {
                        sequences.add(new SequenceMatch(i, length, similarity));
                        break;
                    }
                }
            }
        }

        return mergeOverlappingSequences(sequences);
    }

    /**
     * Union of overlapping or touching spans, keeping the best similarity.
     */
    static List<SequenceMatch> mergeOverlappingSequences(List<SequenceMatch> sequences) {
        if (sequences.isEmpty()) {
            return sequences;
        }

        List<SequenceMatch> sorted = sequences.stream()
                .sorted(Comparator.comparingInt(SequenceMatch::start))
                .collect(Collectors.toList());

        List<SequenceMatch> merged = new ArrayList<>();
        SequenceMatch current = sorted.get(0);

        for (SequenceMatch next : sorted.subList(1, sorted.size())) {
            if (current.end() >= next.start()) {
                current = new SequenceMatch(current.start(),
                        Math.max(current.end(), next.end()) - current.start(),
                        Math.max(current.similarity(), next.similarity()));
            } else {
                merged.add(current);
                current = next;
            }
        }

        merged.add(current);
        return merged;
    }

    /**
     * Compare each window after the baseline with the baseline's mean and
     * standard deviation. Needs at least two windows worth of values.
     */
    public List<AnomalyMatch> findAnomalousSequences(double[] values) {
        PatternEngineProperties.Anomaly config = properties.getAnomaly();
        int windowSize = config.getWindowSize();
        List<AnomalyMatch> anomalies = new ArrayList<>();

        if (values.length < windowSize * 2) {
            return anomalies;
        }

        double[] baseline = SeriesStats.slice(values, 0, windowSize);
        double baselineMean = SeriesStats.mean(baseline);
        double baselineStd = SeriesStats.stdDev(baseline);
        double scale = baselineStd != 0 ? baselineStd : 1;

        for (int i = windowSize; i < values.length - windowSize; i++) {
            double[] window = SeriesStats.slice(values, i, i + windowSize);
            double meanDiff = Math.abs(SeriesStats.mean(window) - baselineMean) / scale;
            double stdDiff = Math.abs(SeriesStats.stdDev(window) - baselineStd) / scale;
            double score = (meanDiff + stdDiff) / 2;

            if (score > config.getScoreThreshold()) {
                anomalies.add(new AnomalyMatch(i, windowSize, score));
            }
        }

        return mergeOverlappingAnomalies(anomalies, config.getMergeGap());
    }

    /**
     * Merge spans that overlap or sit within {@code gap} samples, keeping the max score.
     */
    static List<AnomalyMatch> mergeOverlappingAnomalies(List<AnomalyMatch> anomalies, int gap) {
        if (anomalies.isEmpty()) {
            return anomalies;
        }

        List<AnomalyMatch> sorted = anomalies.stream()
                .sorted(Comparator.comparingInt(AnomalyMatch::start))
                .collect(Collectors.toList());

        List<AnomalyMatch> merged = new ArrayList<>();
        AnomalyMatch current = sorted.get(0);

        for (AnomalyMatch next : sorted.subList(1, sorted.size())) {
            if (current.end() >= next.start() - gap) {
                current = new AnomalyMatch(current.start(),
                        Math.max(current.end(), next.end()) - current.start(),
                        Math.max(current.score(), next.score()));
            } else {
                merged.add(current);
                current = next;
            }
        }

        merged.add(current);
        return merged;
    }

    private Pattern createSequencePattern(String metric, List<SequenceMatch> sequences, List<MetricSample> samples) {
        List<PatternOccurrence> occurrences = sequences.stream()
                .map(seq -> {
                    MetricSample start = samples.get(seq.start());
                    return PatternOccurrence.builder()
                            .timestamp(start.getTimestamp())
                            .systemId(start.getSystemId())
                            .matchScore(seq.similarity())
                            .context(new SequenceContext(seq.start(), seq.length()))
                            .build();
                })
                .collect(Collectors.toList());

        double meanLength = sequences.stream().mapToInt(SequenceMatch::length).average().orElse(0);
        double meanSimilarity = sequences.stream().mapToDouble(SequenceMatch::similarity).average().orElse(0);

        return Pattern.builder()
                .id(PatternIds.of("sequence-" + metric, samples.get(0).getTimestamp()))
                .name(String.format("Repeating %s Pattern", metric))
                .description(String.format("Detected repeating sequence in %s with %d occurrences",
                        metric, sequences.size()))
                .type(PatternType.PERFORMANCE)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder()
                                .metric(metric)
                                .behavior(Behavior.OSCILLATING)
                                .build())
                        .frequency(PatternFrequency.builder()
                                .type(FrequencyType.RECURRING)
                                .interval((double) Math.round(meanLength))
                                .build())
                        .build())
                .occurrences(occurrences)
                .confidence(meanSimilarity)
                .impact(ImpactLevel.MEDIUM)
                .build();
    }

    private Pattern createAnomalyPattern(String metric, List<AnomalyMatch> anomalies, List<MetricSample> samples) {
        double scale = properties.getAnomaly().getScoreScale();

        List<PatternOccurrence> occurrences = anomalies.stream()
                .map(anomaly -> {
                    MetricSample start = samples.get(anomaly.start());
                    return PatternOccurrence.builder()
                            .timestamp(start.getTimestamp())
                            .systemId(start.getSystemId())
                            .matchScore(Math.min(anomaly.score() / scale, 1))
                            .context(new AnomalyContext(anomaly.start(), anomaly.length(), anomaly.score()))
                            .build();
                })
                .collect(Collectors.toList());

        double meanScore = anomalies.stream().mapToDouble(AnomalyMatch::score).average().orElse(0);

        return Pattern.builder()
                .id(PatternIds.of("anomaly-sequence-" + metric, samples.get(0).getTimestamp()))
                .name(String.format("Anomalous %s Sequences", metric))
                .description(String.format("Detected %d anomalous sequences in %s", anomalies.size(), metric))
                .type(PatternType.ERROR)
                .signature(PatternSignature.builder()
                        .metric(MetricPattern.builder()
                                .metric(metric)
                                .behavior(Behavior.OSCILLATING)
                                .build())
                        .build())
                .occurrences(occurrences)
                .confidence(Math.min(meanScore / scale, 1))
                .impact(ImpactLevel.HIGH)
                .build();
    }
}
