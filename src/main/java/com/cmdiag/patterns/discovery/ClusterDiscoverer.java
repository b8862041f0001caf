package com.cmdiag.patterns.discovery;

import com.cmdiag.patterns.analysis.BehaviorClassifier;
import com.cmdiag.patterns.analysis.SeriesStats;
import com.cmdiag.patterns.config.PatternEngineProperties;
import com.cmdiag.patterns.metrics.MetricExtractor;
import com.cmdiag.patterns.metrics.MetricNames;
import com.cmdiag.patterns.metrics.MetricSample;
import com.cmdiag.patterns.model.ClusterContext;
import com.cmdiag.patterns.model.ClusterMethod;
import com.cmdiag.patterns.model.ConditionOperator;
import com.cmdiag.patterns.model.ImpactLevel;
import com.cmdiag.patterns.model.MetricPattern;
import com.cmdiag.patterns.model.Pattern;
import com.cmdiag.patterns.model.PatternCondition;
import com.cmdiag.patterns.model.PatternIds;
import com.cmdiag.patterns.model.PatternOccurrence;
import com.cmdiag.patterns.model.PatternSignature;
import com.cmdiag.patterns.model.PatternType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Surfaces uncatalogued regimes by clustering per-sample feature vectors.
 *
 * Two methods run over the same features: seeded k-means++ (reproducible)
 * and DBSCAN. Every cluster with enough members is turned into a pattern
 * whose signature holds the metrics that stay tight inside the cluster.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClusterDiscoverer {

    private final PatternEngineProperties properties;
    private final BehaviorClassifier behaviorClassifier;

    public List<Pattern> discover(List<MetricSample> samples) {
        PatternEngineProperties.Discovery config = properties.getDiscovery();
        List<Pattern> patterns = new ArrayList<>();

        if (samples.size() < config.getMinSamples()) {
            log.debug("Skipping discovery: {} samples (need {})", samples.size(), config.getMinSamples());
            return patterns;
        }

        List<SampleFeatures> features = extractFeatures(samples);

        try {
            patterns.addAll(clusterWithKMeans(features));
        } catch (RuntimeException e) {
            log.warn("K-means clustering failed: {}", e.getMessage());
        }

        try {
            patterns.addAll(clusterWithDbscan(features));
        } catch (RuntimeException e) {
            log.warn("DBSCAN clustering failed: {}", e.getMessage());
        }

        log.debug("Discovered {} cluster patterns from {} samples", patterns.size(), samples.size());
        return patterns;
    }

    /**
     * [cpu, memory %, response time, error rate, throughput, active users, hour/24, day-of-week/7]
     */
    public List<SampleFeatures> extractFeatures(List<MetricSample> samples) {
        List<SampleFeatures> features = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            MetricSample s = samples.get(i);
            double[] point = {
                    s.getCpuUsage(),
                    s.getMemoryUsagePercent(),
                    s.getAvgResponseTime(),
                    s.getErrorRate(),
                    s.getThroughput(),
                    s.getActiveUsers(),
                    MetricExtractor.value(s, MetricNames.HOUR_OF_DAY) / 24.0,
                    MetricExtractor.value(s, MetricNames.DAY_OF_WEEK) / 7.0
            };
            features.add(new SampleFeatures(i, s, point));
        }
        return features;
    }

    private List<Pattern> clusterWithKMeans(List<SampleFeatures> features) {
        PatternEngineProperties.Discovery config = properties.getDiscovery();
        int k = Math.min(config.getMaxClusters(), features.size() / config.getSamplesPerCluster());
        if (k < 1) {
            return List.of();
        }

        KMeansPlusPlusClusterer<SampleFeatures> clusterer = new KMeansPlusPlusClusterer<>(
                k, config.getKmeansMaxIterations(), new EuclideanDistance(), new Well19937c(config.getKmeansSeed()));

        List<? extends Cluster<SampleFeatures>> clusters = clusterer.cluster(features);
        return toPatterns(clusters, ClusterMethod.KMEANS);
    }

    private List<Pattern> clusterWithDbscan(List<SampleFeatures> features) {
        PatternEngineProperties.Discovery config = properties.getDiscovery();
        // DBSCANClusterer does not count a point as its own neighbour
        int otherNeighbours = Math.max(0, config.getDbscanMinPoints() - 1);
        DBSCANClusterer<SampleFeatures> clusterer =
                new DBSCANClusterer<>(config.getDbscanEps(), otherNeighbours);

        return toPatterns(clusterer.cluster(features), ClusterMethod.DBSCAN);
    }

    private List<Pattern> toPatterns(List<? extends Cluster<SampleFeatures>> clusters, ClusterMethod method) {
        List<Pattern> patterns = new ArrayList<>();
        for (int i = 0; i < clusters.size(); i++) {
            List<SampleFeatures> points = clusters.get(i).getPoints();
            if (points.size() < properties.getDiscovery().getMinClusterSize()) {
                continue;
            }

            // keep members in series order
            List<MetricSample> members = points.stream()
                    .sorted(Comparator.comparingInt(SampleFeatures::getIndex))
                    .map(SampleFeatures::getSample)
                    .collect(Collectors.toList());

            synthesize(members, method.clusterId(i), method).ifPresent(patterns::add);
        }
        return patterns;
    }

    /**
     * Build a pattern from one cluster, or empty when no metric is
     * characteristic of it.
     */
    public Optional<Pattern> synthesize(List<MetricSample> members, String clusterId, ClusterMethod method) {
        PatternEngineProperties.Discovery config = properties.getDiscovery();
        if (members.size() < config.getMinClusterSize()) {
            return Optional.empty();
        }

        PatternSignature.PatternSignatureBuilder signature = PatternSignature.builder();
        List<MetricPattern> characteristic = new ArrayList<>();

        for (String metric : MetricNames.CLUSTER_METRICS) {
            double[] values = MetricExtractor.values(members, metric);
            double mean = SeriesStats.mean(values);
            double stdDev = SeriesStats.stdDev(values);

            if (mean != 0 && stdDev / mean < config.getCharacteristicCv()) {
                characteristic.add(MetricPattern.builder()
                        .metric(metric)
                        .behavior(behaviorClassifier.classify(values))
                        .threshold(mean)
                        .build());
            }
        }

        if (characteristic.isEmpty()) {
            return Optional.empty();
        }
        signature.metrics(characteristic);

        int[] hours = members.stream()
                .mapToInt(m -> (int) MetricExtractor.value(m, MetricNames.HOUR_OF_DAY))
                .toArray();
        double[] hourValues = MetricExtractor.values(members, MetricNames.HOUR_OF_DAY);
        if (SeriesStats.stdDev(hourValues) < config.getHourStdDevLimit()) {
            int mode = SeriesStats.mode(hours);
            signature.condition(PatternCondition.and(
                    PatternCondition.leaf(MetricNames.HOUR_OF_DAY, ConditionOperator.GTE, mode - config.getHourBand()),
                    PatternCondition.leaf(MetricNames.HOUR_OF_DAY, ConditionOperator.LTE, mode + config.getHourBand())));
        }

        List<PatternOccurrence> occurrences = members.stream()
                .map(m -> PatternOccurrence.builder()
                        .timestamp(m.getTimestamp())
                        .systemId(m.getSystemId())
                        .matchScore(config.getOccurrenceScore())
                        .context(new ClusterContext(clusterId, method))
                        .build())
                .collect(Collectors.toList());

        return Optional.of(Pattern.builder()
                .id(PatternIds.of("discovered-" + clusterId, members.get(0).getTimestamp()))
                .name("Discovered Pattern " + clusterId)
                .description("Automatically discovered pattern from clustering analysis")
                .type(inferType(characteristic))
                .signature(signature.build())
                .occurrences(occurrences)
                .confidence(config.getConfidence())
                .impact(ImpactLevel.MEDIUM)
                .build());
    }

    static PatternType inferType(List<MetricPattern> metrics) {
        if (anyNameContains(metrics, "auth") || anyNameContains(metrics, "security")) {
            return PatternType.SECURITY;
        }
        if (anyNameContains(metrics, "error")) {
            return PatternType.ERROR;
        }
        if (anyNameContains(metrics, "cpu") || anyNameContains(metrics, "memory") || anyNameContains(metrics, "response")) {
            return PatternType.PERFORMANCE;
        }
        return PatternType.USAGE;
    }

    private static boolean anyNameContains(List<MetricPattern> metrics, String fragment) {
        return metrics.stream().anyMatch(m -> m.getMetric() != null && m.getMetric().contains(fragment));
    }
}
