package com.shutterprobe.core.threshold;

import com.shutterprobe.core.detection.BatchEventFinder;
import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.model.ThresholdModel;
import com.shutterprobe.core.stats.BaselineStatistics;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bimodal separation by density clustering of brightness values.
 *
 * <p>
 * Runs {@link DBSCANClusterer} with {@value #EPS_STEPS} neighbourhood radii
 * evenly spaced from {@value #EPS_MIN_FRACTION} to {@value #EPS_MAX_FRACTION}
 * of the brightness range. For every run the midpoints between adjacent
 * cluster means are candidate thresholds; the candidate whose event count is
 * closest to the expected count wins. On equal counts the candidate lying in
 * the widest gap between cluster means is kept, which separates the dark and
 * bright populations rather than two dark levels. The brightest cluster mean
 * of the winning run is reported as the peak.
 * </p>
 *
 * <p>
 * When no run yields two clusters the threshold is the
 * {@value #FALLBACK_PERCENTILE}th percentile. The expected event count is
 * mandatory, as for {@link ZScoreStrategy}.
 * </p>
 *
 * @since 1.0.0
 */
public class ClusteringStrategy implements ThresholdStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ClusteringStrategy.class);

    static final double EPS_MIN_FRACTION = 0.01;
    static final double EPS_MAX_FRACTION = 0.2;
    static final int EPS_STEPS = 20;

    /** Neighbours a core sample needs, itself excluded: five samples in all. */
    static final int MIN_NEIGHBOURS = 4;

    static final double FALLBACK_PERCENTILE = 95.0;

    /** Below this brightness range the samples are treated as uniform. */
    static final double MIN_RANGE = 1e-6;

    @Override
    public ThresholdModel calculate(List<Double> samples, Integer expectedEventCount) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (expectedEventCount == null) {
            throw new MissingParameterException("expectedEventCount",
                    "Clustering threshold method requires an expected event count");
        }
        if (expectedEventCount <= 0) {
            throw new MissingParameterException("expectedEventCount",
                    "Clustering threshold method requires a positive expected event count, got: "
                            + expectedEventCount);
        }

        double baseline = BaselineStatistics.percentile(samples, PercentileMarginStrategy.BASELINE_PERCENTILE);
        double min = BaselineStatistics.min(samples);
        double max = BaselineStatistics.max(samples);
        double range = max - min;

        if (samples.isEmpty() || range < MIN_RANGE) {
            double proposed = samples.isEmpty()
                    ? baseline
                    : BaselineStatistics.percentile(samples, uniformPercentile(samples.size(), expectedEventCount));
            LOG.debug("Clustering: samples are uniform (range={}), threshold={}", range, proposed);
            return ThresholdModel.builder()
                    .method(ThresholdMethod.CLUSTERING)
                    .baseline(baseline)
                    .threshold(DegenerateThresholdPolicy.apply(baseline, proposed, max))
                    .build();
        }

        List<DoublePoint> points = new ArrayList<>(samples.size());
        for (double v : samples) {
            points.add(new DoublePoint(new double[] { v }));
        }

        Split best = null;
        for (int i = 0; i < EPS_STEPS; i++) {
            double fraction = EPS_MIN_FRACTION + i * (EPS_MAX_FRACTION - EPS_MIN_FRACTION) / (EPS_STEPS - 1);
            List<Double> means = clusterMeans(samples, points, range * fraction);
            for (int c = 0; c + 1 < means.size(); c++) {
                double candidate = (means.get(c) + means.get(c + 1)) / 2.0;
                Split split = new Split(candidate,
                        Math.abs(BatchEventFinder.countEvents(samples, candidate) - expectedEventCount),
                        means.get(c + 1) - means.get(c),
                        means.get(means.size() - 1));
                if (split.isBetterThan(best)) {
                    best = split;
                }
            }
        }

        ThresholdModel.Builder model = ThresholdModel.builder()
                .method(ThresholdMethod.CLUSTERING)
                .baseline(baseline);
        if (best == null) {
            double proposed = BaselineStatistics.percentile(samples, FALLBACK_PERCENTILE);
            LOG.warn("Clustering found fewer than two clusters; using p{} = {}", FALLBACK_PERCENTILE, proposed);
            return model.threshold(DegenerateThresholdPolicy.apply(baseline, proposed, max)).build();
        }

        LOG.debug("Clustering threshold: threshold={} countDiff={} gap={} peak={}",
                best.threshold, best.countDiff, best.gap, best.peak);
        return model
                .threshold(DegenerateThresholdPolicy.apply(baseline, best.threshold, max))
                .peak(best.peak)
                .build();
    }

    @Override
    public ThresholdMethod getMethod() {
        return ThresholdMethod.CLUSTERING;
    }

    /**
     * Cluster the samples and average every sample of each cluster.
     *
     * <p>
     * {@link DoublePoint} compares by value, so a cluster lists each distinct
     * brightness once; means are taken over the samples, duplicates included.
     * </p>
     *
     * @return cluster means in ascending order; noise samples are left out
     */
    static List<Double> clusterMeans(List<Double> samples, List<DoublePoint> points, double eps) {
        List<Cluster<DoublePoint>> clusters = new DBSCANClusterer<DoublePoint>(eps, MIN_NEIGHBOURS).cluster(points);
        Map<Double, Integer> labels = new HashMap<>();
        for (int c = 0; c < clusters.size(); c++) {
            for (DoublePoint p : clusters.get(c).getPoints()) {
                labels.put(p.getPoint()[0], c);
            }
        }

        double[] sums = new double[clusters.size()];
        long[] counts = new long[clusters.size()];
        for (double v : samples) {
            Integer label = labels.get(v);
            if (label != null) {
                sums[label] += v;
                counts[label]++;
            }
        }

        List<Double> means = new ArrayList<>(clusters.size());
        for (int c = 0; c < clusters.size(); c++) {
            if (counts[c] > 0) {
                means.add(sums[c] / counts[c]);
            }
        }
        means.sort(null);
        return means;
    }

    private static double uniformPercentile(int size, int expectedEventCount) {
        double p = 100.0 - (double) expectedEventCount / size * 100.0;
        return Math.max(0.0, Math.min(100.0, p));
    }

    private static final class Split {
        final double threshold;
        final int countDiff;
        final double gap;
        final double peak;

        Split(double threshold, int countDiff, double gap, double peak) {
            this.threshold = threshold;
            this.countDiff = countDiff;
            this.gap = gap;
            this.peak = peak;
        }

        boolean isBetterThan(Split other) {
            if (other == null) {
                return true;
            }
            return countDiff < other.countDiff || (countDiff == other.countDiff && gap > other.gap);
        }
    }
}
