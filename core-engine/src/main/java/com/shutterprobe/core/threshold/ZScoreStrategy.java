package com.shutterprobe.core.threshold;

import com.shutterprobe.core.detection.BatchEventFinder;
import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.model.ThresholdModel;
import com.shutterprobe.core.stats.BaselineStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Z-score auto-tuning threshold method.
 *
 * <p>
 * Tries {@code threshold = mean + z * stdDev} for {@value #Z_STEPS} evenly
 * spaced values of {@code z} between {@value #Z_MIN} and {@value #Z_MAX}
 * (both inclusive) and keeps the one whose event count is closest to the
 * expected count. On ties the smallest {@code z} wins.
 * </p>
 *
 * <p>
 * The expected event count is mandatory: without it there is nothing to tune
 * against, and a {@link MissingParameterException} is thrown.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreStrategy implements ThresholdStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreStrategy.class);

    static final double Z_MIN = 1.0;
    static final double Z_MAX = 5.0;
    static final int Z_STEPS = 40;

    /** Below this standard deviation the samples are treated as uniform. */
    static final double MIN_STD_DEV = 1e-6;

    /** Offset above the mean used for uniform samples. */
    static final double UNIFORM_OFFSET = 0.1;

    @Override
    public ThresholdModel calculate(List<Double> samples, Integer expectedEventCount) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (expectedEventCount == null) {
            throw new MissingParameterException("expectedEventCount",
                    "Z-score threshold method requires an expected event count");
        }
        if (expectedEventCount <= 0) {
            throw new MissingParameterException("expectedEventCount",
                    "Z-score threshold method requires a positive expected event count, got: "
                            + expectedEventCount);
        }

        double baseline = BaselineStatistics.percentile(samples, PercentileMarginStrategy.BASELINE_PERCENTILE);
        double mean = BaselineStatistics.mean(samples);
        double std = BaselineStatistics.stdDev(samples);
        double max = BaselineStatistics.max(samples);

        double proposed;
        if (std < MIN_STD_DEV) {
            proposed = mean + UNIFORM_OFFSET;
            LOG.debug("Z-score: samples are uniform (std={}), threshold={}", std, proposed);
        } else {
            proposed = search(samples, mean, std, expectedEventCount);
        }

        double threshold = DegenerateThresholdPolicy.apply(baseline, proposed, max);

        return ThresholdModel.builder()
                .method(ThresholdMethod.ZSCORE)
                .baseline(baseline)
                .threshold(threshold)
                .stdDev(std)
                .build();
    }

    @Override
    public ThresholdMethod getMethod() {
        return ThresholdMethod.ZSCORE;
    }

    private double search(List<Double> samples, double mean, double std, int expectedEventCount) {
        double bestThreshold = mean;
        double bestZ = Double.NaN;
        int bestDiff = Integer.MAX_VALUE;

        for (int i = 0; i < Z_STEPS; i++) {
            double z = Z_MIN + i * (Z_MAX - Z_MIN) / (Z_STEPS - 1);
            double candidate = mean + z * std;
            int count = BatchEventFinder.countEvents(samples, candidate);
            int diff = Math.abs(count - expectedEventCount);
            if (diff < bestDiff) {
                bestDiff = diff;
                bestThreshold = candidate;
                bestZ = z;
            }
        }

        LOG.debug("Z-score search: mean={} std={} bestZ={} threshold={} countDiff={}",
                mean, std, bestZ, bestThreshold, bestDiff);
        return bestThreshold;
    }
}
