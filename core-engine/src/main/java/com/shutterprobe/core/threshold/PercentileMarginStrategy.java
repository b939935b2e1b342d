package com.shutterprobe.core.threshold;

import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.model.ThresholdModel;
import com.shutterprobe.core.stats.BaselineStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Default threshold method.
 *
 * <p>
 * {@code baseline = percentile(25)} and
 * {@code threshold = baseline + (median - baseline) * marginFactor}. The
 * median sits on the dark plateau when events cover less than half of the
 * frames, so the margin lifts the threshold just above closed-shutter noise.
 * </p>
 *
 * @since 1.0.0
 */
public class PercentileMarginStrategy implements ThresholdStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(PercentileMarginStrategy.class);

    /** Percentile used as the closed-shutter baseline. */
    public static final double BASELINE_PERCENTILE = 25.0;

    public static final double DEFAULT_MARGIN_FACTOR = 1.5;

    private final double marginFactor;

    public PercentileMarginStrategy() {
        this(DEFAULT_MARGIN_FACTOR);
    }

    /**
     * @param marginFactor multiplier applied to {@code median - baseline}
     * @throws IllegalArgumentException if {@code marginFactor} is not positive
     */
    public PercentileMarginStrategy(double marginFactor) {
        if (!(marginFactor > 0)) {
            throw new IllegalArgumentException("marginFactor must be > 0, got: " + marginFactor);
        }
        this.marginFactor = marginFactor;
    }

    @Override
    public ThresholdModel calculate(List<Double> samples, Integer expectedEventCount) {
        Objects.requireNonNull(samples, "samples must not be null");

        double baseline = BaselineStatistics.percentile(samples, BASELINE_PERCENTILE);
        double median = BaselineStatistics.median(samples);
        double max = BaselineStatistics.max(samples);

        double proposed = baseline + (median - baseline) * marginFactor;
        double threshold = DegenerateThresholdPolicy.apply(baseline, proposed, max);

        LOG.debug("Percentile-margin threshold: baseline={} median={} factor={} threshold={}",
                baseline, median, marginFactor, threshold);

        return ThresholdModel.builder()
                .method(ThresholdMethod.PERCENTILE_MARGIN)
                .baseline(baseline)
                .threshold(threshold)
                .build();
    }

    @Override
    public ThresholdMethod getMethod() {
        return ThresholdMethod.PERCENTILE_MARGIN;
    }

    public double getMarginFactor() {
        return marginFactor;
    }
}
