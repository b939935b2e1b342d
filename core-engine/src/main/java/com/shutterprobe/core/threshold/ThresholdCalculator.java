package com.shutterprobe.core.threshold;

import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.model.ThresholdModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for deriving a {@link ThresholdModel} from brightness samples.
 *
 * <p>
 * Delegates to the {@link ThresholdStrategy} selected by the caller. The
 * percentile-margin method is the default.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdCalculator.class);

    private final double marginFactor;

    public ThresholdCalculator() {
        this(PercentileMarginStrategy.DEFAULT_MARGIN_FACTOR);
    }

    /**
     * @param marginFactor margin factor used by the percentile-margin method
     * @throws IllegalArgumentException if {@code marginFactor} is not positive
     */
    public ThresholdCalculator(double marginFactor) {
        if (!(marginFactor > 0)) {
            throw new IllegalArgumentException("marginFactor must be > 0, got: " + marginFactor);
        }
        this.marginFactor = marginFactor;
    }

    /**
     * Percentile-margin threshold with this calculator's margin factor.
     *
     * @param samples brightness samples; must not be {@code null}
     * @return the threshold model
     */
    public ThresholdModel calculate(List<Double> samples) {
        return calculate(samples, ThresholdMethod.PERCENTILE_MARGIN, null);
    }

    /**
     * @param samples            brightness samples; must not be {@code null}
     * @param method             threshold method; must not be {@code null}
     * @param expectedEventCount expected number of events, or {@code null}
     * @return the threshold model
     * @throws MissingParameterException if {@code method} needs
     *                                   {@code expectedEventCount} and it is
     *                                   absent
     */
    public ThresholdModel calculate(List<Double> samples, ThresholdMethod method,
            Integer expectedEventCount) {
        Objects.requireNonNull(samples, "samples must not be null");
        ThresholdStrategy strategy = ThresholdStrategyFactory.create(method, marginFactor);
        ThresholdModel model = strategy.calculate(samples, expectedEventCount);
        LOG.info("Threshold calculated over {} sample(s): method={} baseline={} threshold={}",
                samples.size(), method, model.getBaseline(), model.getThreshold());
        return model;
    }

    public double getMarginFactor() {
        return marginFactor;
    }
}
