package com.shutterprobe.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Baseline and detection threshold derived from one calibration cycle.
 *
 * <p>
 * Batch analysis computes one model per series; live sessions compute one per
 * calibration. {@code threshold > baseline} holds for every model produced by
 * the threshold calculator and the calibration controller.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code method} is required.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ThresholdMethod method;
    private final double baseline;
    private final double threshold;
    private final Double peak;
    private final Double stdDev;

    private ThresholdModel(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.baseline = builder.baseline;
        this.threshold = builder.threshold;
        this.peak = builder.peak;
        this.stdDev = builder.stdDev;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ThresholdModel}.
     */
    public static class Builder {
        private ThresholdMethod method;
        private double baseline;
        private double threshold;
        private Double peak;
        private Double stdDev;

        public Builder method(ThresholdMethod method) {
            this.method = method;
            return this;
        }

        public Builder baseline(double baseline) {
            this.baseline = baseline;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder peak(Double peak) {
            this.peak = peak;
            return this;
        }

        public Builder stdDev(Double stdDev) {
            this.stdDev = stdDev;
            return this;
        }

        /**
         * @return a new {@link ThresholdModel}
         * @throws NullPointerException if {@code method} is {@code null}
         */
        public ThresholdModel build() {
            return new ThresholdModel(this);
        }
    }

    public ThresholdMethod getMethod() {
        return method;
    }

    public double getBaseline() {
        return baseline;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return typical fully-open brightness, when the method produced one
     */
    public Optional<Double> getPeak() {
        return Optional.ofNullable(peak);
    }

    public Optional<Double> getStdDev() {
        return Optional.ofNullable(stdDev);
    }

    /**
     * @param brightness frame brightness
     * @return {@code true} if the frame counts as shutter open
     */
    public boolean isOpen(double brightness) {
        return brightness > threshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdModel that))
            return false;
        return method == that.method
                && Double.compare(baseline, that.baseline) == 0
                && Double.compare(threshold, that.threshold) == 0
                && Objects.equals(peak, that.peak)
                && Objects.equals(stdDev, that.stdDev);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, baseline, threshold, peak, stdDev);
    }

    @Override
    public String toString() {
        return "ThresholdModel{" +
                "method=" + method +
                ", baseline=" + baseline +
                ", threshold=" + threshold +
                ", peak=" + peak +
                ", stdDev=" + stdDev +
                '}';
    }
}
