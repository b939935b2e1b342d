package com.shutterprobe.core.model;

import com.shutterprobe.core.detection.WeightedDurationEstimator;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single shutter opening: a maximal run of consecutive above-threshold
 * frames.
 *
 * <p>
 * Instances are immutable. The brightness list is copied at construction and
 * exposed read-only.
 * </p>
 *
 * <h3>Unterminated events</h3>
 * <p>
 * When a recording stops while the shutter is still open the run is reported
 * anyway with {@link #isUnterminated()} set, so that review logic can decide
 * whether to keep it.
 * </p>
 *
 * @since 1.0.0
 */
public final class ShutterEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long startFrame;
    private final long endFrame;
    /** Plain {@link ArrayList} so that Flink's Kryo fallback can rebuild it. */
    private final List<Double> brightnessValues;
    private final double baselineBrightness;
    private final Double peakBrightness;
    private final boolean unterminated;

    private ShutterEvent(Builder builder) {
        if (builder.endFrame < builder.startFrame) {
            throw new IllegalArgumentException("endFrame (" + builder.endFrame
                    + ") must be >= startFrame (" + builder.startFrame + ")");
        }
        this.startFrame = builder.startFrame;
        this.endFrame = builder.endFrame;
        this.brightnessValues = new ArrayList<>(
                Objects.requireNonNull(builder.brightnessValues, "brightnessValues must not be null"));
        this.baselineBrightness = builder.baselineBrightness;
        this.peakBrightness = builder.peakBrightness;
        this.unterminated = builder.unterminated;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ShutterEvent}.
     *
     * <p>
     * {@link #build()} rejects {@code endFrame < startFrame}.
     * </p>
     */
    public static class Builder {
        private long startFrame;
        private long endFrame;
        private List<Double> brightnessValues = List.of();
        private double baselineBrightness;
        private Double peakBrightness;
        private boolean unterminated;

        public Builder startFrame(long startFrame) {
            this.startFrame = startFrame;
            return this;
        }

        public Builder endFrame(long endFrame) {
            this.endFrame = endFrame;
            return this;
        }

        public Builder brightnessValues(List<Double> brightnessValues) {
            this.brightnessValues = brightnessValues;
            return this;
        }

        public Builder baselineBrightness(double baselineBrightness) {
            this.baselineBrightness = baselineBrightness;
            return this;
        }

        public Builder peakBrightness(Double peakBrightness) {
            this.peakBrightness = peakBrightness;
            return this;
        }

        public Builder unterminated(boolean unterminated) {
            this.unterminated = unterminated;
            return this;
        }

        /**
         * @return a new {@link ShutterEvent}
         * @throws IllegalArgumentException if {@code endFrame < startFrame}
         * @throws NullPointerException     if the brightness list is {@code null}
         */
        public ShutterEvent build() {
            return new ShutterEvent(this);
        }
    }

    public long getStartFrame() {
        return startFrame;
    }

    public long getEndFrame() {
        return endFrame;
    }

    /**
     * @return read-only view of the per-frame brightness values
     */
    public List<Double> getBrightnessValues() {
        return Collections.unmodifiableList(brightnessValues);
    }

    public double getBaselineBrightness() {
        return baselineBrightness;
    }

    public Optional<Double> getPeakBrightness() {
        return Optional.ofNullable(peakBrightness);
    }

    public boolean isUnterminated() {
        return unterminated;
    }

    /**
     * @return number of frames in the event, both ends inclusive
     */
    public long getDurationFrames() {
        return endFrame - startFrame + 1;
    }

    /**
     * @return sub-frame duration where transition frames count fractionally
     * @see WeightedDurationEstimator#estimate(ShutterEvent)
     */
    public double getWeightedDurationFrames() {
        return WeightedDurationEstimator.estimate(this);
    }

    public double getMaxBrightness() {
        if (brightnessValues.isEmpty()) {
            return 0.0;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (double v : brightnessValues) {
            max = Math.max(max, v);
        }
        return max;
    }

    public double getAverageBrightness() {
        if (brightnessValues.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : brightnessValues) {
            sum += v;
        }
        return sum / brightnessValues.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ShutterEvent that))
            return false;
        return startFrame == that.startFrame
                && endFrame == that.endFrame
                && Double.compare(baselineBrightness, that.baselineBrightness) == 0
                && unterminated == that.unterminated
                && Objects.equals(peakBrightness, that.peakBrightness)
                && brightnessValues.equals(that.brightnessValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startFrame, endFrame, brightnessValues, baselineBrightness,
                peakBrightness, unterminated);
    }

    @Override
    public String toString() {
        return String.format("ShutterEvent{startFrame=%d, endFrame=%d, durationFrames=%d, "
                        + "weighted=%.2f, maxBrightness=%.2f%s}",
                startFrame, endFrame, getDurationFrames(), getWeightedDurationFrames(),
                getMaxBrightness(), unterminated ? ", unterminated" : "");
    }
}
