package com.shutterprobe.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Tuning for live-mode calibration.
 *
 * <p>
 * The preliminary threshold is the highest of
 * {@code baseline + stdDevMultiplier * stdDev},
 * {@code baseline + absoluteFloor} and {@code maxSeen * maxSeenMultiplier};
 * the final threshold is
 * {@code baseline + (peak - baseline) * peakFraction}.
 * </p>
 *
 * @since 1.0.0
 */
public class CalibrationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_BASELINE_FRAMES = 60;
    public static final double DEFAULT_STD_DEV_MULTIPLIER = 5.0;
    public static final double DEFAULT_ABSOLUTE_FLOOR = 50.0;
    public static final double DEFAULT_MAX_SEEN_MULTIPLIER = 2.0;
    public static final double DEFAULT_PEAK_FRACTION = 0.8;

    /** Dark frames collected for the baseline window. */
    private int baselineFrames = DEFAULT_BASELINE_FRAMES;

    private double stdDevMultiplier = DEFAULT_STD_DEV_MULTIPLIER;

    /** Minimum distance of the preliminary threshold above baseline. */
    private double absoluteFloor = DEFAULT_ABSOLUTE_FLOOR;

    private double maxSeenMultiplier = DEFAULT_MAX_SEEN_MULTIPLIER;

    /** Position of the final threshold between baseline and calibration peak. */
    private double peakFraction = DEFAULT_PEAK_FRACTION;

    /**
     * Collect every out-of-range field into {@code errors}.
     *
     * @param errors destination for error messages
     */
    void collectErrors(List<String> errors) {
        if (baselineFrames < 1) {
            errors.add("calibration 'baselineFrames' must be >= 1, got: " + baselineFrames);
        }
        if (stdDevMultiplier < 0) {
            errors.add("calibration 'stdDevMultiplier' must be >= 0, got: " + stdDevMultiplier);
        }
        if (!(absoluteFloor > 0)) {
            errors.add("calibration 'absoluteFloor' must be > 0, got: " + absoluteFloor);
        }
        if (maxSeenMultiplier < 0) {
            errors.add("calibration 'maxSeenMultiplier' must be >= 0, got: " + maxSeenMultiplier);
        }
        if (!(peakFraction > 0 && peakFraction < 1)) {
            errors.add("calibration 'peakFraction' must be in (0, 1), got: " + peakFraction);
        }
    }

    /**
     * @throws IllegalStateException if any field is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid CalibrationSettings: " + String.join("; ", errors));
        }
    }

    public int getBaselineFrames() {
        return baselineFrames;
    }

    public void setBaselineFrames(int baselineFrames) {
        this.baselineFrames = baselineFrames;
    }

    public double getStdDevMultiplier() {
        return stdDevMultiplier;
    }

    public void setStdDevMultiplier(double stdDevMultiplier) {
        this.stdDevMultiplier = stdDevMultiplier;
    }

    public double getAbsoluteFloor() {
        return absoluteFloor;
    }

    public void setAbsoluteFloor(double absoluteFloor) {
        this.absoluteFloor = absoluteFloor;
    }

    public double getMaxSeenMultiplier() {
        return maxSeenMultiplier;
    }

    public void setMaxSeenMultiplier(double maxSeenMultiplier) {
        this.maxSeenMultiplier = maxSeenMultiplier;
    }

    public double getPeakFraction() {
        return peakFraction;
    }

    public void setPeakFraction(double peakFraction) {
        this.peakFraction = peakFraction;
    }

    @Override
    public String toString() {
        return "CalibrationSettings{" +
                "baselineFrames=" + baselineFrames +
                ", stdDevMultiplier=" + stdDevMultiplier +
                ", absoluteFloor=" + absoluteFloor +
                ", maxSeenMultiplier=" + maxSeenMultiplier +
                ", peakFraction=" + peakFraction +
                '}';
    }
}
