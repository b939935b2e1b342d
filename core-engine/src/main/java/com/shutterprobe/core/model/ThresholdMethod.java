package com.shutterprobe.core.model;

import java.util.Locale;

/**
 * Threshold selection methods understood by the threshold calculator, plus
 * the label carried by thresholds that live calibration derives.
 *
 * @since 1.0.0
 */
public enum ThresholdMethod {

    /** {@code baseline + (median - baseline) * marginFactor}. */
    PERCENTILE_MARGIN("percentile-margin", true, false),

    /** {@code mean + z * stdDev}, z tuned to an expected event count. */
    ZSCORE("zscore", true, true),

    /** Midpoint between density clusters, tuned to an expected event count. */
    CLUSTERING("clustering", true, true),

    /**
     * {@code baseline + (peak - baseline) * peakFraction} from the calibration
     * shot. Produced by live calibration only; not selectable in a profile.
     */
    LIVE_CALIBRATION("live-calibration", false, false);

    private final String configName;
    private final boolean selectable;
    private final boolean requiresExpectedEventCount;

    ThresholdMethod(String configName, boolean selectable, boolean requiresExpectedEventCount) {
        this.configName = configName;
        this.selectable = selectable;
        this.requiresExpectedEventCount = requiresExpectedEventCount;
    }

    /**
     * @return the name used for this method in analysis profiles
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * @return {@code true} if a caller or profile may choose this method
     */
    public boolean isSelectable() {
        return selectable;
    }

    /**
     * @return {@code true} if the method cannot run without an expected event
     *         count
     */
    public boolean requiresExpectedEventCount() {
        return requiresExpectedEventCount;
    }

    /**
     * Resolve a selectable method from its profile name. Matching ignores case
     * and accepts underscores in place of dashes.
     *
     * @param name profile name, e.g. {@code "percentile-margin"}
     * @return the matching method
     * @throws IllegalArgumentException if {@code name} is {@code null},
     *                                  unknown or not selectable
     */
    public static ThresholdMethod fromConfigName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Threshold method name must not be null");
        }
        String normalised = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ThresholdMethod method : values()) {
            if (method.selectable && method.configName.equals(normalised)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown threshold method: '" + name
                + "'. Supported: percentile-margin, zscore, clustering");
    }
}
