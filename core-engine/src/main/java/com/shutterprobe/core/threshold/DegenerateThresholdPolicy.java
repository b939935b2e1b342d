package com.shutterprobe.core.threshold;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback chain that keeps a threshold strictly above its baseline.
 *
 * <ol>
 * <li>If {@code threshold <= baseline}, use
 * {@code baseline + (max - baseline) * }{@value #RANGE_FRACTION}.</li>
 * <li>If that is still {@code <= baseline} (all samples identical), use
 * {@code baseline + }{@value #ABSOLUTE_OFFSET}.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class DegenerateThresholdPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(DegenerateThresholdPolicy.class);

    /** Fraction of the baseline-to-max range used by the first fallback. */
    public static final double RANGE_FRACTION = 0.1;

    /** Fixed offset above baseline used when the samples have no range. */
    public static final double ABSOLUTE_OFFSET = 50.0;

    private DegenerateThresholdPolicy() {
        // utility class — not instantiable
    }

    /**
     * @param baseline  the baseline brightness
     * @param threshold the threshold proposed by a method
     * @param max       the maximum sample value
     * @return {@code threshold} if it is above {@code baseline}, otherwise the
     *         first fallback that is
     */
    public static double apply(double baseline, double threshold, double max) {
        if (threshold > baseline) {
            return threshold;
        }
        double rangeFallback = baseline + (max - baseline) * RANGE_FRACTION;
        if (rangeFallback > baseline) {
            LOG.warn("Threshold {} not above baseline {} – using 10% of range: {}",
                    threshold, baseline, rangeFallback);
            return rangeFallback;
        }
        double absolute = baseline + ABSOLUTE_OFFSET;
        LOG.warn("Brightness samples have no range above baseline {} – using fixed threshold {}",
                baseline, absolute);
        return absolute;
    }
}
