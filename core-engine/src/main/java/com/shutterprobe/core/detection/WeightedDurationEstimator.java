package com.shutterprobe.core.detection;

import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.stats.BaselineStatistics;

import java.util.List;
import java.util.Objects;

/**
 * Sub-frame event duration.
 *
 * <p>
 * A binary open/closed count rounds a 2.7-frame exposure to 2 or 3 frames.
 * Weighting each frame by how open it is removes most of that error. The
 * plateau reference is the event's own median brightness, not a global peak:
 * plateau frames vary (80 and 100 in one event are both fully open), and any
 * frame at or above the median counts as fully open.
 * </p>
 *
 * <pre>
 * eventPeak = median(values)
 * weight(b) = clamp((b - baseline) / (eventPeak - baseline), 0, 1)
 * weighted  = sum(weight(b))
 * </pre>
 *
 * <p>
 * If {@code eventPeak <= baseline} there is no usable range and the plain
 * frame count is returned.
 * </p>
 *
 * @since 1.0.0
 */
public final class WeightedDurationEstimator {

    private WeightedDurationEstimator() {
        // utility class — not instantiable
    }

    /**
     * @param event the event; must not be {@code null}
     * @return weighted duration in frames, or the plain duration when the
     *         event has no brightness samples or no range above baseline
     */
    public static double estimate(ShutterEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        List<Double> values = event.getBrightnessValues();
        if (values.isEmpty()
                || BaselineStatistics.median(values) <= event.getBaselineBrightness()) {
            return event.getDurationFrames();
        }
        return estimate(values, event.getBaselineBrightness());
    }

    /**
     * @param values   brightness of each frame of one event; must not be
     *                 {@code null}
     * @param baseline closed-shutter brightness
     * @return weighted duration in frames; {@code values.size()} when the
     *         event median is not above {@code baseline}
     */
    public static double estimate(List<Double> values, double baseline) {
        Objects.requireNonNull(values, "values must not be null");
        double eventPeak = BaselineStatistics.median(values);
        if (eventPeak <= baseline) {
            return values.size();
        }

        double range = eventPeak - baseline;
        double weighted = 0.0;
        for (double b : values) {
            double weight = (b - baseline) / range;
            weighted += Math.max(0.0, Math.min(1.0, weight));
        }
        return weighted;
    }
}
