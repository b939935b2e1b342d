package com.shutterprobe.core.speed;

import java.util.Locale;

/**
 * Photographic notation for speed denominators.
 *
 * @since 1.0.0
 */
public final class SpeedFormatter {

    private SpeedFormatter() {
        // utility class — not instantiable
    }

    /**
     * @param denominator speed as {@code 1/x}; must be positive
     * @return {@code "1/500"} for fractions of a second, {@code "2.0s"} for
     *         slower speeds
     * @throws IllegalArgumentException if {@code denominator} is not positive
     */
    public static String formatDenominator(double denominator) {
        if (!(denominator > 0)) {
            throw new IllegalArgumentException("denominator must be > 0, got: " + denominator);
        }
        if (denominator >= 1.0) {
            return "1/" + Math.round(denominator);
        }
        return String.format(Locale.ROOT, "%.1fs", 1.0 / denominator);
    }

    /**
     * @param deviationPercent deviation, may be {@code null}
     * @return signed percentage with one decimal, or {@code "-"}
     */
    public static String formatDeviation(Double deviationPercent) {
        if (deviationPercent == null) {
            return "-";
        }
        return String.format(Locale.ROOT, "%+.1f%%", deviationPercent);
    }
}
