package com.shutterprobe.core.speed;

/**
 * Coarse quality grade of a measured speed.
 *
 * @since 1.0.0
 */
public enum DeviationRating {

    /** Under 5 %. */
    GOOD,
    /** Under 10 %. */
    FAIR,
    /** Under 15 %. */
    POOR,
    BAD,
    /** No expected speed to compare with. */
    UNKNOWN;

    /**
     * @param deviationPercent signed deviation, may be {@code null}
     * @return the rating of {@code |deviationPercent|}
     */
    public static DeviationRating of(Double deviationPercent) {
        if (deviationPercent == null || deviationPercent.isNaN()) {
            return UNKNOWN;
        }
        double abs = Math.abs(deviationPercent);
        if (abs < 5.0) {
            return GOOD;
        }
        if (abs < 10.0) {
            return FAIR;
        }
        if (abs < 15.0) {
            return POOR;
        }
        return BAD;
    }
}
