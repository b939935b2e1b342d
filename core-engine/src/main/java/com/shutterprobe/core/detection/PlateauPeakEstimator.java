package com.shutterprobe.core.detection;

import com.shutterprobe.core.stats.BaselineStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Estimates the fully-open brightness of a recording from its events.
 *
 * <p>
 * For each event, the plateau is the set of frames at or above
 * {@code plateauFraction} of the event maximum. Events with at least
 * {@code minPlateauFrames} plateau frames contribute their plateau mean; the
 * estimate is the median of those means. Short events that never settle are
 * therefore ignored.
 * </p>
 *
 * <p>
 * If no event qualifies, the 95th percentile of all event brightness values
 * is used instead.
 * </p>
 *
 * @since 1.0.0
 */
public class PlateauPeakEstimator {

    public static final double DEFAULT_PLATEAU_FRACTION = 0.90;
    public static final int DEFAULT_MIN_PLATEAU_FRAMES = 10;

    static final double FALLBACK_PERCENTILE = 95.0;

    private final double plateauFraction;
    private final int minPlateauFrames;

    public PlateauPeakEstimator() {
        this(DEFAULT_PLATEAU_FRACTION, DEFAULT_MIN_PLATEAU_FRAMES);
    }

    /**
     * @param plateauFraction  fraction of the event maximum a frame must reach
     *                         to be on the plateau, in {@code (0, 1]}
     * @param minPlateauFrames plateau frames an event needs to contribute
     * @throws IllegalArgumentException if either argument is out of range
     */
    public PlateauPeakEstimator(double plateauFraction, int minPlateauFrames) {
        if (!(plateauFraction > 0 && plateauFraction <= 1.0)) {
            throw new IllegalArgumentException(
                    "plateauFraction must be in (0, 1], got: " + plateauFraction);
        }
        if (minPlateauFrames < 1) {
            throw new IllegalArgumentException(
                    "minPlateauFrames must be >= 1, got: " + minPlateauFrames);
        }
        this.plateauFraction = plateauFraction;
        this.minPlateauFrames = minPlateauFrames;
    }

    /**
     * @param eventValues brightness values of each event; must not be
     *                    {@code null}
     * @return the peak estimate, or empty when there are no event samples
     */
    public Optional<Double> estimate(List<List<Double>> eventValues) {
        Objects.requireNonNull(eventValues, "eventValues must not be null");

        List<Double> plateauMeans = new ArrayList<>();
        List<Double> all = new ArrayList<>();

        for (List<Double> values : eventValues) {
            if (values.isEmpty()) {
                continue;
            }
            all.addAll(values);

            double cutoff = BaselineStatistics.max(values) * plateauFraction;
            double sum = 0.0;
            int count = 0;
            for (double v : values) {
                if (v >= cutoff) {
                    sum += v;
                    count++;
                }
            }
            if (count >= minPlateauFrames) {
                plateauMeans.add(sum / count);
            }
        }

        if (!plateauMeans.isEmpty()) {
            return Optional.of(BaselineStatistics.median(plateauMeans));
        }
        if (!all.isEmpty()) {
            return Optional.of(BaselineStatistics.percentile(all, FALLBACK_PERCENTILE));
        }
        return Optional.empty();
    }
}
