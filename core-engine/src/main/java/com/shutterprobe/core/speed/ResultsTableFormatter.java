package com.shutterprobe.core.speed;

import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.SpeedResult;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Plain-text results table.
 *
 * <pre>
 * Event  Frames  Weighted  Measured  Expected  Deviation  Rating
 * -----  ------  --------  --------  --------  ---------  ------
 *     1       3      2.80    1/86      1/100     -14.3%   POOR
 * </pre>
 *
 * <p>
 * The expectation columns appear only when at least one result has an
 * expected speed.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResultsTableFormatter {

    private static final String BASE_HEADER = String.format(Locale.ROOT,
            "%-5s  %6s  %8s  %-8s", "Event", "Frames", "Weighted", "Measured");
    private static final String BASE_RULE = "-----  ------  --------  --------";
    private static final String EXPECTED_HEADER = String.format(Locale.ROOT,
            "  %-8s  %9s  %-7s", "Expected", "Deviation", "Rating");
    private static final String EXPECTED_RULE = "  --------  ---------  -------";

    private ResultsTableFormatter() {
        // utility class — not instantiable
    }

    /**
     * @param results results in display order; must not be {@code null}
     * @return the table, one line per result, or a single line when empty
     */
    public static String format(List<SpeedResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        if (results.isEmpty()) {
            return "No shutter events detected";
        }

        boolean withExpected = results.stream().anyMatch(r -> r.getExpectedSpeed().isPresent());

        StringBuilder sb = new StringBuilder();
        sb.append(BASE_HEADER);
        if (withExpected) {
            sb.append(EXPECTED_HEADER);
        }
        sb.append('\n').append(BASE_RULE);
        if (withExpected) {
            sb.append(EXPECTED_RULE);
        }

        for (int i = 0; i < results.size(); i++) {
            SpeedResult result = results.get(i);
            sb.append('\n').append(formatRow(i + 1, result));
            if (withExpected) {
                sb.append(String.format(Locale.ROOT, "  %-8s  %9s  %-7s",
                        result.getExpectedSpeed().orElse("-"),
                        SpeedFormatter.formatDeviation(result.getDeviationPercent().orElse(null)),
                        DeviationRating.of(result.getDeviationPercent().orElse(null))));
            }
        }
        return sb.toString();
    }

    private static String formatRow(int number, SpeedResult result) {
        String frames = result.getEvent()
                .map(ShutterEvent::getDurationFrames)
                .map(String::valueOf)
                .orElse("-");
        String weighted = result.getEvent()
                .map(e -> String.format(Locale.ROOT, "%.2f", e.getWeightedDurationFrames()))
                .orElse("-");
        return String.format(Locale.ROOT, "%5d  %6s  %8s  %-8s",
                number, frames, weighted,
                SpeedFormatter.formatDenominator(result.getMeasuredSpeedDenominator()));
    }
}
