package com.shutterprobe.core.speed;

import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.SpeedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts event durations into shutter speeds and compares them with the
 * speeds the shutter was set to.
 *
 * <h3>Units</h3>
 * <p>
 * Speeds are expressed as denominators: {@code 500.0} means 1/500 s. Expected
 * speeds are given in photographic notation ({@code "1/500"}, or {@code "2"}
 * for two seconds) and converted with {@link #parseExpectedSpeed(String)}.
 * </p>
 *
 * <h3>Deviation</h3>
 * <p>
 * {@code (measured - expected) / expected * 100} on denominators, so a
 * shutter that is faster than marked gives a positive deviation.
 * </p>
 *
 * <h3>Grouping</h3>
 * <p>
 * Events are matched to expected speeds by position: the Nth detected event
 * is the Nth shot fired. Events fired out of order will be compared with the
 * wrong setting.
 * </p>
 *
 * @since 1.0.0
 */
public class SpeedCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(SpeedCalculator.class);

    // ---------------------------------------------------------------
    // Conversion
    // ---------------------------------------------------------------

    /**
     * @param durationFrames frame count, possibly fractional
     * @param fps            recording frame rate; must be positive
     * @return speed denominator, e.g. {@code 80.0} for 3 frames at 240 fps
     * @throws IllegalArgumentException if either argument is not positive
     */
    public static double calculateShutterSpeed(double durationFrames, double fps) {
        requirePositive(fps, "fps");
        requirePositive(durationFrames, "durationFrames");
        double durationSeconds = durationFrames / fps;
        return 1.0 / durationSeconds;
    }

    /**
     * Speed of one event using its weighted duration.
     *
     * @param event the event; must not be {@code null}
     * @param fps   recording frame rate
     * @return speed denominator
     */
    public double calculateShutterSpeed(ShutterEvent event, double fps) {
        return calculateShutterSpeed(event, fps, true);
    }

    /**
     * @param event       the event; must not be {@code null}
     * @param fps         recording frame rate
     * @param useWeighted use the weighted duration instead of the plain frame
     *                    count
     * @return speed denominator
     */
    public double calculateShutterSpeed(ShutterEvent event, double fps, boolean useWeighted) {
        Objects.requireNonNull(event, "ShutterEvent must not be null");
        double frames = useWeighted ? event.getWeightedDurationFrames() : event.getDurationFrames();
        return calculateShutterSpeed(frames, fps);
    }

    /**
     * Real-time duration of a frame range.
     *
     * <p>
     * For slow-motion footage {@code fps} is the playback rate of the file and
     * {@code recordingFps} the rate the sensor captured at.
     * </p>
     *
     * @param startFrame   first frame, inclusive
     * @param endFrame     last frame, inclusive
     * @param fps          frame rate of the saved footage
     * @param recordingFps capture frame rate, or {@code null} when equal to
     *                     {@code fps}
     * @return duration in seconds
     * @throws IllegalArgumentException if {@code endFrame < startFrame} or a
     *                                  rate is not positive
     */
    public double calculateDurationSeconds(long startFrame, long endFrame, double fps,
            Double recordingFps) {
        if (endFrame < startFrame) {
            throw new IllegalArgumentException(
                    "endFrame (" + endFrame + ") must be >= startFrame (" + startFrame + ")");
        }
        requirePositive(fps, "fps");
        long frameCount = endFrame - startFrame + 1;
        if (recordingFps == null) {
            return frameCount / fps;
        }
        requirePositive(recordingFps, "recordingFps");
        double timeScale = fps / recordingFps;
        return (frameCount / fps) * timeScale;
    }

    // ---------------------------------------------------------------
    // Expected speeds
    // ---------------------------------------------------------------

    /**
     * Parse photographic speed notation into seconds.
     *
     * <ul>
     * <li>{@code "1/500"} → {@code 0.002}</li>
     * <li>{@code "2"} or {@code "0.5"} → whole seconds</li>
     * </ul>
     *
     * @param notation the notation, may be {@code null}
     * @return duration in seconds, or empty when the notation is unparseable,
     *         zero or negative
     */
    public static Optional<Double> parseExpectedSpeed(String notation) {
        if (notation == null || notation.isBlank()) {
            return Optional.empty();
        }
        String trimmed = notation.trim();
        double seconds;
        try {
            int slash = trimmed.indexOf('/');
            if (slash >= 0) {
                double numerator = Double.parseDouble(trimmed.substring(0, slash).trim());
                double denominator = Double.parseDouble(trimmed.substring(slash + 1).trim());
                seconds = numerator / denominator;
            } else {
                seconds = Double.parseDouble(trimmed);
            }
        } catch (NumberFormatException e) {
            LOG.warn("Unparseable expected speed '{}'", notation);
            return Optional.empty();
        }
        if (!(seconds > 0) || Double.isInfinite(seconds)) {
            LOG.warn("Expected speed '{}' is not a positive duration", notation);
            return Optional.empty();
        }
        return Optional.of(seconds);
    }

    /**
     * @param measuredDenominator measured speed as {@code 1/x}
     * @param expectedDenominator expected speed as {@code 1/x}; must not be
     *                            zero
     * @return percentage deviation, positive when the measured shutter is
     *         faster
     */
    public double compareWithExpected(double measuredDenominator, double expectedDenominator) {
        if (expectedDenominator == 0.0) {
            throw new IllegalArgumentException("expectedDenominator must not be zero");
        }
        return (measuredDenominator - expectedDenominator) / expectedDenominator * 100.0;
    }

    // ---------------------------------------------------------------
    // Results
    // ---------------------------------------------------------------

    /**
     * Measure one event and compare it with an expected speed.
     *
     * @param event         the event; must not be {@code null}
     * @param fps           recording frame rate
     * @param expectedSpeed expected speed notation, may be {@code null}
     * @return the result; deviation is absent when {@code expectedSpeed} is
     *         absent or unparseable
     */
    public SpeedResult evaluate(ShutterEvent event, double fps, String expectedSpeed) {
        double measured = calculateShutterSpeed(event, fps);
        Double deviation = null;
        if (expectedSpeed != null) {
            Optional<Double> expectedSeconds = parseExpectedSpeed(expectedSpeed);
            if (expectedSeconds.isPresent()) {
                deviation = compareWithExpected(measured, 1.0 / expectedSeconds.get());
            }
        }
        return new SpeedResult(event, measured, expectedSpeed, deviation);
    }

    /**
     * Pair events with expected speeds by detection order.
     *
     * <p>
     * Both lists are truncated to the shorter one. A setting that appears more
     * than once collects all of its events under one key.
     * </p>
     *
     * @param events         events in detection order; must not be {@code null}
     * @param expectedSpeeds expected speeds in shot order; must not be
     *                       {@code null}
     * @param fps            recording frame rate
     * @return results keyed by expected speed, in first-seen order
     */
    public Map<String, List<SpeedResult>> groupByExpectedSpeeds(List<ShutterEvent> events,
            List<String> expectedSpeeds, double fps) {
        Objects.requireNonNull(events, "events must not be null");
        Objects.requireNonNull(expectedSpeeds, "expectedSpeeds must not be null");

        int pairs = Math.min(events.size(), expectedSpeeds.size());
        if (events.size() != expectedSpeeds.size()) {
            LOG.warn("{} event(s) but {} expected speed(s) – comparing the first {}",
                    events.size(), expectedSpeeds.size(), pairs);
        }

        Map<String, List<SpeedResult>> groups = new LinkedHashMap<>();
        for (int i = 0; i < pairs; i++) {
            String expected = expectedSpeeds.get(i);
            groups.computeIfAbsent(expected, k -> new ArrayList<>())
                    .add(evaluate(events.get(i), fps, expected));
        }
        return groups;
    }

    /**
     * @param events events to measure; must not be {@code null}
     * @param fps    recording frame rate
     * @return one result per event, without expectations
     */
    public List<SpeedResult> calculateAllSpeeds(List<ShutterEvent> events, double fps) {
        Objects.requireNonNull(events, "events must not be null");
        List<SpeedResult> results = new ArrayList<>(events.size());
        for (ShutterEvent event : events) {
            results.add(evaluate(event, fps, null));
        }
        return Collections.unmodifiableList(results);
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
    }
}
