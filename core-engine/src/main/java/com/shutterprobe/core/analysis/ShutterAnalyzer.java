package com.shutterprobe.core.analysis;

import com.shutterprobe.core.config.AnalysisProfile;
import com.shutterprobe.core.config.ThresholdSettings;
import com.shutterprobe.core.detection.BatchEventFinder;
import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.SpeedResult;
import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.model.ThresholdModel;
import com.shutterprobe.core.speed.SpeedCalculator;
import com.shutterprobe.core.threshold.ThresholdCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Batch-mode entry point: re-analyzes a fully recorded brightness series.
 *
 * <ol>
 * <li>Threshold over the whole series with the selected method</li>
 * <li>Event boundaries via {@link BatchEventFinder}</li>
 * <li>Weighted duration and speed per event via {@link SpeedCalculator}</li>
 * </ol>
 *
 * <p>
 * Stateless between calls; one instance may analyze any number of series,
 * from any number of threads.
 * </p>
 *
 * @since 1.0.0
 */
public class ShutterAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ShutterAnalyzer.class);

    private final ThresholdCalculator thresholdCalculator;
    private final BatchEventFinder eventFinder;
    private final SpeedCalculator speedCalculator;

    public ShutterAnalyzer() {
        this(new ThresholdCalculator(), new BatchEventFinder(), new SpeedCalculator());
    }

    public ShutterAnalyzer(ThresholdCalculator thresholdCalculator, BatchEventFinder eventFinder,
            SpeedCalculator speedCalculator) {
        this.thresholdCalculator = Objects.requireNonNull(thresholdCalculator,
                "thresholdCalculator must not be null");
        this.eventFinder = Objects.requireNonNull(eventFinder, "eventFinder must not be null");
        this.speedCalculator = Objects.requireNonNull(speedCalculator,
                "speedCalculator must not be null");
    }

    /**
     * Detect shutter events in a recorded series.
     *
     * @param series             brightness per frame; must not be {@code null}
     * @param recordingFps       capture frame rate; must be positive
     * @param method             threshold method; must not be {@code null}
     * @param expectedEventCount number of shots fired, required for
     *                           {@link ThresholdMethod#ZSCORE}
     * @return events in frame order
     * @throws com.shutterprobe.core.threshold.MissingParameterException if the
     *         method needs {@code expectedEventCount} and it is absent
     */
    public List<ShutterEvent> analyze(List<Double> series, double recordingFps,
            ThresholdMethod method, Integer expectedEventCount) {
        return analyzeSeries(series, recordingFps, method, expectedEventCount, List.of()).getEvents();
    }

    /**
     * Detect events and measure their speeds.
     *
     * @param series             brightness per frame; must not be {@code null}
     * @param recordingFps       capture frame rate; must be positive
     * @param method             threshold method; must not be {@code null}
     * @param expectedEventCount number of shots fired, may be {@code null}
     *                           unless the method needs it
     * @param expectedSpeeds     speeds in shot order; must not be {@code null}
     * @return threshold, events and per-event speed results
     */
    public BatchAnalysisResult analyzeSeries(List<Double> series, double recordingFps,
            ThresholdMethod method, Integer expectedEventCount, List<String> expectedSpeeds) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(method, "ThresholdMethod must not be null");
        Objects.requireNonNull(expectedSpeeds, "expectedSpeeds must not be null");
        if (!(recordingFps > 0)) {
            throw new IllegalArgumentException("recordingFps must be > 0, got: " + recordingFps);
        }

        ThresholdModel model = thresholdCalculator.calculate(series, method, expectedEventCount);
        List<ShutterEvent> events = eventFinder.find(series, model);

        List<SpeedResult> speedResults = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            String expected = i < expectedSpeeds.size() ? expectedSpeeds.get(i) : null;
            speedResults.add(speedCalculator.evaluate(events.get(i), recordingFps, expected));
        }
        Map<String, List<SpeedResult>> grouped =
                speedCalculator.groupByExpectedSpeeds(events, expectedSpeeds, recordingFps);

        LOG.info("Analyzed {} frame(s) at {} fps: {} event(s) above threshold {}",
                series.size(), recordingFps, events.size(), model.getThreshold());
        return new BatchAnalysisResult(model, recordingFps, events, speedResults, grouped);
    }

    /**
     * Analyze with the frame rate, threshold method and expected speeds of a
     * profile.
     *
     * @param series  brightness per frame; must not be {@code null}
     * @param profile validated profile; must not be {@code null}
     * @return threshold, events and per-event speed results
     */
    public BatchAnalysisResult analyze(List<Double> series, AnalysisProfile profile) {
        Objects.requireNonNull(profile, "AnalysisProfile must not be null");
        ThresholdSettings settings = profile.getThreshold();
        ShutterAnalyzer analyzer = settings.getMarginFactor() == thresholdCalculator.getMarginFactor()
                ? this
                : new ShutterAnalyzer(new ThresholdCalculator(settings.getMarginFactor()),
                        eventFinder, speedCalculator);
        return analyzer.analyzeSeries(series, profile.getRecordingFps(), settings.resolveMethod(),
                settings.getExpectedEventCount(), profile.getExpectedSpeeds());
    }
}
