package com.shutterprobe.flink;

import com.shutterprobe.core.config.AnalysisProfile;
import com.shutterprobe.core.model.BaselineProgress;
import com.shutterprobe.core.model.CalibrationComplete;
import com.shutterprobe.core.model.EventDetected;
import com.shutterprobe.core.model.FrameResult;
import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.SpeedResult;
import com.shutterprobe.core.model.ThresholdModel;
import com.shutterprobe.core.speed.SpeedCalculator;
import com.shutterprobe.core.speed.SpeedFormatter;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns the {@link FrameResult}s of a live session into output messages.
 *
 * <p>
 * Baseline progress is not published. The Nth event of a session is compared
 * with the Nth entry of the profile's expected speeds, when there is one.
 * </p>
 *
 * @since 1.0.0
 */
public class MeasurementAssembler implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double recordingFps;
    private final List<String> expectedSpeeds;

    private transient SpeedCalculator speedCalculator;

    public MeasurementAssembler(AnalysisProfile profile) {
        this(Objects.requireNonNull(profile, "AnalysisProfile must not be null").getRecordingFps(),
                profile.getExpectedSpeeds());
    }

    public MeasurementAssembler(double recordingFps, List<String> expectedSpeeds) {
        if (!(recordingFps > 0)) {
            throw new IllegalArgumentException("recordingFps must be > 0, got: " + recordingFps);
        }
        this.recordingFps = recordingFps;
        this.expectedSpeeds = List.copyOf(Objects.requireNonNull(expectedSpeeds,
                "expectedSpeeds must not be null"));
    }

    /**
     * @param sessionId  session the result belongs to
     * @param result     outcome of one frame
     * @param model      the session's armed threshold; required for events
     * @param eventIndex 1-based position of the event within the session
     * @param timestamp  publication time
     * @return the message to publish, or empty for baseline progress
     * @throws IllegalStateException if an event arrives without a model
     */
    public Optional<ShutterMeasurement> assemble(String sessionId, FrameResult result,
            ThresholdModel model, int eventIndex, Instant timestamp) {
        Objects.requireNonNull(result, "FrameResult must not be null");

        if (result instanceof BaselineProgress) {
            return Optional.empty();
        }
        if (result instanceof CalibrationComplete complete) {
            return Optional.of(base(sessionId, ShutterMeasurement.Type.CALIBRATION_COMPLETE,
                    complete.getModel(), timestamp));
        }
        if (result instanceof EventDetected detected) {
            if (model == null) {
                throw new IllegalStateException(
                        "Event detected for session " + sessionId + " without a threshold model");
            }
            return Optional.of(event(sessionId, detected.getEvent(), model, eventIndex, timestamp));
        }
        throw new IllegalArgumentException("Unsupported frame result: " + result.getClass().getName());
    }

    private ShutterMeasurement event(String sessionId, ShutterEvent event, ThresholdModel model,
            int eventIndex, Instant timestamp) {
        String expected = eventIndex >= 1 && eventIndex <= expectedSpeeds.size()
                ? expectedSpeeds.get(eventIndex - 1)
                : null;
        SpeedResult speed = speedCalculator().evaluate(event, recordingFps, expected);

        ShutterMeasurement m = base(sessionId, ShutterMeasurement.Type.EVENT_DETECTED, model, timestamp);
        m.setEventIndex(eventIndex);
        m.setStartFrame(event.getStartFrame());
        m.setEndFrame(event.getEndFrame());
        m.setDurationFrames(event.getDurationFrames());
        m.setWeightedDurationFrames(event.getWeightedDurationFrames());
        m.setMeasuredSpeed(SpeedFormatter.formatDenominator(speed.getMeasuredSpeedDenominator()));
        m.setMeasuredSpeedDenominator(speed.getMeasuredSpeedDenominator());
        m.setExpectedSpeed(expected);
        m.setDeviationPercent(speed.getDeviationPercent().orElse(null));
        m.setUnterminated(event.isUnterminated());
        return m;
    }

    private static ShutterMeasurement base(String sessionId, ShutterMeasurement.Type type,
            ThresholdModel model, Instant timestamp) {
        ShutterMeasurement m = new ShutterMeasurement();
        m.setSessionId(sessionId);
        m.setType(type);
        m.setTimestamp(timestamp);
        m.setBaseline(model.getBaseline());
        m.setThreshold(model.getThreshold());
        return m;
    }

    private SpeedCalculator speedCalculator() {
        if (speedCalculator == null) {
            speedCalculator = new SpeedCalculator();
        }
        return speedCalculator;
    }
}
