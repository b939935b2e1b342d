package com.shutterprobe.core.detection;

import com.shutterprobe.core.model.BrightnessSample;
import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.ThresholdModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-frame event detection against a frozen threshold.
 *
 * <p>
 * Two sub-states: {@link Phase#WAITING_FOR_EVENT} and
 * {@link Phase#EVENT_IN_PROGRESS}. A frame above the threshold opens an event
 * and is its first sample; the first frame at or below the threshold closes
 * it with {@code endFrame} set to the previous frame.
 * </p>
 *
 * <p>
 * There is no timeout: slow speeds such as one second at 240 fps must not be
 * truncated, so an open event waits for the brightness to drop.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. One frame producer drives one instance.
 * </p>
 *
 * @since 1.0.0
 */
public class LiveEventDetector implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(LiveEventDetector.class);

    /** Detector sub-state. */
    public enum Phase {
        WAITING_FOR_EVENT,
        EVENT_IN_PROGRESS
    }

    private final ThresholdModel model;

    private Phase phase = Phase.WAITING_FOR_EVENT;
    private long startFrame;
    private long lastFrame;
    private final List<Double> values = new ArrayList<>();

    /**
     * @param model the frozen calibration result; must not be {@code null}
     */
    public LiveEventDetector(ThresholdModel model) {
        this.model = Objects.requireNonNull(model, "ThresholdModel must not be null");
    }

    /**
     * Classify one frame.
     *
     * @param sample the frame; must not be {@code null}
     * @return the completed event when this frame closed one, empty otherwise
     */
    public Optional<ShutterEvent> processFrame(BrightnessSample sample) {
        Objects.requireNonNull(sample, "BrightnessSample must not be null");
        boolean open = model.isOpen(sample.getValue());

        switch (phase) {
            case WAITING_FOR_EVENT -> {
                if (open) {
                    phase = Phase.EVENT_IN_PROGRESS;
                    startFrame = sample.getFrameIndex();
                    lastFrame = sample.getFrameIndex();
                    values.add(sample.getValue());
                    LOG.trace("Event started at frame {} (brightness={})",
                            startFrame, sample.getValue());
                }
                return Optional.empty();
            }
            case EVENT_IN_PROGRESS -> {
                if (open) {
                    lastFrame = sample.getFrameIndex();
                    values.add(sample.getValue());
                    return Optional.empty();
                }
                ShutterEvent event = buildEvent(false);
                LOG.debug("Event detected: frames {}..{} ({} samples)",
                        event.getStartFrame(), event.getEndFrame(), event.getBrightnessValues().size());
                clear();
                return Optional.of(event);
            }
            default -> throw new IllegalStateException("Unknown detector phase: " + phase);
        }
    }

    /**
     * Close an event left open when the recording stops.
     *
     * @return the in-progress event flagged unterminated, or empty when no
     *         event was open
     */
    public Optional<ShutterEvent> flush() {
        if (phase != Phase.EVENT_IN_PROGRESS) {
            return Optional.empty();
        }
        ShutterEvent event = buildEvent(true);
        LOG.debug("Recording stopped mid-event – reporting frames {}..{} as unterminated",
                event.getStartFrame(), event.getEndFrame());
        clear();
        return Optional.of(event);
    }

    /**
     * Drop any in-progress event and return to waiting. The threshold is kept.
     */
    public void clear() {
        phase = Phase.WAITING_FOR_EVENT;
        values.clear();
        startFrame = 0;
        lastFrame = 0;
    }

    public Phase getPhase() {
        return phase;
    }

    public boolean isEventInProgress() {
        return phase == Phase.EVENT_IN_PROGRESS;
    }

    public ThresholdModel getModel() {
        return model;
    }

    private ShutterEvent buildEvent(boolean unterminated) {
        return ShutterEvent.builder()
                .startFrame(startFrame)
                .endFrame(lastFrame)
                .brightnessValues(values)
                .baselineBrightness(model.getBaseline())
                .peakBrightness(model.getPeak().orElse(null))
                .unterminated(unterminated)
                .build();
    }
}
