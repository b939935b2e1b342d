package com.shutterprobe.core.live;

import com.shutterprobe.core.model.CalibrationState;
import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.ThresholdModel;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of a {@link LiveShutterSession}, safe to hand to observer
 * threads.
 *
 * @since 1.0.0
 */
public final class LiveSessionSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final CalibrationState calibrationState;
    private final double calibrationProgress;
    private final ThresholdModel model;
    private final List<ShutterEvent> events;
    private final boolean eventInProgress;
    private final long framesProcessed;

    /**
     * @param calibrationState    current calibration state
     * @param calibrationProgress baseline progress in {@code [0, 1]}
     * @param model               frozen threshold model, {@code null} until
     *                            armed
     * @param events              detected events; the list is copied
     * @param eventInProgress     whether the detector is inside an event
     * @param framesProcessed     frames consumed since the last reset
     */
    public LiveSessionSnapshot(CalibrationState calibrationState, double calibrationProgress,
            ThresholdModel model, List<ShutterEvent> events, boolean eventInProgress,
            long framesProcessed) {
        this.calibrationState = Objects.requireNonNull(calibrationState,
                "calibrationState must not be null");
        this.calibrationProgress = calibrationProgress;
        this.model = model;
        this.events = List.copyOf(Objects.requireNonNull(events, "events must not be null"));
        this.eventInProgress = eventInProgress;
        this.framesProcessed = framesProcessed;
    }

    public CalibrationState getCalibrationState() {
        return calibrationState;
    }

    public double getCalibrationProgress() {
        return calibrationProgress;
    }

    public Optional<ThresholdModel> getModel() {
        return Optional.ofNullable(model);
    }

    /**
     * @return unmodifiable list of detected events, in detection order
     */
    public List<ShutterEvent> getEvents() {
        return events;
    }

    public boolean isEventInProgress() {
        return eventInProgress;
    }

    public long getFramesProcessed() {
        return framesProcessed;
    }

    public boolean isArmed() {
        return calibrationState == CalibrationState.ARMED;
    }

    @Override
    public String toString() {
        return "LiveSessionSnapshot{" +
                "calibrationState=" + calibrationState +
                ", calibrationProgress=" + calibrationProgress +
                ", threshold=" + (model != null ? model.getThreshold() : null) +
                ", events=" + events.size() +
                ", eventInProgress=" + eventInProgress +
                ", framesProcessed=" + framesProcessed +
                '}';
    }
}
