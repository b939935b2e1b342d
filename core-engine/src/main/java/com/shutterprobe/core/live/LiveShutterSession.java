package com.shutterprobe.core.live;

import com.shutterprobe.core.calibration.CalibrationController;
import com.shutterprobe.core.config.CalibrationSettings;
import com.shutterprobe.core.detection.LiveEventDetector;
import com.shutterprobe.core.model.BrightnessSample;
import com.shutterprobe.core.model.CalibrationComplete;
import com.shutterprobe.core.model.CalibrationState;
import com.shutterprobe.core.model.EventDetected;
import com.shutterprobe.core.model.FrameResult;
import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.ThresholdModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * One live recording session.
 *
 * <p>
 * Owns one {@link CalibrationController} and, once calibration arms, one
 * {@link LiveEventDetector} built from the frozen threshold. Frames are
 * numbered sequentially from the first frame received after
 * {@link #start()}; the timestamp of that frame is the session's time
 * reference.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * A single thread delivers frames. Other threads may call
 * {@link #snapshot()} at any time: an immutable {@link LiveSessionSnapshot}
 * is published through a volatile field by the constructor, after every frame
 * and every reset, and on Java deserialization. A copy restored by a
 * serializer that skips {@code readObject} (Flink's Kryo fallback) shows the
 * constructor's snapshot until its next frame or reset.
 * </p>
 *
 * <h3>Usage</h3>
 *
 * <pre>
 * LiveShutterSession session = new LiveShutterSession();
 * session.start();
 * for (Frame f : camera) {
 *     session.processFrame(f.brightness(), f.timestampNanos())
 *             .ifPresent(this::handle);
 * }
 * session.finishRecording().ifPresent(this::handle);
 * </pre>
 *
 * @since 1.0.0
 */
public class LiveShutterSession implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(LiveShutterSession.class);

    private final CalibrationController calibration;

    private LiveEventDetector detector;
    private final List<ShutterEvent> events = new ArrayList<>();
    private long framesProcessed;
    private Long firstFrameTimestampNanos;

    private transient volatile LiveSessionSnapshot published;

    public LiveShutterSession() {
        this(new CalibrationSettings());
    }

    /**
     * @param settings calibration tuning; must not be {@code null}
     */
    public LiveShutterSession(CalibrationSettings settings) {
        this.calibration = new CalibrationController(settings);
        publish();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Begin calibration.
     *
     * @return {@code false} when the session was already started
     */
    public boolean start() {
        boolean started = calibration.start();
        publish();
        return started;
    }

    /**
     * Return to {@link CalibrationState#IDLE}, dropping calibration,
     * detector state, detected events and the time reference.
     */
    public void reset() {
        calibration.reset();
        detector = null;
        events.clear();
        framesProcessed = 0;
        firstFrameTimestampNanos = null;
        publish();
        LOG.info("Session reset");
    }

    /**
     * Drop detected events and any in-progress event while keeping the armed
     * threshold and the time reference.
     *
     * @return {@code true} if events were reset, {@code false} when the
     *         session is not armed
     */
    public boolean resetEvents() {
        if (detector == null) {
            LOG.debug("Ignoring resetEvents() in state {}", calibration.getState());
            return false;
        }
        detector.clear();
        events.clear();
        publish();
        LOG.info("Session events reset; threshold {} kept", detector.getModel().getThreshold());
        return true;
    }

    // ---------------------------------------------------------------
    // Frame path
    // ---------------------------------------------------------------

    /**
     * Feed one frame.
     *
     * @param brightness     mean frame brightness
     * @param timestampNanos capture timestamp in nanoseconds
     * @return the outcome of this frame, or empty when nothing happened (or
     *         the session is idle)
     */
    public Optional<FrameResult> processFrame(double brightness, long timestampNanos) {
        if (calibration.getState() == CalibrationState.IDLE) {
            LOG.trace("Frame ignored while idle");
            return Optional.empty();
        }
        if (firstFrameTimestampNanos == null) {
            firstFrameTimestampNanos = timestampNanos;
        }
        long frameIndex = framesProcessed++;

        Optional<FrameResult> result;
        if (detector == null) {
            result = calibration.processFrame(brightness);
            if (result.isPresent() && result.get() instanceof CalibrationComplete complete) {
                detector = new LiveEventDetector(complete.getModel());
                LOG.info("Session armed at frame {}", frameIndex);
            }
        } else {
            result = detector.processFrame(new BrightnessSample(brightness, frameIndex, timestampNanos))
                    .map(this::record);
        }

        publish();
        return result;
    }

    /**
     * Close the recording. An event still open is reported with
     * {@code unterminated = true}.
     *
     * @return the flushed event, or empty when no event was open
     */
    public Optional<FrameResult> finishRecording() {
        if (detector == null) {
            return Optional.empty();
        }
        Optional<FrameResult> result = detector.flush().map(this::record);
        publish();
        return result;
    }

    // ---------------------------------------------------------------
    // Observers
    // ---------------------------------------------------------------

    /**
     * @return the latest published snapshot; never {@code null}
     */
    public LiveSessionSnapshot snapshot() {
        return published;
    }

    public CalibrationState getCalibrationState() {
        return calibration.getState();
    }

    public Optional<ThresholdModel> getModel() {
        return calibration.getModel();
    }

    public long getFramesProcessed() {
        return framesProcessed;
    }

    /**
     * @return timestamp of the first frame since the last reset
     */
    public OptionalLong getFirstFrameTimestampNanos() {
        return firstFrameTimestampNanos == null
                ? OptionalLong.empty()
                : OptionalLong.of(firstFrameTimestampNanos);
    }

    /**
     * @return number of events detected since the last reset
     */
    public int getEventCount() {
        return events.size();
    }

    // ---- Internal ----

    private FrameResult record(ShutterEvent event) {
        events.add(event);
        LOG.debug("Event #{} detected: {}", events.size(), event);
        return new EventDetected(event);
    }

    private void publish() {
        published = new LiveSessionSnapshot(
                calibration.getState(),
                calibration.getProgress(),
                calibration.getModel().orElse(null),
                events,
                detector != null && detector.isEventInProgress(),
                framesProcessed);
    }

    private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
        in.defaultReadObject();
        publish();
    }
}
