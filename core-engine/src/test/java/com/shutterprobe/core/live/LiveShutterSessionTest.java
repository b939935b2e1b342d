package com.shutterprobe.core.live;

import com.shutterprobe.core.config.CalibrationSettings;
import com.shutterprobe.core.model.BaselineProgress;
import com.shutterprobe.core.model.CalibrationComplete;
import com.shutterprobe.core.model.CalibrationState;
import com.shutterprobe.core.model.EventDetected;
import com.shutterprobe.core.model.FrameResult;
import com.shutterprobe.core.model.ShutterEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link LiveShutterSession}.
 */
class LiveShutterSessionTest {

    private static final long FRAME_NANOS = 4_166_667L;

    private LiveShutterSession session;
    private long clock;

    @BeforeEach
    void setUp() {
        CalibrationSettings settings = new CalibrationSettings();
        settings.setBaselineFrames(10);
        session = new LiveShutterSession(settings);
        clock = 1_000_000_000L;
    }

    @Test
    @DisplayName("Calibration event is consumed and never reported as a detection")
    void shouldExcludeCalibrationEvent() {
        session.start();
        List<FrameResult> results = calibrate();

        assertThat(results).hasSize(11);
        assertThat(results.subList(0, 10)).allMatch(r -> r instanceof BaselineProgress);
        assertThat(results.get(10)).isInstanceOf(CalibrationComplete.class);
        assertThat(session.getCalibrationState()).isEqualTo(CalibrationState.ARMED);
        assertThat(session.snapshot().getEvents()).isEmpty();

        // frames 14..15 dark, 16..18 open, 19 closes
        feed(20.0);
        feed(20.0);
        feed(250.0);
        feed(250.0);
        feed(250.0);
        Optional<FrameResult> result = feed(20.0);

        assertThat(result).hasValueSatisfying(r -> assertThat(r).isInstanceOf(EventDetected.class));
        ShutterEvent event = ((EventDetected) result.get()).getEvent();
        assertThat(event.getStartFrame()).isEqualTo(16);
        assertThat(event.getEndFrame()).isEqualTo(18);
        assertThat(event.getBaselineBrightness()).isEqualTo(20.0);

        LiveSessionSnapshot snapshot = session.snapshot();
        assertThat(snapshot.getEvents()).containsExactly(event);
        assertThat(snapshot.getFramesProcessed()).isEqualTo(20);
        assertThat(snapshot.isArmed()).isTrue();
        assertThat(snapshot.getModel()).hasValueSatisfying(
                m -> assertThat(m.getThreshold()).isCloseTo(204.0, within(1e-9)));
    }

    @Test
    @DisplayName("Frames are ignored until the session is started")
    void shouldIgnoreFramesBeforeStart() {
        assertThat(feed(20.0)).isEmpty();
        assertThat(session.getFramesProcessed()).isZero();
        assertThat(session.getFirstFrameTimestampNanos()).isEmpty();
    }

    @Test
    @DisplayName("First frame after start is the time reference")
    void shouldRecordFirstTimestamp() {
        session.start();
        long first = clock;
        feed(20.0);
        feed(20.0);

        assertThat(session.getFirstFrameTimestampNanos()).hasValue(first);
    }

    @Test
    @DisplayName("resetEvents() keeps the threshold and clears detections")
    void shouldResetEventsOnly() {
        session.start();
        calibrate();
        feed(250.0);
        feed(20.0);
        feed(250.0);
        assertThat(session.getEventCount()).isEqualTo(1);
        assertThat(session.snapshot().isEventInProgress()).isTrue();

        assertThat(session.resetEvents()).isTrue();

        LiveSessionSnapshot snapshot = session.snapshot();
        assertThat(snapshot.getEvents()).isEmpty();
        assertThat(snapshot.isEventInProgress()).isFalse();
        assertThat(snapshot.getCalibrationState()).isEqualTo(CalibrationState.ARMED);
        assertThat(session.getFirstFrameTimestampNanos()).isPresent();

        feed(250.0);
        Optional<FrameResult> result = feed(20.0);
        assertThat(result).hasValueSatisfying(r -> assertThat(((EventDetected) r).getEvent().getStartFrame())
                .isEqualTo(17));
    }

    @Test
    @DisplayName("resetEvents() is a no-op before calibration arms")
    void shouldIgnoreResetEventsWhileCalibrating() {
        session.start();
        feed(20.0);

        assertThat(session.resetEvents()).isFalse();
        assertThat(session.getCalibrationState()).isEqualTo(CalibrationState.COLLECTING_BASELINE);
    }

    @Test
    @DisplayName("reset() returns to IDLE and forgets everything")
    void shouldResetFully() {
        session.start();
        calibrate();
        feed(250.0);
        feed(20.0);

        session.reset();

        LiveSessionSnapshot snapshot = session.snapshot();
        assertThat(snapshot.getCalibrationState()).isEqualTo(CalibrationState.IDLE);
        assertThat(snapshot.getEvents()).isEmpty();
        assertThat(snapshot.getModel()).isEmpty();
        assertThat(snapshot.getFramesProcessed()).isZero();
        assertThat(session.getFirstFrameTimestampNanos()).isEmpty();
        assertThat(session.start()).isTrue();
    }

    @Test
    @DisplayName("finishRecording() reports an open event as unterminated")
    void shouldFlushOnFinish() {
        session.start();
        calibrate();
        feed(250.0);
        feed(250.0);

        Optional<FrameResult> result = session.finishRecording();

        assertThat(result).hasValueSatisfying(r -> assertThat(((EventDetected) r).getEvent().isUnterminated())
                .isTrue());
        assertThat(session.snapshot().getEvents()).hasSize(1);
        assertThat(session.finishRecording()).isEmpty();
    }

    @Test
    @DisplayName("Snapshots are immutable and readable from another thread")
    void shouldPublishSnapshotsToObservers() throws InterruptedException {
        session.start();
        calibrate();
        feed(250.0);
        feed(20.0);
        LiveSessionSnapshot before = session.snapshot();

        AtomicReference<LiveSessionSnapshot> seen = new AtomicReference<>();
        Thread observer = new Thread(() -> seen.set(session.snapshot()));
        observer.start();
        observer.join();

        assertThat(seen.get().getEvents()).hasSize(1);

        feed(250.0);
        feed(20.0);
        assertThat(before.getEvents()).hasSize(1);
        assertThat(session.snapshot().getEvents()).hasSize(2);
    }

    @Test
    @DisplayName("A deserialized session publishes its restored state before any frame")
    void shouldPublishSnapshotAfterDeserialization() throws Exception {
        session.start();
        calibrate();
        feed(250.0);
        feed(20.0);

        LiveShutterSession restored = roundTrip(session);

        AtomicReference<LiveSessionSnapshot> seen = new AtomicReference<>();
        Thread observer = new Thread(() -> seen.set(restored.snapshot()));
        observer.start();
        observer.join();

        assertThat(seen.get()).isNotNull();
        assertThat(seen.get().isArmed()).isTrue();
        assertThat(seen.get().getEvents()).hasSize(1);
        assertThat(seen.get().getFramesProcessed()).isEqualTo(16);

        restored.processFrame(250.0, clock);
        restored.processFrame(20.0, clock + FRAME_NANOS);
        assertThat(restored.snapshot().getEvents()).hasSize(2);
        assertThat(session.snapshot().getEvents()).hasSize(1);
    }

    private static LiveShutterSession roundTrip(LiveShutterSession original)
            throws IOException, ClassNotFoundException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(original);
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            return (LiveShutterSession) in.readObject();
        }
    }

    private List<FrameResult> calibrate() {
        List<FrameResult> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            feed(20.0).ifPresent(results::add);
        }
        for (double b : new double[] { 200.0, 250.0, 220.0, 20.0 }) {
            feed(b).ifPresent(results::add);
        }
        return results;
    }

    private Optional<FrameResult> feed(double brightness) {
        Optional<FrameResult> result = session.processFrame(brightness, clock);
        clock += FRAME_NANOS;
        return result;
    }
}
