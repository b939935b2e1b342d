package com.shutterprobe.flink;

import com.shutterprobe.core.config.AnalysisProfile;
import com.shutterprobe.core.live.LiveShutterSession;
import com.shutterprobe.core.model.FrameResult;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Core Flink {@link KeyedProcessFunction} that runs one live shutter
 * measurement session per recording session id.
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code ValueState<LiveShutterSession>} holds the calibration controller,
 * the armed detector and the detected events of each key. Flink serializes it
 * with its Kryo fallback, which rebuilds the plain {@code ArrayList}s the
 * session holds, so a restored job resumes mid-calibration or mid-event.
 * </p>
 *
 * <h3>Control Messages</h3>
 * <ul>
 * <li>{@code reset} – drop everything and calibrate again</li>
 * <li>{@code reset-events} – drop events, keep the threshold</li>
 * <li>{@code finish} – publish an event still open as unterminated</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ShutterSessionProcessFunction
        extends KeyedProcessFunction<String, BrightnessFrame, ShutterMeasurement> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ShutterSessionProcessFunction.class);

    /** Type of the keyed session state; not a POJO, so Flink serializes it with Kryo. */
    static final TypeInformation<LiveShutterSession> SESSION_TYPE = TypeInformation.of(LiveShutterSession.class);

    private final AnalysisProfile profile;
    private final MeasurementAssembler assembler;

    /** Flink keyed state holding the per-session measurement state. */
    private transient ValueState<LiveShutterSession> sessionState;

    private transient ShutterMetrics metrics;

    /**
     * @param profile validated analysis profile; must not be {@code null}
     */
    public ShutterSessionProcessFunction(AnalysisProfile profile) {
        this.profile = Objects.requireNonNull(profile, "AnalysisProfile must not be null");
        this.assembler = new MeasurementAssembler(profile);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        ValueStateDescriptor<LiveShutterSession> descriptor =
                new ValueStateDescriptor<>("shutter-session", SESSION_TYPE);
        sessionState = getRuntimeContext().getState(descriptor);

        metrics = new ShutterMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("ShutterSessionProcessFunction opened with profile '{}'", profile.getName());
    }

    @Override
    public void close() {
        LOG.info("ShutterSessionProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(BrightnessFrame frame,
            KeyedProcessFunction<String, BrightnessFrame, ShutterMeasurement>.Context ctx,
            Collector<ShutterMeasurement> out) throws Exception {
        long startNanos = System.nanoTime();

        // Lazily create and start the session on the first message of a key
        LiveShutterSession session = sessionState.value();
        if (session == null) {
            session = newSession();
        }

        List<ShutterMeasurement> measurements = apply(session, frame, ctx.getCurrentKey(), Instant.now());
        for (ShutterMeasurement measurement : measurements) {
            out.collect(measurement);
            if (measurement.getType() == ShutterMeasurement.Type.CALIBRATION_COMPLETE) {
                metrics.incrementCalibrationsCompleted();
            } else {
                metrics.incrementShutterEvents();
            }
        }

        sessionState.update(session);

        if (frame.resolveControl().isEmpty()) {
            metrics.incrementFramesProcessed();
        }
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    /**
     * @return a session configured from the profile, already calibrating
     */
    LiveShutterSession newSession() {
        LiveShutterSession session = new LiveShutterSession(profile.getCalibration());
        session.start();
        return session;
    }

    /**
     * Feed one message to a session.
     *
     * @param session   the key's session
     * @param frame     a frame or control message
     * @param sessionId key of the session
     * @param now       publication time for any measurement
     * @return measurements to publish, possibly empty
     */
    List<ShutterMeasurement> apply(LiveShutterSession session, BrightnessFrame frame,
            String sessionId, Instant now) {
        Optional<BrightnessFrame.Control> control = frame.resolveControl();
        if (control.isPresent()) {
            return applyControl(session, control.get(), sessionId, now);
        }
        if (frame.getBrightness() == null) {
            LOG.warn("Frame without brightness for session {} – skipping", sessionId);
            return List.of();
        }

        Optional<FrameResult> result;
        try {
            result = session.processFrame(frame.getBrightness(), frame.getTimestampNanos());
        } catch (RuntimeException e) {
            LOG.error("Session {} failed on frame {} – skipping frame", sessionId, frame, e);
            return List.of();
        }
        return toMeasurements(session, result, sessionId, now);
    }

    private List<ShutterMeasurement> applyControl(LiveShutterSession session,
            BrightnessFrame.Control control, String sessionId, Instant now) {
        switch (control) {
            case RESET -> {
                session.reset();
                session.start();
                LOG.info("Session {} reset; calibration restarted", sessionId);
                return List.of();
            }
            case RESET_EVENTS -> {
                if (!session.resetEvents()) {
                    LOG.info("Session {} is not armed – reset-events ignored", sessionId);
                }
                return List.of();
            }
            case FINISH -> {
                return toMeasurements(session, session.finishRecording(), sessionId, now);
            }
            default -> throw new IllegalArgumentException("Unsupported control: " + control);
        }
    }

    private List<ShutterMeasurement> toMeasurements(LiveShutterSession session,
            Optional<FrameResult> result, String sessionId, Instant now) {
        List<ShutterMeasurement> measurements = new ArrayList<>(1);
        result.flatMap(r -> assembler.assemble(sessionId, r, session.getModel().orElse(null),
                        session.getEventCount(), now))
                .ifPresent(m -> {
                    measurements.add(m);
                    LOG.debug("Publishing {}", m);
                });
        return measurements;
    }
}
