package com.shutterprobe.flink;

import com.shutterprobe.core.config.CalibrationSettings;
import com.shutterprobe.core.live.LiveShutterSession;
import com.shutterprobe.core.model.CalibrationState;
import com.shutterprobe.core.model.EventDetected;
import com.shutterprobe.core.model.FrameResult;
import com.shutterprobe.core.model.ShutterEvent;
import org.apache.flink.api.common.ExecutionConfig;
import org.apache.flink.api.common.typeutils.TypeSerializer;
import org.apache.flink.core.memory.DataInputDeserializer;
import org.apache.flink.core.memory.DataOutputSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Checks that the keyed session state survives Flink's own serializer, as it
 * does on checkpoint and restore.
 */
class LiveShutterSessionStateSerializationTest {

    private TypeSerializer<LiveShutterSession> serializer;
    private LiveShutterSession armed;
    private long frame;

    @BeforeEach
    void setUp() {
        serializer = ShutterSessionProcessFunction.SESSION_TYPE.createSerializer(new ExecutionConfig());

        CalibrationSettings settings = new CalibrationSettings();
        settings.setBaselineFrames(10);
        armed = new LiveShutterSession(settings);
        armed.start();
        frame = 0;

        for (int i = 0; i < 10; i++) {
            feed(armed, 20.0);
        }
        feed(armed, 200.0);
        feed(armed, 250.0);
        feed(armed, 220.0);
        feed(armed, 20.0);
        feed(armed, 250.0);
        feed(armed, 250.0);
        feed(armed, 250.0);
        feed(armed, 20.0);
    }

    @Test
    @DisplayName("An armed session with one event survives serialize and deserialize")
    void shouldRoundTripArmedSession() throws IOException {
        assertThat(armed.getEventCount()).isEqualTo(1);

        DataOutputSerializer out = new DataOutputSerializer(256);
        serializer.serialize(armed, out);
        LiveShutterSession restored = serializer.deserialize(new DataInputDeserializer(out.getCopyOfBuffer()));

        assertRestored(restored);
    }

    @Test
    @DisplayName("An armed session with one event survives a serializer copy")
    void shouldCopyArmedSession() {
        LiveShutterSession copy = serializer.copy(armed);

        assertThat(copy).isNotSameAs(armed);
        assertRestored(copy);
        assertThat(armed.getEventCount()).isEqualTo(1);
    }

    private void assertRestored(LiveShutterSession restored) {
        assertThat(restored.getCalibrationState()).isEqualTo(CalibrationState.ARMED);
        assertThat(restored.getEventCount()).isEqualTo(1);
        assertThat(restored.getFramesProcessed()).isEqualTo(18);
        assertThat(restored.getModel()).hasValueSatisfying(
                m -> assertThat(m.getThreshold()).isCloseTo(204.0, within(1e-9)));

        feed(restored, 250.0);
        Optional<FrameResult> result = feed(restored, 20.0);

        assertThat(result).hasValueSatisfying(r -> assertThat(r).isInstanceOf(EventDetected.class));
        ShutterEvent event = ((EventDetected) result.get()).getEvent();
        assertThat(event.getStartFrame()).isEqualTo(18);
        assertThat(event.getBrightnessValues()).containsExactly(250.0);
        assertThat(restored.getEventCount()).isEqualTo(2);
        assertThat(restored.snapshot().getEvents()).hasSize(2);
    }

    private Optional<FrameResult> feed(LiveShutterSession session, double brightness) {
        return session.processFrame(brightness, frame++ * 4_166_667L);
    }
}
