package com.shutterprobe.flink;

import com.shutterprobe.core.model.BaselineProgress;
import com.shutterprobe.core.model.CalibrationComplete;
import com.shutterprobe.core.model.EventDetected;
import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.model.ThresholdModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MeasurementAssembler}.
 */
class MeasurementAssemblerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

    private final ThresholdModel model = ThresholdModel.builder()
            .method(ThresholdMethod.PERCENTILE_MARGIN)
            .baseline(20.0)
            .threshold(204.0)
            .peak(250.0)
            .build();

    private final MeasurementAssembler assembler = new MeasurementAssembler(240.0, List.of("1/100", "1/60"));

    @Test
    @DisplayName("Baseline progress is not published")
    void shouldSkipProgress() {
        assertThat(assembler.assemble("s", new BaselineProgress(0.5), null, 0, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Calibration complete carries baseline and threshold")
    void shouldAssembleCalibration() {
        Optional<ShutterMeasurement> m = assembler.assemble("s", new CalibrationComplete(model), null, 0, NOW);

        assertThat(m).hasValueSatisfying(c -> {
            assertThat(c.getType()).isEqualTo(ShutterMeasurement.Type.CALIBRATION_COMPLETE);
            assertThat(c.getSessionId()).isEqualTo("s");
            assertThat(c.getTimestamp()).isEqualTo(NOW);
            assertThat(c.getBaseline()).isEqualTo(20.0);
            assertThat(c.getThreshold()).isEqualTo(204.0);
            assertThat(c.getEventIndex()).isNull();
        });
    }

    @Test
    @DisplayName("First event is compared with the first expected speed")
    void shouldAssembleEventWithExpectation() {
        ShutterMeasurement m = assembler.assemble("s", new EventDetected(event(15, 17, false)), model, 1, NOW)
                .orElseThrow();

        assertThat(m.getType()).isEqualTo(ShutterMeasurement.Type.EVENT_DETECTED);
        assertThat(m.getEventIndex()).isEqualTo(1);
        assertThat(m.getStartFrame()).isEqualTo(15L);
        assertThat(m.getEndFrame()).isEqualTo(17L);
        assertThat(m.getDurationFrames()).isEqualTo(3L);
        assertThat(m.getWeightedDurationFrames()).isCloseTo(3.0, within(1e-9));
        assertThat(m.getMeasuredSpeed()).isEqualTo("1/80");
        assertThat(m.getMeasuredSpeedDenominator()).isCloseTo(80.0, within(1e-9));
        assertThat(m.getExpectedSpeed()).isEqualTo("1/100");
        assertThat(m.getDeviationPercent()).isCloseTo(-20.0, within(1e-6));
        assertThat(m.getThreshold()).isEqualTo(204.0);
        assertThat(m.getUnterminated()).isFalse();
    }

    @Test
    @DisplayName("Events past the expected list have no expectation")
    void shouldLeaveExpectationEmptyPastList() {
        ShutterMeasurement m = assembler.assemble("s", new EventDetected(event(40, 42, true)), model, 3, NOW)
                .orElseThrow();

        assertThat(m.getExpectedSpeed()).isNull();
        assertThat(m.getDeviationPercent()).isNull();
        assertThat(m.getUnterminated()).isTrue();
    }

    @Test
    @DisplayName("An event without a threshold model is rejected")
    void shouldRejectEventWithoutModel() {
        assertThatThrownBy(() -> assembler.assemble("s", new EventDetected(event(1, 2, false)), null, 1, NOW))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Non-positive fps is rejected")
    void shouldRejectNonPositiveFps() {
        assertThatThrownBy(() -> new MeasurementAssembler(0.0, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ShutterEvent event(long start, long end, boolean unterminated) {
        return ShutterEvent.builder()
                .startFrame(start)
                .endFrame(end)
                .brightnessValues(List.of(250.0, 250.0, 250.0))
                .baselineBrightness(20.0)
                .peakBrightness(250.0)
                .unterminated(unterminated)
                .build();
    }
}
