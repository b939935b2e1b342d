package com.shutterprobe.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ShutterEvent}.
 */
class ShutterEventTest {

    @Test
    @DisplayName("Duration counts both end frames")
    void shouldCountInclusiveDuration() {
        ShutterEvent event = ShutterEvent.builder().startFrame(10).endFrame(21).build();

        assertThat(event.getDurationFrames()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should reject endFrame < startFrame")
    void shouldRejectInvertedBounds() {
        assertThatThrownBy(() -> ShutterEvent.builder().startFrame(5).endFrame(4).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("endFrame");
    }

    @Test
    @DisplayName("Brightness list is an unmodifiable copy")
    void shouldCopyBrightnessValues() {
        List<Double> values = new ArrayList<>(List.of(100.0, 120.0));
        ShutterEvent event = ShutterEvent.builder().startFrame(0).endFrame(1).brightnessValues(values).build();

        values.add(999.0);

        assertThat(event.getBrightnessValues()).containsExactly(100.0, 120.0);
        assertThatThrownBy(() -> event.getBrightnessValues().add(1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Max and average come from the brightness samples")
    void shouldDeriveMaxAndAverage() {
        ShutterEvent event = ShutterEvent.builder()
                .startFrame(0)
                .endFrame(2)
                .brightnessValues(List.of(-3.0, -1.0, -2.0))
                .build();

        assertThat(event.getMaxBrightness()).isEqualTo(-1.0);
        assertThat(event.getAverageBrightness()).isEqualTo(-2.0);
        assertThat(ShutterEvent.builder().build().getMaxBrightness()).isZero();
    }
}
