package com.shutterprobe.core.detection;

import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.model.ThresholdModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link BatchEventFinder}.
 */
class BatchEventFinderTest {

    private static final ThresholdModel MODEL = ThresholdModel.builder()
            .method(ThresholdMethod.PERCENTILE_MARGIN)
            .baseline(20.0)
            .threshold(100.0)
            .build();

    private final BatchEventFinder finder = new BatchEventFinder();

    @Test
    @DisplayName("Should recover synthetic (start, end) pairs exactly")
    void shouldRecoverSyntheticBoundaries() {
        int[][] pairs = { { 5, 7 }, { 20, 20 }, { 31, 58 }, { 60, 61 }, { 90, 98 } };
        List<Double> series = series(100, pairs);

        List<ShutterEvent> events = finder.find(series, MODEL);

        assertThat(events)
                .extracting(ShutterEvent::getStartFrame, ShutterEvent::getEndFrame, ShutterEvent::isUnterminated)
                .containsExactly(
                        tuple(5L, 7L, false),
                        tuple(20L, 20L, false),
                        tuple(31L, 58L, false),
                        tuple(60L, 61L, false),
                        tuple(90L, 98L, false));
        assertThat(events.get(2).getDurationFrames()).isEqualTo(28);
        assertThat(events.get(2).getBrightnessValues()).hasSize(28).containsOnly(180.0);
    }

    @Test
    @DisplayName("A run still open at the end of the series is emitted as unterminated")
    void shouldEmitTrailingRun() {
        List<Double> series = series(30, new int[][] { { 4, 6 }, { 25, 29 } });

        List<ShutterEvent> events = finder.find(series, MODEL);

        assertThat(events).hasSize(2);
        ShutterEvent last = events.get(1);
        assertThat(last.getStartFrame()).isEqualTo(25);
        assertThat(last.getEndFrame()).isEqualTo(29);
        assertThat(last.isUnterminated()).isTrue();
        assertThat(last.getBrightnessValues()).hasSize(5);
        assertThat(events.get(0).isUnterminated()).isFalse();
    }

    @Test
    @DisplayName("A frame exactly at the threshold is closed")
    void shouldUseStrictComparison() {
        List<Double> series = List.of(20.0, 100.0, 100.0, 100.1, 20.0);

        List<ShutterEvent> events = finder.find(series, MODEL);

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.getStartFrame()).isEqualTo(3);
            assertThat(e.getEndFrame()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("Events carry the model baseline and peak")
    void shouldCarryModelPeak() {
        ThresholdModel withPeak = ThresholdModel.builder()
                .method(ThresholdMethod.CLUSTERING)
                .baseline(20.0)
                .threshold(100.0)
                .peak(175.0)
                .build();

        List<ShutterEvent> events = finder.find(series(20, new int[][] { { 2, 4 } }), withPeak);

        assertThat(events.get(0).getBaselineBrightness()).isEqualTo(20.0);
        assertThat(events.get(0).getPeakBrightness()).contains(175.0);
    }

    @Test
    @DisplayName("Without a model peak, events carry the plateau estimate")
    void shouldEstimatePeakWhenModelHasNone() {
        List<ShutterEvent> events = finder.find(series(40, new int[][] { { 2, 13 }, { 20, 22 } }), MODEL);

        assertThat(events).allSatisfy(e -> assertThat(e.getPeakBrightness()).contains(180.0));
    }

    @Test
    @DisplayName("Should return no events for an all-dark series")
    void shouldReturnEmptyForDarkSeries() {
        assertThat(finder.find(Collections.nCopies(50, 20.0), MODEL)).isEmpty();
        assertThat(finder.find(List.of(), MODEL)).isEmpty();
    }

    @Test
    @DisplayName("countEvents counts runs including a trailing one")
    void shouldCountRuns() {
        List<Double> series = series(30, new int[][] { { 1, 3 }, { 10, 10 }, { 27, 29 } });

        assertThat(BatchEventFinder.countEvents(series, 100.0)).isEqualTo(3);
        assertThat(BatchEventFinder.countEvents(series, 180.0)).isZero();
    }

    private static List<Double> series(int length, int[][] pairs) {
        List<Double> values = new ArrayList<>(Collections.nCopies(length, 20.0));
        for (int[] pair : pairs) {
            for (int i = pair[0]; i <= pair[1]; i++) {
                values.set(i, 180.0);
            }
        }
        return values;
    }
}
