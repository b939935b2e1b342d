package com.shutterprobe.core.speed;

import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.SpeedResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResultsTableFormatter}.
 */
class ResultsTableFormatterTest {

    private final SpeedCalculator calculator = new SpeedCalculator();

    @Test
    @DisplayName("Should list measured speeds without expectation columns")
    void shouldFormatWithoutExpectations() {
        String table = ResultsTableFormatter.format(calculator.calculateAllSpeeds(List.of(event()), 240));

        assertThat(table.lines()).hasSize(3);
        assertThat(table).contains("Event", "Frames", "Weighted", "Measured", "1/80", "3.00");
        assertThat(table).doesNotContain("Expected", "Rating");
    }

    @Test
    @DisplayName("Should add expected, deviation and rating columns")
    void shouldFormatWithExpectations() {
        List<SpeedResult> results = List.of(
                calculator.evaluate(event(), 240, "1/80"),
                calculator.evaluate(event(), 240, "1/100"),
                calculator.evaluate(event(), 240, "soon"));

        String table = ResultsTableFormatter.format(results);

        assertThat(table.lines()).hasSize(5);
        assertThat(table).contains("Expected", "Deviation", "Rating");
        assertThat(table.lines().skip(2)).satisfiesExactly(
                row -> assertThat(row).contains("1/80", "0.0%", "GOOD"),
                row -> assertThat(row).contains("1/100", "-20.0%", "BAD"),
                row -> assertThat(row).contains("soon", "UNKNOWN"));
    }

    @Test
    @DisplayName("Should say so when there are no results")
    void shouldHandleEmptyResults() {
        assertThat(ResultsTableFormatter.format(List.of())).isEqualTo("No shutter events detected");
    }

    private static ShutterEvent event() {
        return ShutterEvent.builder()
                .startFrame(0)
                .endFrame(2)
                .brightnessValues(List.of(100.0, 100.0, 100.0))
                .baselineBrightness(20.0)
                .build();
    }
}
