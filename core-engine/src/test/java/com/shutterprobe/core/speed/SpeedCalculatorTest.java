package com.shutterprobe.core.speed;

import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.SpeedResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SpeedCalculator}.
 */
class SpeedCalculatorTest {

    private final SpeedCalculator calculator = new SpeedCalculator();

    @Test
    @DisplayName("3 frames at 240 fps is 1/80")
    void shouldConvertFramesToSpeed() {
        assertThat(SpeedCalculator.calculateShutterSpeed(3, 240)).isCloseTo(80.0, within(1e-9));
        assertThat(SpeedCalculator.calculateShutterSpeed(4, 240)).isCloseTo(60.0, within(1e-9));
    }

    @Test
    @DisplayName("Should reject non-positive frame rates and durations")
    void shouldRejectNonPositiveInputs() {
        assertThatThrownBy(() -> SpeedCalculator.calculateShutterSpeed(3, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fps");
        assertThatThrownBy(() -> SpeedCalculator.calculateShutterSpeed(0, 240))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("durationFrames");
    }

    @Test
    @DisplayName("Weighted duration gives a faster speed than the plain frame count")
    void shouldUseWeightedDurationByDefault() {
        ShutterEvent event = event(0, List.of(60.0, 100.0, 100.0, 100.0, 40.0));

        double weighted = calculator.calculateShutterSpeed(event, 240);
        double plain = calculator.calculateShutterSpeed(event, 240, false);

        // 3.75 weighted frames vs 5 frames
        assertThat(weighted).isCloseTo(64.0, within(1e-9));
        assertThat(plain).isCloseTo(48.0, within(1e-9));
    }

    @Test
    @DisplayName("Slow-motion footage is converted back to real time")
    void shouldHandleSlowMotion() {
        assertThat(calculator.calculateDurationSeconds(0, 239, 240.0, null)).isCloseTo(1.0, within(1e-9));
        assertThat(calculator.calculateDurationSeconds(0, 239, 30.0, 240.0)).isCloseTo(1.0, within(1e-9));
        assertThatThrownBy(() -> calculator.calculateDurationSeconds(5, 4, 240.0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should parse fraction and whole-second notation")
    void shouldParseExpectedSpeeds() {
        assertThat(SpeedCalculator.parseExpectedSpeed("1/500"))
                .hasValueSatisfying(s -> assertThat(s).isCloseTo(0.002, within(1e-12)));
        assertThat(SpeedCalculator.parseExpectedSpeed(" 1 / 60 "))
                .hasValueSatisfying(s -> assertThat(s).isCloseTo(1.0 / 60, within(1e-12)));
        assertThat(SpeedCalculator.parseExpectedSpeed("2")).contains(2.0);
        assertThat(SpeedCalculator.parseExpectedSpeed("0.5")).contains(0.5);
    }

    @Test
    @DisplayName("Unparseable, zero and negative notations are empty")
    void shouldRejectBadNotation() {
        assertThat(SpeedCalculator.parseExpectedSpeed("fast")).isEmpty();
        assertThat(SpeedCalculator.parseExpectedSpeed("1/0")).isEmpty();
        assertThat(SpeedCalculator.parseExpectedSpeed("0")).isEmpty();
        assertThat(SpeedCalculator.parseExpectedSpeed("-1/250")).isEmpty();
        assertThat(SpeedCalculator.parseExpectedSpeed("")).isEmpty();
        assertThat(SpeedCalculator.parseExpectedSpeed(null)).isEmpty();
    }

    @Test
    @DisplayName("Measured 1/55 against 1/60 is -8.33%")
    void shouldComputeDeviation() {
        assertThat(calculator.compareWithExpected(55.0, 60.0)).isCloseTo(-8.333, within(0.001));
        assertThat(calculator.compareWithExpected(70.0, 60.0)).isPositive();
    }

    @Test
    @DisplayName("An unparseable expectation keeps the string and leaves deviation unknown")
    void shouldKeepUnparseableExpectation() {
        SpeedResult result = calculator.evaluate(event(0, List.of(100.0, 100.0, 100.0)), 240, "1/abc");

        assertThat(result.getMeasuredSpeedDenominator()).isCloseTo(80.0, within(1e-9));
        assertThat(result.getExpectedSpeed()).contains("1/abc");
        assertThat(result.getDeviationPercent()).isEmpty();
    }

    @Test
    @DisplayName("Should compare against the expected denominator")
    void shouldEvaluateAgainstExpected() {
        SpeedResult result = calculator.evaluate(event(0, List.of(100.0, 100.0, 100.0)), 240, "1/100");

        assertThat(result.getDeviationPercent()).hasValueSatisfying(
                d -> assertThat(d).isCloseTo(-20.0, within(1e-9)));
        assertThat(result.getEvent()).isPresent();
    }

    @Test
    @DisplayName("Grouping is positional, truncated and keyed in first-seen order")
    void shouldGroupPositionally() {
        ShutterEvent fast = event(0, Collections.nCopies(3, 100.0));
        ShutterEvent slow = event(10, Collections.nCopies(6, 100.0));
        ShutterEvent again = event(30, Collections.nCopies(3, 100.0));

        Map<String, List<SpeedResult>> groups = calculator.groupByExpectedSpeeds(
                List.of(fast, slow, again), List.of("1/80", "1/40", "1/80", "1/20"), 240);

        assertThat(groups).containsOnlyKeys("1/80", "1/40");
        assertThat(groups.keySet()).containsExactly("1/80", "1/40");
        assertThat(groups.get("1/80")).extracting(r -> r.getEvent().orElseThrow())
                .containsExactly(fast, again);
        assertThat(groups.get("1/40")).singleElement().satisfies(r -> assertThat(r.getDeviationPercent())
                .hasValueSatisfying(d -> assertThat(d).isCloseTo(0.0, within(1e-9))));

        Map<String, List<SpeedResult>> truncated = calculator.groupByExpectedSpeeds(
                List.of(fast, slow, again), List.of("1/80"), 240);
        assertThat(truncated.get("1/80")).hasSize(1);
    }

    @Test
    @DisplayName("calculateAllSpeeds reports every event without expectations")
    void shouldCalculateAllSpeeds() {
        List<SpeedResult> results = calculator.calculateAllSpeeds(
                List.of(event(0, Collections.nCopies(3, 100.0)), event(10, Collections.nCopies(6, 100.0))), 240);

        assertThat(results).hasSize(2);
        assertThat(results).allSatisfy(r -> {
            assertThat(r.getExpectedSpeed()).isEmpty();
            assertThat(r.getDeviationPercent()).isEmpty();
        });
        assertThat(results.get(1).getMeasuredSpeedDenominator()).isCloseTo(40.0, within(1e-9));
    }

    private static ShutterEvent event(long start, List<Double> values) {
        return ShutterEvent.builder()
                .startFrame(start)
                .endFrame(start + values.size() - 1)
                .brightnessValues(values)
                .baselineBrightness(20.0)
                .build();
    }
}
