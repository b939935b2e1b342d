package com.shutterprobe.core.threshold;

import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.model.ThresholdModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThresholdCalculator} and {@link ThresholdStrategyFactory}.
 */
class ThresholdCalculatorTest {

    private static final List<Double> SAMPLES =
            List.of(10.0, 10.0, 10.0, 10.0, 20.0, 20.0, 20.0, 100.0, 100.0);

    @Test
    @DisplayName("Default method is percentile-margin")
    void shouldDefaultToPercentileMargin() {
        ThresholdModel model = new ThresholdCalculator().calculate(SAMPLES);

        assertThat(model.getMethod()).isEqualTo(ThresholdMethod.PERCENTILE_MARGIN);
        assertThat(model.getThreshold()).isEqualTo(25.0);
    }

    @Test
    @DisplayName("Should dispatch to the selected method")
    void shouldDispatchToSelectedMethod() {
        ThresholdCalculator calculator = new ThresholdCalculator();

        assertThat(calculator.calculate(SAMPLES, ThresholdMethod.CLUSTERING, 2).getMethod())
                .isEqualTo(ThresholdMethod.CLUSTERING);
        assertThat(calculator.calculate(SAMPLES, ThresholdMethod.ZSCORE, 2).getMethod())
                .isEqualTo(ThresholdMethod.ZSCORE);
    }

    @Test
    @DisplayName("Every method keeps the threshold above baseline")
    void shouldKeepThresholdAboveBaselineForAllMethods() {
        ThresholdCalculator calculator = new ThresholdCalculator();
        List<List<Double>> inputs = List.of(List.of(), List.of(5.0), List.of(7.0, 7.0, 7.0), SAMPLES);

        for (ThresholdMethod method : ThresholdMethod.values()) {
            if (!method.isSelectable()) {
                continue;
            }
            for (List<Double> input : inputs) {
                ThresholdModel model = calculator.calculate(input, method, 1);
                assertThat(model.getThreshold())
                        .as("%s over %s", method, input)
                        .isGreaterThan(model.getBaseline());
            }
        }
    }

    @Test
    @DisplayName("Factory should resolve methods by profile name")
    void shouldCreateStrategyByName() {
        assertThat(ThresholdStrategyFactory.create("zscore", 1.5)).isInstanceOf(ZScoreStrategy.class);
        assertThat(ThresholdStrategyFactory.create("CLUSTERING", 1.5)).isInstanceOf(ClusteringStrategy.class);
        assertThat(ThresholdStrategyFactory.create("percentile_margin", 2.0))
                .isInstanceOfSatisfying(PercentileMarginStrategy.class,
                        s -> assertThat(s.getMarginFactor()).isEqualTo(2.0));
    }

    @Test
    @DisplayName("Factory should reject unknown method names")
    void shouldRejectUnknownMethod() {
        assertThatThrownBy(() -> ThresholdStrategyFactory.create("dbscan", 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dbscan");
    }

    @Test
    @DisplayName("Factory should refuse the live calibration label")
    void shouldRejectLiveCalibrationMethod() {
        assertThatThrownBy(() -> ThresholdStrategyFactory.create(ThresholdMethod.LIVE_CALIBRATION, 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("live-calibration");
    }
}
