package com.shutterprobe.core.threshold;

import com.shutterprobe.core.model.ThresholdMethod;

import java.util.Objects;

/**
 * Creates {@link ThresholdStrategy} instances for a {@link ThresholdMethod}.
 *
 * <p>
 * This is the single point of extension when adding a threshold method:
 * add the enum constant and map it here.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdStrategyFactory {

    private ThresholdStrategyFactory() {
        // utility class — not instantiable
    }

    /**
     * @param method       the threshold method; must not be {@code null}
     * @param marginFactor margin factor for the percentile-margin method,
     *                     ignored by the others
     * @return a strategy implementing {@code method}
     * @throws NullPointerException     if {@code method} is {@code null}
     * @throws IllegalArgumentException if {@code method} is not selectable
     */
    public static ThresholdStrategy create(ThresholdMethod method, double marginFactor) {
        Objects.requireNonNull(method, "ThresholdMethod must not be null");
        return switch (method) {
            case PERCENTILE_MARGIN -> new PercentileMarginStrategy(marginFactor);
            case ZSCORE -> new ZScoreStrategy();
            case CLUSTERING -> new ClusteringStrategy();
            case LIVE_CALIBRATION -> throw new IllegalArgumentException(
                    "Threshold method '" + method.getConfigName() + "' is set by live calibration only");
        };
    }

    /**
     * Create a strategy from its profile name.
     *
     * @param methodName   profile name such as {@code "zscore"}
     * @param marginFactor margin factor for the percentile-margin method
     * @return a strategy implementing the named method
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ThresholdStrategy create(String methodName, double marginFactor) {
        return create(ThresholdMethod.fromConfigName(methodName), marginFactor);
    }
}
