package com.shutterprobe.core.config;

import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.threshold.PercentileMarginStrategy;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch threshold selection.
 *
 * <pre>
 * threshold:
 *   method: zscore
 *   marginFactor: 1.5
 *   expectedEventCount: 10
 * </pre>
 *
 * @since 1.0.0
 */
public class ThresholdSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Config name of a {@link ThresholdMethod}. */
    private String method = ThresholdMethod.PERCENTILE_MARGIN.getConfigName();

    private double marginFactor = PercentileMarginStrategy.DEFAULT_MARGIN_FACTOR;

    /** Required for {@code zscore} and {@code clustering}, ignored otherwise. */
    private Integer expectedEventCount;

    void collectErrors(List<String> errors) {
        ThresholdMethod resolved = null;
        try {
            resolved = ThresholdMethod.fromConfigName(method);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (!(marginFactor > 0)) {
            errors.add("threshold 'marginFactor' must be > 0, got: " + marginFactor);
        }
        if (resolved != null && resolved.requiresExpectedEventCount()
                && (expectedEventCount == null || expectedEventCount <= 0)) {
            errors.add("threshold 'expectedEventCount' must be a positive integer for method '"
                    + resolved.getConfigName() + "'");
        }
    }

    /**
     * @throws IllegalStateException if any field is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ThresholdSettings: " + String.join("; ", errors));
        }
    }

    /**
     * @return the configured method
     * @throws IllegalArgumentException if the method name is unknown
     */
    public ThresholdMethod resolveMethod() {
        return ThresholdMethod.fromConfigName(method);
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public double getMarginFactor() {
        return marginFactor;
    }

    public void setMarginFactor(double marginFactor) {
        this.marginFactor = marginFactor;
    }

    public Integer getExpectedEventCount() {
        return expectedEventCount;
    }

    public void setExpectedEventCount(Integer expectedEventCount) {
        this.expectedEventCount = expectedEventCount;
    }

    @Override
    public String toString() {
        return "ThresholdSettings{method='" + method + '\'' +
                ", marginFactor=" + marginFactor +
                ", expectedEventCount=" + expectedEventCount +
                '}';
    }
}
