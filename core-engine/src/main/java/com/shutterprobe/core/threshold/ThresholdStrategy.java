package com.shutterprobe.core.threshold;

import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.model.ThresholdModel;

import java.util.List;

/**
 * Contract for the interchangeable threshold selection methods.
 *
 * <p>
 * Implementations are stateless and may be shared. Every returned model
 * satisfies {@code threshold > baseline}; degenerate inputs are resolved with
 * {@link DegenerateThresholdPolicy} rather than by throwing.
 * </p>
 */
public interface ThresholdStrategy {

    /**
     * Derive a baseline and detection threshold from the given samples.
     *
     * @param samples            brightness samples; must not be {@code null}
     * @param expectedEventCount number of shutter events the caller expects,
     *                           or {@code null} when unknown
     * @return the threshold model
     * @throws MissingParameterException if the method needs
     *                                   {@code expectedEventCount} and it is
     *                                   absent
     */
    ThresholdModel calculate(List<Double> samples, Integer expectedEventCount);

    /**
     * @return the method this strategy implements
     */
    ThresholdMethod getMethod();
}
