package com.shutterprobe.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Emitted once when the calibration shutter closes and the threshold is
 * frozen.
 *
 * @since 1.0.0
 */
public final class CalibrationComplete implements FrameResult, Serializable {

    private static final long serialVersionUID = 1L;

    private final ThresholdModel model;

    public CalibrationComplete(ThresholdModel model) {
        this.model = Objects.requireNonNull(model, "ThresholdModel must not be null");
    }

    public ThresholdModel getModel() {
        return model;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CalibrationComplete that))
            return false;
        return model.equals(that.model);
    }

    @Override
    public int hashCode() {
        return model.hashCode();
    }

    @Override
    public String toString() {
        return "CalibrationComplete{model=" + model + '}';
    }
}
