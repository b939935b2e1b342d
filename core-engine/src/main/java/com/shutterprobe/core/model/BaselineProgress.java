package com.shutterprobe.core.model;

import java.io.Serializable;

/**
 * Baseline collection progress, emitted once per dark frame while
 * calibrating.
 *
 * @since 1.0.0
 */
public final class BaselineProgress implements FrameResult, Serializable {

    private static final long serialVersionUID = 1L;

    private final double fraction;

    /**
     * @param fraction collected frames over required frames, in {@code [0, 1]}
     * @throws IllegalArgumentException if {@code fraction} is out of range
     */
    public BaselineProgress(double fraction) {
        if (!(fraction >= 0.0 && fraction <= 1.0)) {
            throw new IllegalArgumentException("fraction must be in [0, 1], got: " + fraction);
        }
        this.fraction = fraction;
    }

    public double getFraction() {
        return fraction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineProgress that))
            return false;
        return Double.compare(fraction, that.fraction) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(fraction);
    }

    @Override
    public String toString() {
        return "BaselineProgress{fraction=" + fraction + '}';
    }
}
