package com.shutterprobe.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One frame's mean brightness together with its position in the recording.
 *
 * <p>
 * Values are nominally in {@code 0..255} but are not clamped: some capture
 * pipelines report linear luminance above that range.
 * </p>
 *
 * @since 1.0.0
 */
public final class BrightnessSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double value;
    private final long frameIndex;
    private final long timestampNanos;

    /**
     * @param value          mean frame brightness
     * @param frameIndex     zero-based frame index within the recording
     * @param timestampNanos monotonic capture timestamp in nanoseconds
     * @throws IllegalArgumentException if {@code frameIndex} is negative
     */
    public BrightnessSample(double value, long frameIndex, long timestampNanos) {
        if (frameIndex < 0) {
            throw new IllegalArgumentException("frameIndex must be >= 0, got: " + frameIndex);
        }
        this.value = value;
        this.frameIndex = frameIndex;
        this.timestampNanos = timestampNanos;
    }

    public double getValue() {
        return value;
    }

    public long getFrameIndex() {
        return frameIndex;
    }

    public long getTimestampNanos() {
        return timestampNanos;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BrightnessSample that))
            return false;
        return Double.compare(value, that.value) == 0
                && frameIndex == that.frameIndex
                && timestampNanos == that.timestampNanos;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, frameIndex, timestampNanos);
    }

    @Override
    public String toString() {
        return "BrightnessSample{" +
                "value=" + value +
                ", frameIndex=" + frameIndex +
                ", timestampNanos=" + timestampNanos +
                '}';
    }
}
