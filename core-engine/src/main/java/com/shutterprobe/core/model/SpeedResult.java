package com.shutterprobe.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Measured shutter speed of one event, optionally compared with the speed
 * the shutter was set to.
 *
 * <p>
 * {@code measuredSpeedDenominator} is the {@code x} of {@code 1/x} seconds,
 * so {@code 500.0} means 1/500 s. {@code deviationPercent} is absent when no
 * expectation was given or the expected speed could not be parsed.
 * </p>
 *
 * @since 1.0.0
 */
public final class SpeedResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ShutterEvent event;
    private final double measuredSpeedDenominator;
    private final String expectedSpeed;
    private final Double deviationPercent;

    /**
     * @param event                    the measured event, may be {@code null}
     *                                 when the result was computed from a bare
     *                                 frame count
     * @param measuredSpeedDenominator measured speed as {@code 1/x}
     * @param expectedSpeed            expected speed notation, may be
     *                                 {@code null}
     * @param deviationPercent         deviation from the expected speed, may be
     *                                 {@code null}
     */
    public SpeedResult(ShutterEvent event, double measuredSpeedDenominator,
            String expectedSpeed, Double deviationPercent) {
        this.event = event;
        this.measuredSpeedDenominator = measuredSpeedDenominator;
        this.expectedSpeed = expectedSpeed;
        this.deviationPercent = deviationPercent;
    }

    public Optional<ShutterEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    public double getMeasuredSpeedDenominator() {
        return measuredSpeedDenominator;
    }

    public Optional<String> getExpectedSpeed() {
        return Optional.ofNullable(expectedSpeed);
    }

    public Optional<Double> getDeviationPercent() {
        return Optional.ofNullable(deviationPercent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SpeedResult that))
            return false;
        return Double.compare(measuredSpeedDenominator, that.measuredSpeedDenominator) == 0
                && Objects.equals(event, that.event)
                && Objects.equals(expectedSpeed, that.expectedSpeed)
                && Objects.equals(deviationPercent, that.deviationPercent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, measuredSpeedDenominator, expectedSpeed, deviationPercent);
    }

    @Override
    public String toString() {
        return "SpeedResult{" +
                "measuredSpeedDenominator=" + measuredSpeedDenominator +
                ", expectedSpeed='" + expectedSpeed + '\'' +
                ", deviationPercent=" + deviationPercent +
                '}';
    }
}
