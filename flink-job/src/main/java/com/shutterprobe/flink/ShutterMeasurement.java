package com.shutterprobe.flink;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;

/**
 * One message of the output topic.
 *
 * <p>
 * {@link Type#CALIBRATION_COMPLETE} carries the frozen baseline and
 * threshold; {@link Type#EVENT_DETECTED} additionally carries the event
 * boundaries and its measured speed. Absent fields are omitted from the JSON.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ShutterMeasurement implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Kind of measurement. */
    public enum Type {
        CALIBRATION_COMPLETE,
        EVENT_DETECTED
    }

    private String sessionId;
    private Type type;
    private Instant timestamp;
    private double baseline;
    private double threshold;

    // ---- EVENT_DETECTED only ----
    private Integer eventIndex;
    private Long startFrame;
    private Long endFrame;
    private Long durationFrames;
    private Double weightedDurationFrames;
    private String measuredSpeed;
    private Double measuredSpeedDenominator;
    private String expectedSpeed;
    private Double deviationPercent;
    private Boolean unterminated;

    public ShutterMeasurement() {
        // for Jackson
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getBaseline() {
        return baseline;
    }

    public void setBaseline(double baseline) {
        this.baseline = baseline;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    /**
     * @return 1-based position of the event within its session
     */
    public Integer getEventIndex() {
        return eventIndex;
    }

    public void setEventIndex(Integer eventIndex) {
        this.eventIndex = eventIndex;
    }

    public Long getStartFrame() {
        return startFrame;
    }

    public void setStartFrame(Long startFrame) {
        this.startFrame = startFrame;
    }

    public Long getEndFrame() {
        return endFrame;
    }

    public void setEndFrame(Long endFrame) {
        this.endFrame = endFrame;
    }

    public Long getDurationFrames() {
        return durationFrames;
    }

    public void setDurationFrames(Long durationFrames) {
        this.durationFrames = durationFrames;
    }

    public Double getWeightedDurationFrames() {
        return weightedDurationFrames;
    }

    public void setWeightedDurationFrames(Double weightedDurationFrames) {
        this.weightedDurationFrames = weightedDurationFrames;
    }

    /**
     * @return measured speed in photographic notation, e.g. {@code "1/500"}
     */
    public String getMeasuredSpeed() {
        return measuredSpeed;
    }

    public void setMeasuredSpeed(String measuredSpeed) {
        this.measuredSpeed = measuredSpeed;
    }

    public Double getMeasuredSpeedDenominator() {
        return measuredSpeedDenominator;
    }

    public void setMeasuredSpeedDenominator(Double measuredSpeedDenominator) {
        this.measuredSpeedDenominator = measuredSpeedDenominator;
    }

    public String getExpectedSpeed() {
        return expectedSpeed;
    }

    public void setExpectedSpeed(String expectedSpeed) {
        this.expectedSpeed = expectedSpeed;
    }

    public Double getDeviationPercent() {
        return deviationPercent;
    }

    public void setDeviationPercent(Double deviationPercent) {
        this.deviationPercent = deviationPercent;
    }

    public Boolean getUnterminated() {
        return unterminated;
    }

    public void setUnterminated(Boolean unterminated) {
        this.unterminated = unterminated;
    }

    @Override
    public String toString() {
        return "ShutterMeasurement{" +
                "sessionId='" + sessionId + '\'' +
                ", type=" + type +
                ", threshold=" + threshold +
                ", eventIndex=" + eventIndex +
                ", frames=" + startFrame + ".." + endFrame +
                ", measuredSpeed='" + measuredSpeed + '\'' +
                ", expectedSpeed='" + expectedSpeed + '\'' +
                ", deviationPercent=" + deviationPercent +
                '}';
    }
}
