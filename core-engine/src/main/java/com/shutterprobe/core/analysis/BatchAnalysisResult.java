package com.shutterprobe.core.analysis;

import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.SpeedResult;
import com.shutterprobe.core.model.ThresholdModel;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one batch analysis run.
 *
 * <p>
 * {@code speedResults} holds one entry per event in detection order;
 * {@code groupedResults} holds the events that had an expected speed, keyed
 * by that speed.
 * </p>
 *
 * @since 1.0.0
 */
public final class BatchAnalysisResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ThresholdModel model;
    private final double recordingFps;
    private final List<ShutterEvent> events;
    private final List<SpeedResult> speedResults;
    private final Map<String, List<SpeedResult>> groupedResults;

    public BatchAnalysisResult(ThresholdModel model, double recordingFps, List<ShutterEvent> events,
            List<SpeedResult> speedResults, Map<String, List<SpeedResult>> groupedResults) {
        this.model = Objects.requireNonNull(model, "ThresholdModel must not be null");
        this.recordingFps = recordingFps;
        this.events = List.copyOf(Objects.requireNonNull(events, "events must not be null"));
        this.speedResults = List.copyOf(Objects.requireNonNull(speedResults, "speedResults must not be null"));
        this.groupedResults = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(groupedResults, "groupedResults must not be null")));
    }

    public ThresholdModel getModel() {
        return model;
    }

    public double getRecordingFps() {
        return recordingFps;
    }

    public List<ShutterEvent> getEvents() {
        return events;
    }

    public List<SpeedResult> getSpeedResults() {
        return speedResults;
    }

    public Map<String, List<SpeedResult>> getGroupedResults() {
        return groupedResults;
    }

    /**
     * @return number of events reported unterminated
     */
    public long getUnterminatedCount() {
        return events.stream().filter(ShutterEvent::isUnterminated).count();
    }

    @Override
    public String toString() {
        return "BatchAnalysisResult{" +
                "threshold=" + model.getThreshold() +
                ", recordingFps=" + recordingFps +
                ", events=" + events.size() +
                ", groups=" + groupedResults.keySet() +
                '}';
    }
}
