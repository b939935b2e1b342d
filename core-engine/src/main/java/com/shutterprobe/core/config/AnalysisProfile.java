package com.shutterprobe.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for the analysis profile YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * name: default
 * recordingFps: 240
 * threshold:
 *   method: percentile-margin
 *   marginFactor: 1.5
 * calibration:
 *   baselineFrames: 60
 *   peakFraction: 0.8
 * expectedSpeeds: ["1/1000", "1/500", "1/250"]
 * </pre>
 *
 * <p>
 * Missing sections fall back to their defaults. Call {@link #validate()}
 * after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_RECORDING_FPS = 240.0;

    private String name = "default";
    private double recordingFps = DEFAULT_RECORDING_FPS;
    private ThresholdSettings threshold = new ThresholdSettings();
    private CalibrationSettings calibration = new CalibrationSettings();
    private List<String> expectedSpeeds = new ArrayList<>();

    /**
     * Validate every section and collect all errors into one exception.
     *
     * @throws IllegalStateException if the profile is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("'name' is required");
        }
        if (!(recordingFps > 0)) {
            errors.add("'recordingFps' must be > 0, got: " + recordingFps);
        }
        threshold.collectErrors(errors);
        calibration.collectErrors(errors);
        for (int i = 0; i < expectedSpeeds.size(); i++) {
            String speed = expectedSpeeds.get(i);
            if (speed == null || speed.isBlank()) {
                errors.add("'expectedSpeeds' entry " + i + " is blank");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analysis profile '" + name + "' validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getRecordingFps() {
        return recordingFps;
    }

    public void setRecordingFps(double recordingFps) {
        this.recordingFps = recordingFps;
    }

    public ThresholdSettings getThreshold() {
        return threshold;
    }

    public void setThreshold(ThresholdSettings threshold) {
        this.threshold = threshold != null ? threshold : new ThresholdSettings();
    }

    public CalibrationSettings getCalibration() {
        return calibration;
    }

    public void setCalibration(CalibrationSettings calibration) {
        this.calibration = calibration != null ? calibration : new CalibrationSettings();
    }

    /**
     * @return unmodifiable list of expected speeds, in shot order
     */
    public List<String> getExpectedSpeeds() {
        return Collections.unmodifiableList(expectedSpeeds);
    }

    public void setExpectedSpeeds(List<String> expectedSpeeds) {
        this.expectedSpeeds = expectedSpeeds != null ? new ArrayList<>(expectedSpeeds) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AnalysisProfile{" +
                "name='" + name + '\'' +
                ", recordingFps=" + recordingFps +
                ", threshold=" + threshold +
                ", calibration=" + calibration +
                ", expectedSpeeds=" + expectedSpeeds +
                '}';
    }
}
