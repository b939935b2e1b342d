package com.shutterprobe.core.calibration;

import com.shutterprobe.core.config.CalibrationSettings;
import com.shutterprobe.core.model.BaselineProgress;
import com.shutterprobe.core.model.CalibrationComplete;
import com.shutterprobe.core.model.CalibrationState;
import com.shutterprobe.core.model.FrameResult;
import com.shutterprobe.core.model.ThresholdMethod;
import com.shutterprobe.core.model.ThresholdModel;
import com.shutterprobe.core.stats.BaselineStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Two-phase live calibration.
 *
 * <pre>
 * IDLE --start()--&gt; COLLECTING_BASELINE --N frames--&gt; AWAITING_CALIBRATION_SHUTTER
 *      --frame &gt; preliminary--&gt; CAPTURING_CALIBRATION_EVENT
 *      --frame &lt;= preliminary--&gt; ARMED
 * </pre>
 *
 * <h3>Phase 1: baseline</h3>
 * <p>
 * The first {@code baselineFrames} frames after {@link #start()} are taken
 * with the shutter closed. Baseline is their 25th percentile. The
 * preliminary threshold is the highest of {@code baseline + k * stdDev},
 * {@code baseline + floor} and {@code maxSeen * m}, so sensor noise alone
 * cannot trigger the calibration event even on a perfectly flat window.
 * </p>
 *
 * <h3>Phase 2: calibration shutter</h3>
 * <p>
 * The user fires the shutter once. The brightest frame of that excursion is
 * the peak and the final threshold sits at {@code peakFraction} of the way
 * from baseline to peak. The calibration event itself is never reported.
 * </p>
 *
 * <p>
 * Frames delivered while {@link CalibrationState#IDLE} or
 * {@link CalibrationState#ARMED} are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public class CalibrationController implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(CalibrationController.class);

    private final CalibrationSettings settings;

    private CalibrationState state = CalibrationState.IDLE;
    private final List<Double> baselineBuffer = new ArrayList<>();

    private double baseline;
    private double stdDev;
    private double preliminaryThreshold;
    private double calibrationPeak;
    private ThresholdModel model;

    public CalibrationController() {
        this(new CalibrationSettings());
    }

    /**
     * @param settings calibration tuning; must not be {@code null} and must
     *                 pass validation
     * @throws IllegalStateException if {@code settings} is invalid
     */
    public CalibrationController(CalibrationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "CalibrationSettings must not be null");
        settings.validate();
    }

    /**
     * Begin collecting the baseline.
     *
     * @return {@code true} if calibration started, {@code false} when the
     *         controller was not idle
     */
    public boolean start() {
        if (state != CalibrationState.IDLE) {
            LOG.debug("Ignoring start() in state {}", state);
            return false;
        }
        state = CalibrationState.COLLECTING_BASELINE;
        LOG.info("Calibration started: collecting {} baseline frame(s)", settings.getBaselineFrames());
        return true;
    }

    /**
     * Feed one frame's brightness.
     *
     * @param brightness mean frame brightness
     * @return baseline progress while collecting, the frozen model when the
     *         calibration shutter closes, empty otherwise
     */
    public Optional<FrameResult> processFrame(double brightness) {
        switch (state) {
            case COLLECTING_BASELINE -> {
                return Optional.of(collectBaseline(brightness));
            }
            case AWAITING_CALIBRATION_SHUTTER -> {
                if (brightness > preliminaryThreshold) {
                    calibrationPeak = brightness;
                    state = CalibrationState.CAPTURING_CALIBRATION_EVENT;
                    LOG.debug("Calibration shutter opened (brightness={} > {})",
                            brightness, preliminaryThreshold);
                }
                return Optional.empty();
            }
            case CAPTURING_CALIBRATION_EVENT -> {
                if (brightness > preliminaryThreshold) {
                    calibrationPeak = Math.max(calibrationPeak, brightness);
                    return Optional.empty();
                }
                return Optional.of(arm());
            }
            case IDLE, ARMED -> {
                return Optional.empty();
            }
            default -> throw new IllegalStateException("Unknown calibration state: " + state);
        }
    }

    /**
     * Return to {@link CalibrationState#IDLE}, discarding the baseline and
     * any frozen threshold.
     */
    public void reset() {
        state = CalibrationState.IDLE;
        baselineBuffer.clear();
        baseline = 0;
        stdDev = 0;
        preliminaryThreshold = 0;
        calibrationPeak = 0;
        model = null;
        LOG.debug("Calibration reset");
    }

    public CalibrationState getState() {
        return state;
    }

    public boolean isArmed() {
        return state == CalibrationState.ARMED;
    }

    /**
     * @return baseline collection progress in {@code [0, 1]}; {@code 1.0}
     *         once the baseline window is complete
     */
    public double getProgress() {
        return switch (state) {
            case IDLE -> 0.0;
            case COLLECTING_BASELINE -> (double) baselineBuffer.size() / settings.getBaselineFrames();
            case AWAITING_CALIBRATION_SHUTTER, CAPTURING_CALIBRATION_EVENT, ARMED -> 1.0;
        };
    }

    /**
     * @return the preliminary threshold once the baseline is complete
     */
    public OptionalDouble getPreliminaryThreshold() {
        if (state == CalibrationState.IDLE || state == CalibrationState.COLLECTING_BASELINE) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(preliminaryThreshold);
    }

    /**
     * @return the frozen threshold model once armed
     */
    public Optional<ThresholdModel> getModel() {
        return Optional.ofNullable(model);
    }

    public CalibrationSettings getSettings() {
        return settings;
    }

    // ---- Internal ----

    private FrameResult collectBaseline(double brightness) {
        baselineBuffer.add(brightness);
        int required = settings.getBaselineFrames();
        double fraction = Math.min(1.0, (double) baselineBuffer.size() / required);

        if (baselineBuffer.size() >= required) {
            baseline = BaselineStatistics.percentile(baselineBuffer, 25);
            stdDev = BaselineStatistics.stdDev(baselineBuffer);
            double maxSeen = BaselineStatistics.max(baselineBuffer);

            preliminaryThreshold = Math.max(
                    baseline + settings.getStdDevMultiplier() * stdDev,
                    Math.max(baseline + settings.getAbsoluteFloor(),
                            maxSeen * settings.getMaxSeenMultiplier()));

            baselineBuffer.clear();
            state = CalibrationState.AWAITING_CALIBRATION_SHUTTER;
            LOG.info("Baseline complete: baseline={} stdDev={} maxSeen={} preliminaryThreshold={}",
                    baseline, stdDev, maxSeen, preliminaryThreshold);
        }
        return new BaselineProgress(fraction);
    }

    private FrameResult arm() {
        double threshold = baseline + (calibrationPeak - baseline) * settings.getPeakFraction();
        model = ThresholdModel.builder()
                .method(ThresholdMethod.LIVE_CALIBRATION)
                .baseline(baseline)
                .threshold(threshold)
                .peak(calibrationPeak)
                .stdDev(stdDev)
                .build();
        state = CalibrationState.ARMED;
        LOG.info("Calibration armed: baseline={} peak={} threshold={}",
                baseline, calibrationPeak, threshold);
        return new CalibrationComplete(model);
    }
}
