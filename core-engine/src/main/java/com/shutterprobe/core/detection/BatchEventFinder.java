package com.shutterprobe.core.detection;

import com.shutterprobe.core.model.ShutterEvent;
import com.shutterprobe.core.model.ThresholdModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Finds shutter events in a complete, ordered brightness series.
 *
 * <p>
 * A frame is open iff {@code value > threshold} (strict). A single pointer
 * tracks the current open run: closed→open starts a run, open→closed emits
 * it with {@code endFrame} set to the previous frame.
 * </p>
 *
 * <h3>Trailing runs</h3>
 * <p>
 * A run still open at the end of the series is emitted with the samples
 * collected so far and flagged as unterminated; it is never dropped.
 * </p>
 *
 * <h3>Peak brightness</h3>
 * <p>
 * Events carry the model's peak when it has one, otherwise the estimate of a
 * {@link PlateauPeakEstimator} over all runs of the series.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchEventFinder {

    private static final Logger LOG = LoggerFactory.getLogger(BatchEventFinder.class);

    private final PlateauPeakEstimator peakEstimator;

    public BatchEventFinder() {
        this(new PlateauPeakEstimator());
    }

    /**
     * @param peakEstimator estimator used when the model has no peak
     */
    public BatchEventFinder(PlateauPeakEstimator peakEstimator) {
        this.peakEstimator = Objects.requireNonNull(peakEstimator, "peakEstimator must not be null");
    }

    /**
     * @param series brightness of every frame, in frame order; must not be
     *               {@code null}
     * @param model  threshold model to classify against; must not be
     *               {@code null}
     * @return unmodifiable list of events in frame order
     */
    public List<ShutterEvent> find(List<Double> series, ThresholdModel model) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(model, "ThresholdModel must not be null");

        List<Run> runs = scan(series, model.getThreshold());

        Double peak = model.getPeak().orElse(null);
        if (peak == null) {
            peak = peakEstimator.estimate(runs.stream().map(r -> r.values).toList()).orElse(null);
        }

        List<ShutterEvent> events = new ArrayList<>(runs.size());
        for (Run run : runs) {
            events.add(ShutterEvent.builder()
                    .startFrame(run.start)
                    .endFrame(run.end)
                    .brightnessValues(run.values)
                    .baselineBrightness(model.getBaseline())
                    .peakBrightness(peak)
                    .unterminated(run.unterminated)
                    .build());
        }

        LOG.debug("Found {} event(s) in {} frame(s) above threshold {}",
                events.size(), series.size(), model.getThreshold());
        return Collections.unmodifiableList(events);
    }

    /**
     * Count maximal above-threshold runs without materialising events.
     *
     * @param series    brightness series; must not be {@code null}
     * @param threshold detection threshold
     * @return number of runs, including a trailing unterminated one
     */
    public static int countEvents(List<Double> series, double threshold) {
        Objects.requireNonNull(series, "series must not be null");
        int count = 0;
        boolean open = false;
        for (double value : series) {
            boolean isOpen = value > threshold;
            if (isOpen && !open) {
                count++;
            }
            open = isOpen;
        }
        return count;
    }

    private static List<Run> scan(List<Double> series, double threshold) {
        List<Run> runs = new ArrayList<>();
        Run current = null;

        for (int frame = 0; frame < series.size(); frame++) {
            double value = series.get(frame);
            boolean isOpen = value > threshold;

            if (isOpen && current == null) {
                current = new Run(frame);
                current.values.add(value);
            } else if (isOpen) {
                current.values.add(value);
            } else if (current != null) {
                current.end = frame - 1;
                runs.add(current);
                current = null;
            }
        }

        if (current != null) {
            current.end = series.size() - 1;
            current.unterminated = true;
            LOG.debug("Series ended with shutter open – reporting run from frame {} as unterminated",
                    current.start);
            runs.add(current);
        }
        return runs;
    }

    private static final class Run {
        private final long start;
        private long end;
        private boolean unterminated;
        private final List<Double> values = new ArrayList<>();

        private Run(long start) {
            this.start = start;
        }
    }
}
