package com.shutterprobe.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Shutter Probe.
 * <p>
 * Exported through whatever reporters the cluster configures; the job only
 * defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code frames_processed_total} – counter of all frames fed to a session</li>
 *   <li>{@code calibrations_completed_total} – counter of sessions armed</li>
 *   <li>{@code shutter_events_total} – counter of detected shutter events</li>
 *   <li>{@code processing_latency_ms} – histogram of per-message latency</li>
 * </ul>
 */
public class ShutterMetrics {

    private final Counter framesProcessed;
    private final Counter calibrationsCompleted;
    private final Counter shutterEvents;
    private final Histogram processingLatency;

    public ShutterMetrics(MetricGroup metricGroup) {
        MetricGroup probeGroup = metricGroup.addGroup("shutter_probe");

        this.framesProcessed = probeGroup.counter("frames_processed_total");
        this.calibrationsCompleted = probeGroup.counter("calibrations_completed_total");
        this.shutterEvents = probeGroup.counter("shutter_events_total");

        // sliding window of 350 samples
        this.processingLatency = probeGroup
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementFramesProcessed() {
        framesProcessed.inc();
    }

    public void incrementCalibrationsCompleted() {
        calibrationsCompleted.inc();
    }

    public void incrementShutterEvents() {
        shutterEvents.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
