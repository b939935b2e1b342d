/**
 * Event boundary detection and sub-frame duration estimation.
 *
 * <ul>
 * <li>{@link com.shutterprobe.core.detection.BatchEventFinder} — scans a
 * recorded series in one pass</li>
 * <li>{@link com.shutterprobe.core.detection.LiveEventDetector} — classifies
 * frames one at a time once calibration is armed</li>
 * <li>{@link com.shutterprobe.core.detection.WeightedDurationEstimator} —
 * median-referenced weighted frame count</li>
 * <li>{@link com.shutterprobe.core.detection.PlateauPeakEstimator} — typical
 * fully-open brightness of a recording</li>
 * </ul>
 *
 * <p>
 * Both detectors use the same strict rule: a frame is open iff its brightness
 * is greater than the threshold.
 * </p>
 *
 * @since 1.0.0
 */
package com.shutterprobe.core.detection;
