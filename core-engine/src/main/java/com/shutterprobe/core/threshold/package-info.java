/**
 * Threshold selection: separating closed-shutter frames from open ones.
 *
 * <p>
 * All methods implement
 * {@link com.shutterprobe.core.threshold.ThresholdStrategy} and are created by
 * {@link com.shutterprobe.core.threshold.ThresholdStrategyFactory}:
 * </p>
 * <ul>
 * <li>{@link com.shutterprobe.core.threshold.PercentileMarginStrategy} —
 * 25th percentile plus a margin of the median distance (default)</li>
 * <li>{@link com.shutterprobe.core.threshold.ZScoreStrategy} — mean plus
 * z × σ, z tuned to an expected event count</li>
 * <li>{@link com.shutterprobe.core.threshold.ClusteringStrategy} — midpoint
 * between density clusters, tuned to an expected event count</li>
 * </ul>
 *
 * <p>
 * Degenerate sample sets never throw; they fall back through
 * {@link com.shutterprobe.core.threshold.DegenerateThresholdPolicy}.
 * </p>
 *
 * @since 1.0.0
 */
package com.shutterprobe.core.threshold;
