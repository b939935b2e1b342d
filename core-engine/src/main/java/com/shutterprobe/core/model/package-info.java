/**
 * Value types shared by batch analysis, live sessions and the Flink job.
 *
 * <ul>
 * <li>{@link com.shutterprobe.core.model.BrightnessSample} — one frame's
 * brightness and position</li>
 * <li>{@link com.shutterprobe.core.model.ThresholdModel} — baseline and
 * detection threshold</li>
 * <li>{@link com.shutterprobe.core.model.ShutterEvent} — one detected shutter
 * opening</li>
 * <li>{@link com.shutterprobe.core.model.SpeedResult} — measured speed and
 * deviation</li>
 * <li>{@link com.shutterprobe.core.model.FrameResult} — per-frame outcome of a
 * live session</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.shutterprobe.core.model;
