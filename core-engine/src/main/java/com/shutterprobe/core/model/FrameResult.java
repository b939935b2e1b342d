package com.shutterprobe.core.model;

/**
 * Outcome of feeding one frame to a live session.
 *
 * <p>
 * Exactly one of {@link BaselineProgress}, {@link CalibrationComplete} or
 * {@link EventDetected}. Callers dispatch with {@code instanceof}:
 * </p>
 *
 * <pre>
 * if (result instanceof EventDetected detected) {
 *     report(detected.getEvent());
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public interface FrameResult {
}
