package com.shutterprobe.core.model;

/**
 * Phases of live-mode calibration. Exactly one is active at a time.
 *
 * @since 1.0.0
 */
public enum CalibrationState {

    /** Nothing collected; waiting for an explicit start. */
    IDLE,

    /** Accumulating dark frames for the baseline window. */
    COLLECTING_BASELINE,

    /** Preliminary threshold set; waiting for the throw-away shutter click. */
    AWAITING_CALIBRATION_SHUTTER,

    /** Calibration click in progress; tracking its peak brightness. */
    CAPTURING_CALIBRATION_EVENT,

    /** Final threshold frozen; event detection active. */
    ARMED
}
