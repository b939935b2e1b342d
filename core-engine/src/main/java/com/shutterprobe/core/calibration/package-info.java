/**
 * Live calibration state machine producing a frozen
 * {@link com.shutterprobe.core.model.ThresholdModel}.
 *
 * @since 1.0.0
 */
package com.shutterprobe.core.calibration;
