/**
 * YAML analysis profile: recording frame rate, threshold method, calibration
 * tuning and the expected speed sequence.
 *
 * @since 1.0.0
 */
package com.shutterprobe.core.config;
