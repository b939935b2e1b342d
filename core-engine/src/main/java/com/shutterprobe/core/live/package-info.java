/**
 * Live recording sessions: calibration followed by per-frame event
 * detection, with immutable snapshots for observers.
 *
 * @since 1.0.0
 */
package com.shutterprobe.core.live;
