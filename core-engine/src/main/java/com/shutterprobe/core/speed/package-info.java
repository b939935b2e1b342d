/**
 * Shutter speed conversion, comparison with expected settings and
 * text reporting.
 *
 * @since 1.0.0
 */
package com.shutterprobe.core.speed;
