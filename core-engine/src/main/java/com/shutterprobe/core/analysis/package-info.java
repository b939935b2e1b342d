/**
 * Batch analysis of recorded brightness series.
 *
 * @since 1.0.0
 */
package com.shutterprobe.core.analysis;
