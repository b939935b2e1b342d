/**
 * Order statistics over brightness samples.
 *
 * @since 1.0.0
 */
package com.shutterprobe.core.stats;
