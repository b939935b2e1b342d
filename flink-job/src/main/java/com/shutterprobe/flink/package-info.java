/**
 * Flink streaming job that runs live shutter measurement sessions keyed by
 * recording session, reading brightness frames from Kafka and publishing
 * calibration and event measurements back to Kafka.
 *
 * @since 1.0.0
 */
package com.shutterprobe.flink;
