/**
 * Anomaly detection: per-kind series preprocessing, scoring and ranking,
 * and the metric, log-frequency and log-pattern detectors built on top.
 *
 * <p>
 * New rule types are registered in
 * {@link com.telemetrylens.core.detection.DetectorFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetrylens.core.detection;
