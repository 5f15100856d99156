/**
 * Plain data types of the analysis engine: series points and windows,
 * baseline statistics, thresholds, anomalies, trend, seasonality and
 * correlation results, and the rule definitions loaded from configuration.
 *
 * @since 1.0.0
 */
package com.telemetrylens.core.model;
