/**
 * Time-series characterisation: trend, seasonality, change points,
 * correlation across series, and the gap-filling and smoothing applied
 * before them.
 *
 * @since 1.0.0
 */
package com.telemetrylens.core.analysis;
