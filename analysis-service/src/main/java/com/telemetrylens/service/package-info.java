/**
 * Analysis service for Telemetry Lens.
 *
 * <p>
 * This package wires the core engine to a series source: it runs every
 * configured rule concurrently, renders the results as JSON and exposes
 * metrics and health endpoints.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.telemetrylens.service.TelemetryLensService}: main entry
 * point</li>
 * <li>{@link com.telemetrylens.service.AnalysisService}: bounded rule fan-out
 * and single-series requests</li>
 * <li>{@link com.telemetrylens.service.ServiceConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.telemetrylens.service.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.telemetrylens.service;
