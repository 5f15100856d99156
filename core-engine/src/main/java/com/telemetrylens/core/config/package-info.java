/**
 * Loading and validation of analysis rules.
 *
 * <p>
 * Rules are defined in YAML and loaded by
 * {@link com.telemetrylens.core.config.AnalysisRulesLoader} into an
 * {@link com.telemetrylens.core.config.AnalysisRulesConfig}; validation runs
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetrylens.core.config;
