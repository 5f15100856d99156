/**
 * Baseline statistics and threshold derivation.
 */
package com.telemetrylens.core.stats;
