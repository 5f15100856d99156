/**
 * Interfaces the engine consumes from the outside world: the series fetch
 * and the optional anomaly enrichment.
 */
package com.telemetrylens.core.source;
