package com.telemetrylens.core.model;

/**
 * Side of the boundary an anomalous point fell on.
 *
 * @since 1.0.0
 */
public enum AnomalyDirection {
    SPIKE,
    DROP
}
