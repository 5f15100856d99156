package com.telemetrylens.core.model;

public enum ChangePointType {
    INCREASE,
    DECREASE,
    VARIANCE
}
