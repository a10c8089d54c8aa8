package com.dealplatform.common.agent;

public enum DemandLevel {
    HIGH,
    MEDIUM,
    LOW
}
