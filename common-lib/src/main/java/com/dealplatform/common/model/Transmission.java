package com.dealplatform.common.model;

public enum Transmission {
    MANUAL,
    AUTOMATIC
}
