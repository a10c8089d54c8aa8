package com.dealplatform.common.model;

public enum FuelType {
    PETROL,
    DIESEL,
    HYBRID,
    ELECTRIC
}
