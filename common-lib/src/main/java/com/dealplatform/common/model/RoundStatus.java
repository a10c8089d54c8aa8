package com.dealplatform.common.model;

public enum RoundStatus {
    ONGOING,
    RESOLVED
}
