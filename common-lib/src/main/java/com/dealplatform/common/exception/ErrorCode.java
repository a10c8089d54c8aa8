package com.dealplatform.common.exception;

public enum ErrorCode {
    VALIDATION_ERROR,
    NOT_FOUND,
    AGENT_FAILURE,
    MARKET_DATA_UNAVAILABLE,
    CONCURRENCY_CONFLICT
}
