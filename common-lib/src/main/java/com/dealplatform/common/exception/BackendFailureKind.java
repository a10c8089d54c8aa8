package com.dealplatform.common.exception;

public enum BackendFailureKind {
    TIMEOUT,
    MALFORMED_OUTPUT,
    BACKEND_UNAVAILABLE
}
