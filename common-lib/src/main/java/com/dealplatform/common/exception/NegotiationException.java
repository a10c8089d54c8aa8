package com.dealplatform.common.exception;

/**
 * Root of every failure the negotiation core surfaces to its callers.
 */
public abstract class NegotiationException extends RuntimeException {

    private final ErrorCode errorCode;

    protected NegotiationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected NegotiationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
