package com.dealplatform.common.exception;

/**
 * Bad identifier or out-of-range argument. Always raised before any state is touched.
 */
public class ValidationException extends NegotiationException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
