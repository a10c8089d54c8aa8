package com.dealplatform.common.exception;

public class NegotiationNotFoundException extends NegotiationException {

    public NegotiationNotFoundException(String what, Object id) {
        super(ErrorCode.NOT_FOUND, what + " not found. id=" + id);
    }
}
