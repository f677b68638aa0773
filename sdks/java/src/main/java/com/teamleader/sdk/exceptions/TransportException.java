package com.teamleader.sdk.exceptions;

import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;

/**
 * Exception thrown when no HTTP response was received (connection failure, timeout).
 */
public class TransportException extends TeamleaderException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT, message);
    }

    public TransportException(ApiFailure failure) {
        super(failure);
    }
}
