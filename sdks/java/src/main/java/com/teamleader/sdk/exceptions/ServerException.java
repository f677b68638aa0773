package com.teamleader.sdk.exceptions;

import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;

/**
 * Exception thrown when a server error occurs (5xx).
 */
public class ServerException extends TeamleaderException {

    public ServerException(String message) {
        super(ErrorKind.SERVER_ERROR, message);
    }

    public ServerException(ApiFailure failure) {
        super(failure);
    }
}
