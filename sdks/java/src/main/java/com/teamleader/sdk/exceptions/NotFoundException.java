package com.teamleader.sdk.exceptions;

import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;

/**
 * Exception thrown when a resource is not found (404 Not Found).
 */
public class NotFoundException extends TeamleaderException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public NotFoundException(ApiFailure failure) {
        super(failure);
    }
}
