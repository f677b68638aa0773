package com.teamleader.sdk.exceptions;

import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;

/**
 * Exception thrown when authentication fails (401 Unauthorized, or no usable token).
 */
public class AuthenticationException extends TeamleaderException {

    public AuthenticationException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }

    public AuthenticationException(ApiFailure failure) {
        super(failure);
    }
}
