package com.teamleader.sdk.exceptions;

import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;

/**
 * Exception thrown when the API rejects the request (4xx other than 401, 404 and 429).
 */
public class ValidationException extends TeamleaderException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(ApiFailure failure) {
        super(failure);
    }
}
