package com.teamleader.sdk.exceptions;

import com.teamleader.sdk.errors.ApiFailure;
import com.teamleader.sdk.errors.ErrorKind;

/**
 * Exception thrown when required client configuration is missing or invalid.
 */
public class ConfigurationException extends TeamleaderException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(ApiFailure failure) {
        super(failure);
    }
}
