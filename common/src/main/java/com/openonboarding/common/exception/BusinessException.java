package com.openonboarding.common.exception;

import lombok.Getter;

/**
 * Base type for onboarding rule violations. The error code is stable and safe to expose to clients.
 */
@Getter
public class BusinessException extends RuntimeException {
    public static final String DEFAULT_CODE = "BUSINESS_ERROR";

    private final String errorCode;

    public BusinessException(String message) {
        this(message, DEFAULT_CODE);
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
