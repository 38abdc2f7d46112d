package com.openonboarding.common.exception;

import lombok.Getter;

/**
 * A shared dependency (lock service, store) could not serve the request in time.
 * The caller may retry the same request later. Mapped to HTTP 503.
 */
@Getter
public class ServiceUnavailableException extends RuntimeException {
    public static final String CODE = "SERVICE_UNAVAILABLE";

    private final String errorCode = CODE;

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
