package com.openonboarding.common.exception;

import lombok.Getter;

/**
 * Thrown when a session (or any other addressed resource) does not exist.
 */
@Getter
public class ResourceNotFoundException extends BusinessException {
    public static final String CODE = "RESOURCE_NOT_FOUND";

    private final String resourceType;
    private final String identifier;

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), CODE);
        this.resourceType = resourceType;
        this.identifier = String.valueOf(identifier);
    }
}
