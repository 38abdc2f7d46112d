package com.openonboarding.onboarding.exception;

import com.openonboarding.common.exception.BusinessException;
import com.openonboarding.onboarding.domain.model.SessionStatus;
import lombok.Getter;

@Getter
public class InvalidSessionStateException extends BusinessException {
    public static final String CODE = "INVALID_SESSION_STATE";

    private final String sessionId;
    private final SessionStatus status;

    public InvalidSessionStateException(String sessionId, SessionStatus status, String operation) {
        super(String.format("Cannot %s session %s in status %s", operation, sessionId, status), CODE);
        this.sessionId = sessionId;
        this.status = status;
    }
}
