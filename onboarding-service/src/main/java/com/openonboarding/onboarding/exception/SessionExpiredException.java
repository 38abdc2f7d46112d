package com.openonboarding.onboarding.exception;

import com.openonboarding.common.exception.BusinessException;
import lombok.Getter;

import java.time.Instant;

@Getter
public class SessionExpiredException extends BusinessException {
    public static final String CODE = "SESSION_EXPIRED";

    private final String sessionId;
    private final Instant expiredAt;

    public SessionExpiredException(String sessionId, Instant expiredAt) {
        super(String.format("Onboarding session %s expired at %s", sessionId, expiredAt), CODE);
        this.sessionId = sessionId;
        this.expiredAt = expiredAt;
    }
}
