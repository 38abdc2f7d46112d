package com.openonboarding.onboarding.api.exception;

import com.openonboarding.common.dto.BaseResponse;
import com.openonboarding.onboarding.exception.InvalidSessionStateException;
import com.openonboarding.onboarding.exception.SessionExpiredException;
import com.openonboarding.onboarding.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session-specific errors. Runs before the common handler so validation failures keep their error,
 * warning and missing-step lists.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class OnboardingExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<BaseResponse<Map<String, Object>>> handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getErrors());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errors", ex.getErrors());
        details.put("warnings", ex.getWarnings());
        if (!ex.getMissingSteps().isEmpty()) {
            details.put("missingSteps", ex.getMissingSteps());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(BaseResponse.failure(ex.getMessage(), ex.getErrorCode(), details));
    }

    @ExceptionHandler(InvalidSessionStateException.class)
    public ResponseEntity<BaseResponse<Void>> handleInvalidState(InvalidSessionStateException ex) {
        log.warn("Invalid session state: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.failure(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(SessionExpiredException.class)
    public ResponseEntity<BaseResponse<Void>> handleExpired(SessionExpiredException ex) {
        log.warn("Session expired: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.GONE)
                .body(BaseResponse.failure(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<BaseResponse<Void>> handleConcurrentModification(OptimisticLockingFailureException ex) {
        log.warn("Concurrent session modification: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.failure("Session was modified concurrently. Please retry.", "CONCURRENT_MODIFICATION"));
    }
}
