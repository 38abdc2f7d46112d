package com.openonboarding.onboarding.domain.image;

import com.openonboarding.common.exception.BusinessException;

/**
 * Raised when pixel statistics cannot be computed. Never escapes {@link ImageQualityAnalyzer}.
 */
public class ImageAnalysisException extends BusinessException {
    public static final String CODE = "IMAGE_ANALYSIS_FAILED";

    public ImageAnalysisException(String message) {
        super(message, CODE);
    }

    public ImageAnalysisException(String message, Throwable cause) {
        super(message, cause, CODE);
    }
}
