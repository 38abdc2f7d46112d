package com.openonboarding.onboarding.domain.image;

/**
 * Turns raw image bytes into the statistics the analyzer works on.
 */
public interface ImageDecoder {

    /**
     * @throws ImageAnalysisException when the bytes are not a readable image
     */
    ImageStatistics decode(byte[] content);
}
