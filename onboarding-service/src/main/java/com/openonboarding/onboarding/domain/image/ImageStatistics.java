package com.openonboarding.onboarding.domain.image;

/**
 * Decoded pixel statistics consumed by {@link ImageQualityAnalyzer}.
 *
 * @param width         pixel width, null when unknown
 * @param height        pixel height, null when unknown
 * @param channelMeans  mean value per color channel on a 0-255 scale
 * @param channelStdevs standard deviation per color channel
 * @param grayscale     row-major luminance buffer of {@code width * height} bytes
 */
public record ImageStatistics(
        Integer width,
        Integer height,
        double[] channelMeans,
        double[] channelStdevs,
        byte[] grayscale
) {
    public boolean hasDimensions() {
        return width != null && height != null && width > 0 && height > 0;
    }
}
