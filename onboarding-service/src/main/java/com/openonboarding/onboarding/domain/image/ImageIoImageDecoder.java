package com.openonboarding.onboarding.domain.image;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * {@link ImageDecoder} backed by {@code javax.imageio}. Supports whatever formats the JDK has readers for
 * (PNG, JPEG, GIF, BMP out of the box).
 */
@Slf4j
@Component
public class ImageIoImageDecoder implements ImageDecoder {

    private static final double RED_WEIGHT = 0.299;
    private static final double GREEN_WEIGHT = 0.587;
    private static final double BLUE_WEIGHT = 0.114;

    @Override
    public ImageStatistics decode(byte[] content) {
        if (content == null || content.length == 0) {
            throw new ImageAnalysisException("Image content is empty");
        }

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(content));
        } catch (IOException | RuntimeException e) {
            throw new ImageAnalysisException("Unable to read image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageAnalysisException("Unsupported image format");
        }

        int width = image.getWidth();
        int height = image.getHeight();
        long pixelCount = (long) width * height;
        if (pixelCount == 0 || pixelCount > Integer.MAX_VALUE) {
            throw new ImageAnalysisException("Unsupported image size " + width + "x" + height);
        }

        double[] sum = new double[3];
        double[] sumOfSquares = new double[3];
        byte[] grayscale = new byte[(int) pixelCount];
        int[] row = new int[width];

        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int rgb = row[x];
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;

                sum[0] += r;
                sum[1] += g;
                sum[2] += b;
                sumOfSquares[0] += (double) r * r;
                sumOfSquares[1] += (double) g * g;
                sumOfSquares[2] += (double) b * b;

                long luminance = Math.round(RED_WEIGHT * r + GREEN_WEIGHT * g + BLUE_WEIGHT * b);
                grayscale[y * width + x] = (byte) Math.min(255, luminance);
            }
        }

        double[] means = new double[3];
        double[] stdevs = new double[3];
        for (int c = 0; c < 3; c++) {
            means[c] = sum[c] / pixelCount;
            double variance = sumOfSquares[c] / pixelCount - means[c] * means[c];
            stdevs[c] = Math.sqrt(Math.max(0.0, variance));
        }

        log.debug("Decoded image {}x{}: means={} {} {}", width, height, means[0], means[1], means[2]);
        return new ImageStatistics(width, height, means, stdevs, grayscale);
    }
}
