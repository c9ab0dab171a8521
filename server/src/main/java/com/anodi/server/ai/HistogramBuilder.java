package com.anodi.server.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts every n x n pattern of a binary image with a stride-1 sliding window.
 * Windows that would cross the image border are not counted, so the counts
 * always sum to (H - n + 1) * (W - n + 1).
 */
public final class HistogramBuilder {

    private static final Logger logger = LoggerFactory.getLogger(HistogramBuilder.class);

    private HistogramBuilder() {
    }

    public static Histogram build(BinaryImage image, int patchSize, boolean normalize) {
        if (image == null) {
            throw new ValidationException("Image must not be null");
        }
        int bins = PatternEncoder.patternCount(patchSize);
        checkFits(image, patchSize);

        int rows = image.getHeight() - patchSize + 1;
        int cols = image.getWidth() - patchSize + 1;
        int[] counts = new int[bins];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                counts[PatternEncoder.encode(image, r, c, patchSize)]++;
            }
        }

        if (logger.isTraceEnabled()) {
            logger.trace("Counted {} patches of size {} in {}", (long) rows * cols, patchSize, image);
        }

        Histogram raw = new Histogram(patchSize, counts, false);
        return normalize ? raw.normalize() : raw;
    }

    public static long patchCount(int height, int width, int patchSize) {
        if (height < patchSize || width < patchSize) {
            return 0;
        }
        return (long) (height - patchSize + 1) * (width - patchSize + 1);
    }

    static void checkFits(BinaryImage image, int patchSize) {
        long windows = patchCount(image.getHeight(), image.getWidth(), patchSize);
        if (windows == 0) {
            throw new ConfigurationException("Patch size " + patchSize + " does not fit a "
                    + image.getHeight() + "x" + image.getWidth() + " image");
        }
        // a single bin may receive every window
        if (windows > Integer.MAX_VALUE) {
            throw new ValidationException(image + " has " + windows + " windows, more than a bin can count");
        }
    }
}
