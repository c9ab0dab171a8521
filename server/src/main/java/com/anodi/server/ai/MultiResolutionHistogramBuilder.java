package com.anodi.server.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds one histogram per resolution factor. The image is downsampled by
 * majority vote at each factor and scanned with the same base patch size.
 * Levels whose image is smaller than the patch are skipped and reported.
 */
public class MultiResolutionHistogramBuilder implements HistogramSource {

    private static final Logger logger = LoggerFactory.getLogger(MultiResolutionHistogramBuilder.class);

    private final int patchSize;
    private final int[] factors;
    private final TieBreak tieBreak;
    private final String signature;

    public MultiResolutionHistogramBuilder(EvaluationSettings settings) {
        this.patchSize = settings.getPatchSize();
        this.factors = settings.getFactors();
        this.tieBreak = settings.getTieBreak();
        this.signature = settings.histogramSignature();
    }

    @Override
    public String getSignature() {
        return signature;
    }

    public int getPatchSize() {
        return patchSize;
    }

    public int[] getFactors() {
        return factors.clone();
    }

    @Override
    public MultiResolutionHistogram compute(BinaryImage image) {
        return build(image, patchSize, factors, tieBreak);
    }

    public static MultiResolutionHistogram build(BinaryImage image, int patchSize, int[] factors, TieBreak tieBreak) {
        if (image == null) {
            throw new ValidationException("Image must not be null");
        }
        List<MultiResolutionHistogram.Level> levels = new ArrayList<>();
        List<SkippedResolution> skipped = new ArrayList<>();

        for (int factor : factors) {
            SkippedResolution skip = skipFor(image.getHeight(), image.getWidth(), patchSize, factor);
            if (skip != null) {
                logger.warn("Skipping resolution factor {} for {}: downsampled to {}x{}, smaller than patch {}",
                        factor, image, skip.getHeight(), skip.getWidth(), patchSize);
                skipped.add(skip);
                continue;
            }
            BinaryImage level = MajorityDownsampler.downsample(image, factor, tieBreak);
            Histogram counts = HistogramBuilder.build(level, patchSize, false);
            levels.add(new MultiResolutionHistogram.Level(factor, level.getHeight(), level.getWidth(), counts));
        }
        return new MultiResolutionHistogram(patchSize, levels, skipped);
    }

    /**
     * Returns the skip record for a level that cannot be scanned, or null if
     * the level is usable. Depends only on the image size.
     */
    public static SkippedResolution skipFor(int height, int width, int patchSize, int factor) {
        if (factor <= 0) {
            throw new ConfigurationException("Downsampling factor must be positive, got " + factor);
        }
        int h = MajorityDownsampler.downsampledSize(height, factor);
        int w = MajorityDownsampler.downsampledSize(width, factor);
        if (h < patchSize || w < patchSize) {
            return new SkippedResolution(factor, h, w, patchSize);
        }
        return null;
    }

    public List<Integer> usableFactors(int height, int width) {
        List<Integer> usable = new ArrayList<>();
        for (int factor : factors) {
            if (skipFor(height, width, patchSize, factor) == null) {
                usable.add(factor);
            }
        }
        return usable;
    }
}
