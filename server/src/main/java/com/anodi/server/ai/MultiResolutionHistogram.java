package com.anodi.server.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Histograms of one image at each usable resolution level, in factor order,
 * together with the levels that had to be skipped.
 */
public class MultiResolutionHistogram {

    public static class Level {
        private final int factor;
        private final int height;
        private final int width;
        private final Histogram counts;
        private final Histogram probabilities;

        public Level(int factor, int height, int width, Histogram counts) {
            this.factor = factor;
            this.height = height;
            this.width = width;
            this.counts = counts;
            this.probabilities = counts.normalize();
        }

        public int getFactor() {
            return factor;
        }

        public int getHeight() {
            return height;
        }

        public int getWidth() {
            return width;
        }

        public Histogram getCounts() {
            return counts;
        }

        public Histogram getProbabilities() {
            return probabilities;
        }
    }

    private final int patchSize;
    private final List<Level> levels;
    private final List<SkippedResolution> skipped;

    public MultiResolutionHistogram(int patchSize, List<Level> levels, List<SkippedResolution> skipped) {
        this.patchSize = patchSize;
        this.levels = Collections.unmodifiableList(new ArrayList<>(levels));
        this.skipped = Collections.unmodifiableList(new ArrayList<>(skipped));
    }

    public int getPatchSize() {
        return patchSize;
    }

    public List<Level> getLevels() {
        return levels;
    }

    public List<SkippedResolution> getSkipped() {
        return skipped;
    }

    public Level levelFor(int factor) {
        for (Level level : levels) {
            if (level.getFactor() == factor) {
                return level;
            }
        }
        return null;
    }
}
