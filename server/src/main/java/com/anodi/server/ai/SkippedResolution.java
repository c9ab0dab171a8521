package com.anodi.server.ai;

/**
 * A resolution level left out because the downsampled image is smaller than
 * the patch.
 */
public class SkippedResolution {
    private final int factor;
    private final int height;
    private final int width;
    private final int patchSize;

    public SkippedResolution(int factor, int height, int width, int patchSize) {
        this.factor = factor;
        this.height = height;
        this.width = width;
        this.patchSize = patchSize;
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

    public int getPatchSize() {
        return patchSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SkippedResolution))
            return false;
        SkippedResolution other = (SkippedResolution) o;
        return factor == other.factor && height == other.height && width == other.width
                && patchSize == other.patchSize;
    }

    @Override
    public int hashCode() {
        return ((factor * 31 + height) * 31 + width) * 31 + patchSize;
    }

    @Override
    public String toString() {
        return "SkippedResolution{factor=" + factor + ", size=" + height + "x" + width
                + ", patchSize=" + patchSize + "}";
    }
}
