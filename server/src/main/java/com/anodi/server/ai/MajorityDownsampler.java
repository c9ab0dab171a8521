package com.anodi.server.ai;

/**
 * Shrinks a binary image by an integer factor. Each f x f block becomes one
 * pixel set to the block's majority value. Blocks on the bottom and right
 * edges may be partial and vote over the pixels they contain. Output size is
 * ceil(H / f) x ceil(W / f).
 */
public final class MajorityDownsampler {

    private MajorityDownsampler() {
    }

    public static int downsampledSize(int size, int factor) {
        return (size + factor - 1) / factor;
    }

    public static BinaryImage downsample(BinaryImage image, int factor, TieBreak tieBreak) {
        if (factor <= 0) {
            throw new ConfigurationException("Downsampling factor must be positive, got " + factor);
        }
        if (factor == 1) {
            return image;
        }
        int h = image.getHeight();
        int w = image.getWidth();
        int outH = downsampledSize(h, factor);
        int outW = downsampledSize(w, factor);
        int[][] out = new int[outH][outW];

        for (int br = 0; br < outH; br++) {
            int r0 = br * factor;
            int r1 = Math.min(r0 + factor, h);
            for (int bc = 0; bc < outW; bc++) {
                int c0 = bc * factor;
                int c1 = Math.min(c0 + factor, w);
                int ones = 0;
                for (int r = r0; r < r1; r++) {
                    for (int c = c0; c < c1; c++) {
                        ones += image.get(r, c);
                    }
                }
                int cells = (r1 - r0) * (c1 - c0);
                if (2 * ones > cells) {
                    out[br][bc] = 1;
                } else if (2 * ones == cells) {
                    out[br][bc] = tieBreak.getValue();
                }
            }
        }
        return BinaryImage.of(out);
    }
}
