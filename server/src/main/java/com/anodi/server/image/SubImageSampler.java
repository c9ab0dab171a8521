package com.anodi.server.image;

import com.anodi.server.ai.BinaryImage;
import com.anodi.server.ai.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Draws square sub-images at random positions of an exemplar. Seeded, so a
 * given seed always yields the same samples.
 */
public class SubImageSampler {

    private final Random random;

    public SubImageSampler(long seed) {
        this.random = new Random(seed);
    }

    public List<BinaryImage> sample(BinaryImage source, int size, int count) {
        if (size <= 0 || size > source.getHeight() || size > source.getWidth()) {
            throw new ValidationException("Sample size " + size + " does not fit " + source);
        }
        List<BinaryImage> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int row = random.nextInt(source.getHeight() - size + 1);
            int col = random.nextInt(source.getWidth() - size + 1);
            out.add(source.crop(row, col, size, size));
        }
        return out;
    }

    /**
     * Rotates counter-clockwise by a multiple of 90 degrees.
     */
    public static BinaryImage rotate(BinaryImage image, int degrees) {
        if (degrees % 90 != 0) {
            throw new ValidationException("Only multiples of 90 degrees are supported, got " + degrees);
        }
        int quarterTurns = Math.floorMod(degrees / 90, 4);
        BinaryImage out = image;
        for (int i = 0; i < quarterTurns; i++) {
            out = out.rotate90();
        }
        return out;
    }
}
