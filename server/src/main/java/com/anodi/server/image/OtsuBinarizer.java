package com.anodi.server.image;

import com.anodi.server.ai.BinaryImage;
import com.anodi.server.ai.ValidationException;

/**
 * Greyscale to binary conversion with Otsu's threshold: pixels strictly above
 * the level that maximizes between-class variance become 1.
 */
public class OtsuBinarizer {

    /**
     * @param grey grey[row][col] in [0, 255]
     */
    public static int threshold(int[][] grey) {
        int[] hist = new int[256];
        int total = 0;
        for (int r = 0; r < grey.length; r++) {
            for (int c = 0; c < grey[r].length; c++) {
                int v = grey[r][c];
                if (v < 0 || v > 255) {
                    throw new ValidationException("Grey level " + v + " at (" + r + ", " + c + ") outside [0, 255]");
                }
                hist[v]++;
                total++;
            }
        }
        if (total == 0) {
            throw new ValidationException("Cannot threshold an empty image");
        }

        double sum = 0;
        for (int t = 0; t < 256; t++)
            sum += t * (double) hist[t];
        double sumB = 0;
        int wB = 0;
        double varMax = -1;
        int threshold = 0;
        for (int t = 0; t < 256; t++) {
            wB += hist[t];
            if (wB == 0)
                continue;
            int wF = total - wB;
            if (wF == 0)
                break;
            sumB += t * (double) hist[t];
            double mB = sumB / wB;
            double mF = (sum - sumB) / wF;
            double varBetween = (double) wB * (double) wF * (mB - mF) * (mB - mF);
            if (varBetween > varMax) {
                varMax = varBetween;
                threshold = t;
            }
        }
        if (varMax < 0) {
            // single grey level: it is the threshold, so nothing lies above it
            int level = 0;
            while (hist[level] == 0)
                level++;
            return level;
        }
        return threshold;
    }

    public static BinaryImage binarize(int[][] grey) {
        int t = threshold(grey);
        int[][] bits = new int[grey.length][];
        for (int r = 0; r < grey.length; r++) {
            bits[r] = new int[grey[r].length];
            for (int c = 0; c < grey[r].length; c++) {
                bits[r][c] = grey[r][c] > t ? 1 : 0;
            }
        }
        return BinaryImage.of(bits);
    }
}
