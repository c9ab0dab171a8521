package com.anodi.server.ai;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Immutable binary image. Every pixel is 0 or 1.
 */
public class BinaryImage {

    // bits[row * width + col]
    private final byte[] bits;
    private final int height;
    private final int width;

    private BinaryImage(byte[] bits, int height, int width) {
        this.bits = bits;
        this.height = height;
        this.width = width;
    }

    /**
     * Copies a pixel grid into a new image.
     *
     * @param pixels pixels[row][col], every row the same length, values 0 or 1
     * @throws ValidationException if the grid is empty, ragged or non-binary
     */
    public static BinaryImage of(int[][] pixels) {
        if (pixels == null || pixels.length == 0 || pixels[0] == null || pixels[0].length == 0) {
            throw new ValidationException("Image must have at least one row and one column");
        }
        int h = pixels.length;
        int w = pixels[0].length;
        byte[] bits = new byte[h * w];
        for (int r = 0; r < h; r++) {
            if (pixels[r] == null || pixels[r].length != w) {
                throw new ValidationException("Row " + r + " has a different width than row 0 (" + w + ")");
            }
            for (int c = 0; c < w; c++) {
                int v = pixels[r][c];
                if (v != 0 && v != 1) {
                    throw new ValidationException(
                            "Pixel (" + r + ", " + c + ") has value " + v + ", expected 0 or 1");
                }
                bits[r * w + c] = (byte) v;
            }
        }
        return new BinaryImage(bits, h, w);
    }

    public static BinaryImage zeros(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new ValidationException("Image dimensions must be positive: " + height + "x" + width);
        }
        return new BinaryImage(new byte[height * width], height, width);
    }

    public int get(int row, int col) {
        return bits[row * width + col];
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public boolean sameShape(BinaryImage other) {
        return height == other.height && width == other.width;
    }

    public int[][] toArray() {
        int[][] out = new int[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                out[r][c] = bits[r * width + c];
            }
        }
        return out;
    }

    /**
     * Extracts the h x w window whose top-left corner is (row, col).
     */
    public BinaryImage crop(int row, int col, int h, int w) {
        if (h <= 0 || w <= 0 || row < 0 || col < 0 || row + h > height || col + w > width) {
            throw new ValidationException("Crop " + h + "x" + w + " at (" + row + ", " + col
                    + ") does not fit a " + height + "x" + width + " image");
        }
        byte[] out = new byte[h * w];
        for (int r = 0; r < h; r++) {
            System.arraycopy(bits, (row + r) * width + col, out, r * w, w);
        }
        return new BinaryImage(out, h, w);
    }

    /**
     * Rotates the image 90 degrees counter-clockwise.
     */
    public BinaryImage rotate90() {
        // new[r][c] = old[c][W - 1 - r], new size W x H
        byte[] out = new byte[height * width];
        for (int r = 0; r < width; r++) {
            for (int c = 0; c < height; c++) {
                out[r * height + c] = bits[c * width + (width - 1 - r)];
            }
        }
        return new BinaryImage(out, width, height);
    }

    public int countOnes() {
        int n = 0;
        for (byte b : bits) {
            n += b;
        }
        return n;
    }

    /**
     * SHA-256 over the dimensions and the pixel bits, as lowercase hex.
     */
    public String contentHash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(new byte[] {
                    (byte) (height >>> 24), (byte) (height >>> 16), (byte) (height >>> 8), (byte) height,
                    (byte) (width >>> 24), (byte) (width >>> 16), (byte) (width >>> 8), (byte) width });
            digest.update(bits);
            byte[] hash = digest.digest();
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1)
                    hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "BinaryImage{" + height + "x" + width + "}";
    }
}
