package com.anodi.server.ai;

/**
 * Maps an n x n binary patch to its pattern id.
 *
 * The patch is read row by row, left to right, and the first pixel read is
 * the most significant bit:
 *
 * <pre>
 * [[0,0],[0,0]] -> 0000 -> 0
 * [[0,1],[0,0]] -> 0100 -> 4
 * [[1,0],[1,1]] -> 1011 -> 11
 * </pre>
 *
 * Ids cover [0, 2^(n*n)) exactly once, so a patch size of n needs a table of
 * 2^(n*n) entries.
 */
public final class PatternEncoder {

    // 4x4 = 65536 bins per level; a 5x5 table already needs 2^25
    public static final int MAX_PATCH_SIZE = 4;

    private PatternEncoder() {
    }

    /**
     * Number of distinct patterns for a patch size.
     */
    public static int patternCount(int patchSize) {
        checkPatchSize(patchSize);
        return 1 << (patchSize * patchSize);
    }

    public static void checkPatchSize(int patchSize) {
        if (patchSize < 1 || patchSize > MAX_PATCH_SIZE) {
            throw new ConfigurationException(
                    "Patch size must be between 1 and " + MAX_PATCH_SIZE + ", got " + patchSize);
        }
    }

    public static int encode(int[][] patch) {
        if (patch == null || patch.length == 0) {
            throw new ValidationException("Patch must not be empty");
        }
        int n = patch.length;
        checkPatchSize(n);
        int symbol = 0;
        for (int pr = 0; pr < n; pr++) {
            if (patch[pr] == null || patch[pr].length != n) {
                throw new ValidationException("Patch must be square, row " + pr + " is not " + n + " wide");
            }
            for (int pc = 0; pc < n; pc++) {
                int v = patch[pr][pc];
                if (v != 0 && v != 1) {
                    throw new ValidationException(
                            "Patch value at (" + pr + ", " + pc + ") is " + v + ", expected 0 or 1");
                }
                symbol = (symbol << 1) | v;
            }
        }
        return symbol;
    }

    /**
     * Encodes the n x n window of {@code image} whose top-left corner is
     * (startRow, startCol). The caller guarantees the window fits.
     */
    public static int encode(BinaryImage image, int startRow, int startCol, int patchSize) {
        int symbol = 0;
        for (int pr = 0; pr < patchSize; pr++) {
            for (int pc = 0; pc < patchSize; pc++) {
                symbol = (symbol << 1) | image.get(startRow + pr, startCol + pc);
            }
        }
        return symbol;
    }

    public static int[][] decode(int id, int patchSize) {
        int count = patternCount(patchSize);
        if (id < 0 || id >= count) {
            throw new ValidationException("Pattern id " + id + " outside [0, " + count + ")");
        }
        int[][] patch = new int[patchSize][patchSize];
        int bit = patchSize * patchSize - 1;
        for (int pr = 0; pr < patchSize; pr++) {
            for (int pc = 0; pc < patchSize; pc++) {
                patch[pr][pc] = (id >>> bit) & 1;
                bit--;
            }
        }
        return patch;
    }
}
