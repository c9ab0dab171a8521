package com.anodi.server.ai;

/**
 * Value given to a downsampled block with exactly as many ones as zeros.
 */
public enum TieBreak {
    ZERO(0),
    ONE(1);

    private final int value;

    TieBreak(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }
}
