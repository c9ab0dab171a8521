package com.anodi.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

public class SparseCountsCodecTest {

    @Test
    public void testSparseHistogramSurvivesStorage() {
        int[] input = new int[65536];
        input[0] = 140;
        input[4369] = 12;
        input[65535] = 3;
        byte[] bytes = SparseCountsCodec.toBytes(input);

        // header plus three (index, count) entries
        Assertions.assertEquals(8 + 3 * 8, bytes.length);
        Assertions.assertArrayEquals(input, SparseCountsCodec.fromBytes(bytes));
    }

    @Test
    public void testEmpty() {
        int[] input = {};
        Assertions.assertArrayEquals(input, SparseCountsCodec.fromBytes(SparseCountsCodec.toBytes(input)));
        Assertions.assertNull(SparseCountsCodec.fromBytes(null));
    }

    @Test
    public void testCorruptBlobIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> SparseCountsCodec.fromBytes(new byte[3]));

        byte[] truncated = ByteBuffer.allocate(8).putInt(16).putInt(2).array();
        Assertions.assertThrows(IllegalArgumentException.class, () -> SparseCountsCodec.fromBytes(truncated));

        byte[] badIndex = ByteBuffer.allocate(16).putInt(4).putInt(1).putInt(9).putInt(1).array();
        Assertions.assertThrows(IllegalArgumentException.class, () -> SparseCountsCodec.fromBytes(badIndex));
    }
}
