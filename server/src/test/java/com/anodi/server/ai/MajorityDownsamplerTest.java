package com.anodi.server.ai;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MajorityDownsamplerTest {

    @Test
    void testMajorityVote() {
        BinaryImage img = BinaryImage.of(new int[][] {
                { 1, 1, 0, 0 },
                { 1, 0, 0, 1 },
                { 0, 0, 1, 1 },
                { 0, 0, 1, 1 } });
        BinaryImage out = MajorityDownsampler.downsample(img, 2, TieBreak.ZERO);
        assertArrayEquals(new int[][] { { 1, 0 }, { 0, 1 } }, out.toArray());
    }

    @Test
    void testTieBreak() {
        BinaryImage img = BinaryImage.of(new int[][] {
                { 1, 0 },
                { 0, 1 } });
        assertEquals(0, MajorityDownsampler.downsample(img, 2, TieBreak.ZERO).get(0, 0));
        assertEquals(1, MajorityDownsampler.downsample(img, 2, TieBreak.ONE).get(0, 0));
    }

    @Test
    void testPartialEdgeBlocks() {
        // 3x5 at factor 2 -> 2x3; last row and column blocks are partial
        BinaryImage img = BinaryImage.of(new int[][] {
                { 0, 0, 1, 1, 1 },
                { 0, 0, 1, 1, 0 },
                { 1, 1, 0, 0, 1 } });
        BinaryImage out = MajorityDownsampler.downsample(img, 2, TieBreak.ZERO);
        assertEquals(2, out.getHeight());
        assertEquals(3, out.getWidth());
        // bottom-left block is (1,1): two ones out of two
        // bottom-right block is the single pixel 1
        // top-right block is {1, 0}: tie -> 0
        assertArrayEquals(new int[][] { { 0, 1, 0 }, { 1, 0, 1 } }, out.toArray());
    }

    @Test
    void testFactorOneIsIdentity() {
        BinaryImage img = BinaryImage.of(HistogramBuilderTest.VERTICAL_LINE);
        assertSame(img, MajorityDownsampler.downsample(img, 1, TieBreak.ZERO));
    }

    @Test
    void testNonPositiveFactor() {
        BinaryImage img = BinaryImage.zeros(4, 4);
        assertThrows(ConfigurationException.class, () -> MajorityDownsampler.downsample(img, 0, TieBreak.ZERO));
    }

    @Test
    void testDownsampledSizeRoundsUp() {
        assertEquals(3, MajorityDownsampler.downsampledSize(5, 2));
        assertEquals(2, MajorityDownsampler.downsampledSize(4, 2));
        assertEquals(1, MajorityDownsampler.downsampledSize(3, 4));
    }
}
