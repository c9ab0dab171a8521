package com.anodi.server.ai;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BinaryImageTest {

    @Test
    void testRejectsNonBinaryPixels() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> BinaryImage.of(new int[][] { { 0, 1 }, { 255, 0 } }));
        assertTrue(e.getMessage().contains("(1, 0)"));
    }

    @Test
    void testRejectsRaggedAndEmptyGrids() {
        assertThrows(ValidationException.class, () -> BinaryImage.of(new int[][] { { 0, 1 }, { 0 } }));
        assertThrows(ValidationException.class, () -> BinaryImage.of(new int[0][0]));
        assertThrows(ValidationException.class, () -> BinaryImage.of(null));
    }

    @Test
    void testCopiesInput() {
        int[][] pixels = { { 0, 1 }, { 1, 0 } };
        BinaryImage img = BinaryImage.of(pixels);
        pixels[0][0] = 1;
        assertEquals(0, img.get(0, 0));
        img.toArray()[0][1] = 0;
        assertEquals(1, img.get(0, 1));
    }

    @Test
    void testCrop() {
        BinaryImage img = BinaryImage.of(new int[][] {
                { 0, 1, 0 },
                { 1, 1, 0 },
                { 0, 0, 1 } });
        BinaryImage crop = img.crop(1, 1, 2, 2);
        assertArrayEquals(new int[][] { { 1, 0 }, { 0, 1 } }, crop.toArray());
        assertThrows(ValidationException.class, () -> img.crop(2, 2, 2, 2));
    }

    @Test
    void testRotate90CounterClockwise() {
        BinaryImage img = BinaryImage.of(new int[][] {
                { 1, 0, 0 },
                { 0, 0, 1 } });
        BinaryImage rotated = img.rotate90();
        assertEquals(3, rotated.getHeight());
        assertEquals(2, rotated.getWidth());
        assertArrayEquals(new int[][] { { 0, 1 }, { 0, 0 }, { 1, 0 } }, rotated.toArray());
        assertArrayEquals(img.toArray(), rotated.rotate90().rotate90().rotate90().toArray());
    }

    @Test
    void testContentHashDependsOnShapeAndBits() {
        BinaryImage a = BinaryImage.of(new int[][] { { 0, 1, 0, 1 } });
        BinaryImage b = BinaryImage.of(new int[][] { { 0, 1 }, { 0, 1 } });
        BinaryImage c = BinaryImage.of(new int[][] { { 0, 1, 0, 1 } });
        assertNotEquals(a.contentHash(), b.contentHash());
        assertEquals(a.contentHash(), c.contentHash());
        assertEquals(64, a.contentHash().length());
    }
}
