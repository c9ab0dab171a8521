package com.anodi.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class PersistenceIntegrationTest {

    private static final String TEST_DB = "test_anodi_cache.db";
    private TextureImageDao imageDao;
    private HistogramLevelDao levelDao;

    @BeforeEach
    public void setup() throws SQLException {
        deleteDbFiles();
        SqliteInitializer.initialize(TEST_DB);
        imageDao = new TextureImageDao(TEST_DB);
        levelDao = new HistogramLevelDao(TEST_DB);
    }

    @AfterEach
    public void teardown() {
        deleteDbFiles();
    }

    private static void deleteDbFiles() {
        for (String suffix : new String[] { "", "-wal", "-shm" }) {
            File f = new File(TEST_DB + suffix);
            if (f.exists()) {
                f.delete();
            }
        }
    }

    @Test
    public void testTextureImageCrud() throws SQLException {
        TextureImage img1 = imageDao.getOrCreateByHash("hash1", 64, 48);
        Assertions.assertNotNull(img1);
        Assertions.assertEquals("hash1", img1.getContentHash());
        Assertions.assertEquals(64, img1.getHeight());
        Assertions.assertEquals(48, img1.getWidth());

        // Retrieve existing
        TextureImage img2 = imageDao.getOrCreateByHash("hash1", 64, 48);
        Assertions.assertEquals(img1.getId(), img2.getId());

        Optional<TextureImage> found = imageDao.findByHash("hash1");
        Assertions.assertTrue(found.isPresent());
        Assertions.assertEquals(img1.getId(), found.get().getId());
        Assertions.assertFalse(imageDao.findByHash("missing").isPresent());
    }

    @Test
    public void testHistogramLevelCrud() throws SQLException {
        TextureImage img = imageDao.getOrCreateByHash("h1", 4, 4);
        int[] full = new int[16];
        full[0] = 7;
        full[15] = 2;
        int[] half = new int[16];
        half[0] = 1;

        levelDao.upsertLevels(img.getId(), "n=2;f=1,2;tie=ZERO", Arrays.asList(
                new HistogramLevelDao.StoredLevel(1, 4, 4, full),
                new HistogramLevelDao.StoredLevel(2, 2, 2, half)));

        List<HistogramLevelDao.StoredLevel> loaded = levelDao.loadLevels(img.getId(), "n=2;f=1,2;tie=ZERO");
        Assertions.assertEquals(2, loaded.size());
        Assertions.assertEquals(1, loaded.get(0).factor);
        Assertions.assertArrayEquals(full, loaded.get(0).counts);
        Assertions.assertEquals(2, loaded.get(1).height);
        Assertions.assertArrayEquals(half, loaded.get(1).counts);
        Assertions.assertTrue(levelDao.loadLevels(img.getId(), "n=3;f=1;tie=ZERO").isEmpty());

        // Update
        int[] full2 = new int[16];
        full2[5] = 9;
        levelDao.upsertLevels(img.getId(), "n=2;f=1,2;tie=ZERO",
                Collections.singletonList(new HistogramLevelDao.StoredLevel(1, 4, 4, full2)));
        loaded = levelDao.loadLevels(img.getId(), "n=2;f=1,2;tie=ZERO");
        Assertions.assertEquals(2, loaded.size());
        Assertions.assertArrayEquals(full2, loaded.get(0).counts);

        // Delete
        Assertions.assertEquals(2, levelDao.deleteBySignature("n=2;f=1,2;tie=ZERO"));
        Assertions.assertTrue(levelDao.loadLevels(img.getId(), "n=2;f=1,2;tie=ZERO").isEmpty());
    }

    @Test
    public void testDeleteByImage() throws SQLException {
        TextureImage a = imageDao.getOrCreateByHash("a", 3, 3);
        TextureImage b = imageDao.getOrCreateByHash("b", 3, 3);
        HistogramLevelDao.StoredLevel level = new HistogramLevelDao.StoredLevel(1, 3, 3, new int[] { 4, 0 });
        levelDao.upsertLevels(a.getId(), "n=1;f=1;tie=ZERO", Collections.singletonList(level));
        levelDao.upsertLevels(b.getId(), "n=1;f=1;tie=ZERO", Collections.singletonList(level));

        Assertions.assertEquals(1, levelDao.deleteByImage(a.getId()));
        Assertions.assertTrue(levelDao.loadLevels(a.getId(), "n=1;f=1;tie=ZERO").isEmpty());
        Assertions.assertEquals(1, levelDao.loadLevels(b.getId(), "n=1;f=1;tie=ZERO").size());
    }
}
