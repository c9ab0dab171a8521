package com.anodi.server.ai;

import com.anodi.db.HistogramLevelDao;
import com.anodi.db.TextureImage;
import com.anodi.db.TextureImageDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps histogram bundles in SQLite, keyed by image content and histogram
 * signature. A bundle is only served from the database when every usable
 * level is present; otherwise it is recomputed and stored.
 */
public class CachedHistogramSource implements HistogramSource {

    private static final Logger logger = LoggerFactory.getLogger(CachedHistogramSource.class);

    private final MultiResolutionHistogramBuilder delegate;
    private final TextureImageDao imageDao;
    private final HistogramLevelDao levelDao;
    // SQLite allows one writer; bundle computation itself runs outside this lock
    private final Object dbLock = new Object();

    public CachedHistogramSource(MultiResolutionHistogramBuilder delegate,
            TextureImageDao imageDao,
            HistogramLevelDao levelDao) {
        this.delegate = delegate;
        this.imageDao = imageDao;
        this.levelDao = levelDao;
    }

    @Override
    public String getSignature() {
        return delegate.getSignature();
    }

    @Override
    public MultiResolutionHistogram compute(BinaryImage image) {
        String signature = delegate.getSignature();
        String hash = image.contentHash();
        try {
            TextureImage row;
            List<HistogramLevelDao.StoredLevel> stored;
            synchronized (dbLock) {
                row = imageDao.getOrCreateByHash(hash, image.getHeight(), image.getWidth());
                stored = levelDao.loadLevels(row.getId(), signature);
            }

            MultiResolutionHistogram cached = assemble(image, stored);
            if (cached != null) {
                logger.debug("Cache HIT for image {} histograms {}", hash, signature);
                return cached;
            }

            logger.debug("Cache MISS for image {} histograms {}", hash, signature);
            MultiResolutionHistogram bundle = delegate.compute(image);

            List<HistogramLevelDao.StoredLevel> toStore = new ArrayList<>();
            for (MultiResolutionHistogram.Level level : bundle.getLevels()) {
                toStore.add(new HistogramLevelDao.StoredLevel(level.getFactor(), level.getHeight(),
                        level.getWidth(), level.getCounts().countsArray()));
            }
            synchronized (dbLock) {
                levelDao.upsertLevels(row.getId(), signature, toStore);
            }
            return bundle;

        } catch (SQLException e) {
            logger.error("Database error in CachedHistogramSource, falling back to direct computation", e);
            return delegate.compute(image);
        }
    }

    private MultiResolutionHistogram assemble(BinaryImage image, List<HistogramLevelDao.StoredLevel> stored) {
        if (stored.isEmpty()) {
            return null;
        }
        Map<Integer, HistogramLevelDao.StoredLevel> byFactor = new HashMap<>();
        for (HistogramLevelDao.StoredLevel level : stored) {
            byFactor.put(level.factor, level);
        }

        int patchSize = delegate.getPatchSize();
        List<MultiResolutionHistogram.Level> levels = new ArrayList<>();
        List<SkippedResolution> skipped = new ArrayList<>();
        try {
            for (int factor : delegate.getFactors()) {
                SkippedResolution skip = MultiResolutionHistogramBuilder.skipFor(
                        image.getHeight(), image.getWidth(), patchSize, factor);
                if (skip != null) {
                    skipped.add(skip);
                    continue;
                }
                HistogramLevelDao.StoredLevel level = byFactor.get(factor);
                if (level == null) {
                    return null;
                }
                Histogram counts = Histogram.ofCounts(patchSize, level.counts);
                if (counts.getPatchTotal() != HistogramBuilder.patchCount(level.height, level.width, patchSize)) {
                    logger.warn("Stored histogram for factor {} has {} patches, expected {}; recomputing",
                            factor, counts.getPatchTotal(),
                            HistogramBuilder.patchCount(level.height, level.width, patchSize));
                    return null;
                }
                levels.add(new MultiResolutionHistogram.Level(factor, level.height, level.width, counts));
            }
        } catch (IllegalArgumentException e) {
            logger.warn("Unreadable cached histogram for {}, recomputing: {}", image, e.getMessage());
            return null;
        }
        return new MultiResolutionHistogram(patchSize, levels, skipped);
    }
}
