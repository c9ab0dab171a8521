package com.anodi.server.service;

import com.anodi.db.HistogramLevelDao;
import com.anodi.db.TextureImage;
import com.anodi.db.TextureImageDao;
import com.anodi.server.config.EvaluationConfig;
import com.anodi.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.Optional;

@Service
public class CacheControlService {

    private static final Logger logger = LoggerFactory.getLogger(CacheControlService.class);

    private final TextureImageDao imageDao;
    private final HistogramLevelDao levelDao;

    public CacheControlService() {
        this(DataPathResolver.resolveDbPath(EvaluationConfig.loadDefault()));
    }

    public CacheControlService(String dbPath) {
        this.imageDao = new TextureImageDao(dbPath);
        this.levelDao = new HistogramLevelDao(dbPath);
    }

    /**
     * Clears all cached histograms built with one signature.
     * Use this when the histogram or downsampling code changes.
     */
    public int clearSignature(String signature) {
        try {
            int removed = levelDao.deleteBySignature(signature);
            logger.info("Removed {} cached histogram levels for {}", removed, signature);
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear histogram cache for " + signature, e);
        }
    }

    /**
     * Clears every cached histogram of the image with the given content hash.
     */
    public int evictImage(String contentHash) {
        try {
            Optional<TextureImage> img = imageDao.findByHash(contentHash);
            if (img.isEmpty()) {
                return 0;
            }
            return levelDao.deleteByImage(img.get().getId());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to evict cached histograms for image " + contentHash, e);
        }
    }
}
