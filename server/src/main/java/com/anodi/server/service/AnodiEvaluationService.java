package com.anodi.server.service;

import com.anodi.db.HistogramLevelDao;
import com.anodi.db.SqliteInitializer;
import com.anodi.db.TextureImageDao;
import com.anodi.server.ai.AnodiEvaluator;
import com.anodi.server.ai.BinaryImage;
import com.anodi.server.ai.CachedHistogramSource;
import com.anodi.server.ai.DistanceMatrix;
import com.anodi.server.ai.EvaluationSettings;
import com.anodi.server.ai.HistogramSource;
import com.anodi.server.ai.MultiResolutionHistogramBuilder;
import com.anodi.server.ai.ScoreReport;
import com.anodi.server.ai.ValidationException;
import com.anodi.server.config.EvaluationConfig;
import com.anodi.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds evaluators from anodi_config.json. Requests may override the patch
 * size and resolution factors; each request gets its own settings value.
 */
@Service
public class AnodiEvaluationService {

    private static final Logger logger = LoggerFactory.getLogger(AnodiEvaluationService.class);

    private final EvaluationSettings baseSettings;
    private final TextureImageDao imageDao;
    private final HistogramLevelDao levelDao;

    public AnodiEvaluationService() {
        this(EvaluationConfig.loadDefault());
    }

    public AnodiEvaluationService(EvaluationConfig config) {
        this.baseSettings = config.toSettings();
        if (DataPathResolver.isCacheEnabled(config)) {
            String dbPath = DataPathResolver.resolveDbPath(config);
            try {
                SqliteInitializer.initialize(dbPath);
                logger.info("Initialized SQLite histogram cache at {}", dbPath);
            } catch (SQLException e) {
                logger.error("Failed to initialize SQLite", e);
                throw new RuntimeException(e);
            }
            this.imageDao = new TextureImageDao(dbPath);
            this.levelDao = new HistogramLevelDao(dbPath);
        } else {
            this.imageDao = null;
            this.levelDao = null;
        }
        logger.info("Evaluation defaults: {}, persistent cache {}", baseSettings,
                imageDao != null ? "on" : "off");
    }

    public EvaluationSettings getBaseSettings() {
        return baseSettings;
    }

    public boolean isCacheEnabled() {
        return imageDao != null;
    }

    public EvaluationSettings resolveSettings(Integer patchSize, List<Integer> factors) {
        EvaluationSettings settings = baseSettings;
        if (patchSize != null) {
            settings = settings.withPatchSize(patchSize);
        }
        if (factors != null) {
            settings = settings.withFactors(factors);
        }
        return settings;
    }

    public AnodiEvaluator evaluator(EvaluationSettings settings) {
        MultiResolutionHistogramBuilder builder = new MultiResolutionHistogramBuilder(settings);
        HistogramSource source = builder;
        if (imageDao != null) {
            source = new CachedHistogramSource(builder, imageDao, levelDao);
        }
        return new AnodiEvaluator(settings, source);
    }

    public ScoreReport evaluate(int[][] reference, List<int[][]> images, Integer patchSize, List<Integer> factors) {
        if (reference == null) {
            throw new ValidationException("Evaluation needs a reference image");
        }
        BinaryImage ref = BinaryImage.of(reference);
        List<BinaryImage> set = toImages(images);
        return evaluator(resolveSettings(patchSize, factors)).evaluate(set, ref);
    }

    public DistanceMatrix distanceMatrix(List<int[][]> images, int[][] reference, Integer patchSize,
            List<Integer> factors) {
        List<BinaryImage> set = toImages(images);
        BinaryImage ref = reference != null ? BinaryImage.of(reference) : null;
        return evaluator(resolveSettings(patchSize, factors)).distanceMatrix(set, ref);
    }

    private static List<BinaryImage> toImages(List<int[][]> images) {
        if (images == null || images.isEmpty()) {
            throw new ValidationException("Image set must not be empty");
        }
        List<BinaryImage> out = new ArrayList<>(images.size());
        for (int[][] pixels : images) {
            out.add(BinaryImage.of(pixels));
        }
        return out;
    }
}
