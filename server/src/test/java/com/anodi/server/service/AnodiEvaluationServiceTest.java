package com.anodi.server.service;

import com.anodi.server.ai.DistanceMatrix;
import com.anodi.server.ai.EvaluationSettings;
import com.anodi.server.ai.ScoreReport;
import com.anodi.server.ai.ValidationException;
import com.anodi.server.config.EvaluationConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AnodiEvaluationServiceTest {

    private static final int[][] LINE = { { 0, 1, 0 }, { 0, 1, 0 }, { 0, 1, 0 } };
    private static final int[][] BLANK = new int[3][3];

    @TempDir
    Path tempDir;

    @Test
    public void testRequestOverridesDoNotLeak() {
        EvaluationConfig config = new EvaluationConfig();
        config.patchSize = 2;
        config.factors = Arrays.asList(1, 2);
        AnodiEvaluationService service = new AnodiEvaluationService(config);

        EvaluationSettings overridden = service.resolveSettings(3, Collections.singletonList(1));
        assertEquals(3, overridden.getPatchSize());
        assertArrayEquals(new int[] { 1 }, overridden.getFactors());

        EvaluationSettings base = service.resolveSettings(null, null);
        assertEquals(2, base.getPatchSize());
        assertArrayEquals(new int[] { 1, 2 }, base.getFactors());
        assertSame(service.getBaseSettings(), base);
    }

    @Test
    public void testEvaluate() {
        AnodiEvaluationService service = new AnodiEvaluationService(new EvaluationConfig());
        assertFalse(service.isCacheEnabled());

        List<int[][]> images = Arrays.asList(LINE, BLANK);
        ScoreReport report = service.evaluate(LINE, images, null, null);
        assertEquals(Math.log(2.0) / 2.0, report.getInconsistency(), 1e-12);
        assertEquals(Math.log(2.0), report.getDiversity(), 1e-12);

        DistanceMatrix matrix = service.distanceMatrix(images, null, null, null);
        assertEquals(2, matrix.getSize());
        assertFalse(matrix.hasReference());

        assertThrows(ValidationException.class, () -> service.evaluate(null, images, null, null));
        assertThrows(ValidationException.class, () -> service.evaluate(LINE, Collections.emptyList(), null, null));
        assertThrows(ValidationException.class,
                () -> service.evaluate(LINE, Collections.singletonList(new int[][] { { 0, 2 }, { 1, 1 } }), null, null));
    }

    @Test
    public void testPersistentCache() {
        EvaluationConfig config = new EvaluationConfig();
        config.anodi_data_directory = tempDir.toString();
        config.cache = new EvaluationConfig.CacheConfig();
        config.cache.enabled = true;
        config.cache.fileName = "service_cache.db";
        AnodiEvaluationService service = new AnodiEvaluationService(config);
        assertTrue(service.isCacheEnabled());
        assertTrue(new File(tempDir.toFile(), "service_cache.db").exists());

        List<int[][]> images = Arrays.asList(LINE, BLANK, LINE);
        ScoreReport cold = service.evaluate(LINE, images, null, null);
        ScoreReport warm = service.evaluate(LINE, images, null, null);
        assertEquals(cold.getInconsistency(), warm.getInconsistency());
        assertEquals(cold.getDiversity(), warm.getDiversity());

        CacheControlService cacheControl = new CacheControlService(
                new File(tempDir.toFile(), "service_cache.db").getPath());
        // LINE and BLANK, one level each
        assertEquals(2, cacheControl.clearSignature(service.getBaseSettings().histogramSignature()));
        assertEquals(0, cacheControl.evictImage("no-such-hash"));
    }
}
