package com.anodi.server.tools;

import com.anodi.server.ai.BinaryImage;
import com.anodi.server.config.EvaluationConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextureDatasetEvaluateTest {

    @Test
    public void testSampleRotations() {
        EvaluationConfig config = new EvaluationConfig();
        config.sampling = new EvaluationConfig.SamplingConfig();
        config.sampling.count = 4;
        config.sampling.size = 6;
        config.sampling.seed = 7L;
        config.sampling.rotations = Arrays.asList(0, 90);

        BinaryImage reference = BinaryImage.zeros(10, 16);
        List<String> names = new ArrayList<>();
        List<List<BinaryImage>> groups = new ArrayList<>();
        TextureDatasetEvaluate.sampleRotations(reference, config, names, groups);

        assertEquals(Arrays.asList("0 rotation", "90 rotation"), names);
        assertEquals(2, groups.size());
        for (List<BinaryImage> group : groups) {
            assertEquals(4, group.size());
            for (BinaryImage img : group) {
                assertEquals(6, img.getHeight());
                assertEquals(6, img.getWidth());
            }
        }
    }
}
