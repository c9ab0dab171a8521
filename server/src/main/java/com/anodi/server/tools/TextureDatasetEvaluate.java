package com.anodi.server.tools;

import com.anodi.server.ai.AnodiEvaluator;
import com.anodi.server.ai.BinaryImage;
import com.anodi.server.ai.DistanceMatrix;
import com.anodi.server.ai.ScoreReport;
import com.anodi.server.config.EvaluationConfig;
import com.anodi.server.image.PngImageLoader;
import com.anodi.server.image.SubImageSampler;
import com.anodi.server.service.AnodiEvaluationService;
import com.anodi.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Offline scoring of binary textures against a reference exemplar.
 * Usage: TextureDatasetEvaluate <reference.png> [imagesDir] [matrix.csv]
 *
 * With an images directory, every PNG in it is scored as one set. Without
 * one, sub-images are sampled from the reference at each configured rotation
 * and every rotation group is scored separately. The distance matrix of all
 * images, reference last, is written as CSV for an external MDS step.
 */
public class TextureDatasetEvaluate {

    private static final Logger logger = LoggerFactory.getLogger(TextureDatasetEvaluate.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: TextureDatasetEvaluate <reference.png> [imagesDir] [matrix.csv]");
            System.exit(1);
        }

        File referenceFile = new File(args[0]);
        if (!referenceFile.isFile()) {
            System.err.println("Invalid reference image: " + args[0]);
            System.exit(1);
        }

        try {
            EvaluationConfig config = EvaluationConfig.loadDefault();
            AnodiEvaluationService service = new AnodiEvaluationService(config);
            AnodiEvaluator evaluator = service.evaluator(service.getBaseSettings());

            BinaryImage reference = PngImageLoader.load(referenceFile);
            logger.info("Reference {} loaded as {}", referenceFile, reference);

            List<String> groupNames = new ArrayList<>();
            List<List<BinaryImage>> groups = new ArrayList<>();
            if (args.length >= 2) {
                Path dir = Paths.get(args[1]);
                if (!Files.isDirectory(dir)) {
                    System.err.println("Invalid images directory: " + args[1]);
                    System.exit(1);
                }
                groupNames.add(dir.getFileName().toString());
                groups.add(PngImageLoader.loadDirectory(dir, null));
            } else {
                sampleRotations(reference, config, groupNames, groups);
            }

            List<BinaryImage> all = new ArrayList<>();
            System.out.println(String.format("%-16s %14s %10s", "set", "inconsistency", "diversity"));
            for (int g = 0; g < groups.size(); g++) {
                ScoreReport report = evaluator.evaluate(groups.get(g), reference);
                System.out.println(String.format("%-16s %14.4f %10.4f", groupNames.get(g),
                        report.getInconsistency(), report.getDiversity()));
                if (!report.getSkippedResolutions().isEmpty()) {
                    logger.warn("Set {} skipped resolution levels: {}", groupNames.get(g),
                            report.getSkippedResolutions());
                }
                all.addAll(groups.get(g));
            }

            DistanceMatrix matrix = evaluator.distanceMatrix(all, reference);
            Path out = args.length >= 3 ? Paths.get(args[2])
                    : Paths.get(DataPathResolver.resolveDataDirectory(config), "anodi_distance_matrix.csv");
            Files.write(out, matrix.toCsv().getBytes(StandardCharsets.UTF_8));
            logger.info("Wrote {}x{} distance matrix (reference in row {}) to {}", matrix.getSize(),
                    matrix.getSize(), matrix.getReferenceIndex(), out.toAbsolutePath());

        } catch (IOException e) {
            logger.error("Failed to read or write image data", e);
            System.exit(1);
        } catch (IllegalArgumentException e) {
            logger.error("Evaluation rejected: {}", e.getMessage());
            System.exit(2);
        }
    }

    static void sampleRotations(BinaryImage reference, EvaluationConfig config, List<String> groupNames,
            List<List<BinaryImage>> groups) {
        EvaluationConfig.SamplingConfig sampling = config.sampling != null ? config.sampling
                : new EvaluationConfig.SamplingConfig();
        int count = sampling.count != null ? sampling.count : 10;
        int size = sampling.size != null ? sampling.size : 64;
        long seed = sampling.seed != null ? sampling.seed : 42L;
        List<Integer> rotations = sampling.rotations != null ? sampling.rotations : Arrays.asList(0, 90, 180);

        SubImageSampler sampler = new SubImageSampler(seed);
        for (int degrees : rotations) {
            BinaryImage rotated = SubImageSampler.rotate(reference, degrees);
            List<BinaryImage> samples = sampler.sample(rotated, size, count);
            logger.info("Extracted {} patches of size {}x{} at {} degrees", samples.size(), size, size, degrees);
            groupNames.add(degrees + " rotation");
            groups.add(samples);
        }
    }
}
