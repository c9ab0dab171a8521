package com.anodi.server.ai;

import com.anodi.server.ai.divergence.JensenShannonDivergence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Scores a set of binary images with multipoint histograms.
 *
 * <ul>
 * <li>inconsistency: mean distance between each image and a reference</li>
 * <li>diversity: mean distance over all unordered pairs of the set</li>
 * </ul>
 *
 * The distance between two images is the Jensen-Shannon divergence of their
 * histograms, averaged over resolution levels by the configured combination
 * policy. Inputs are validated before any histogram is built, every histogram
 * is built once per call, and only then are distances computed.
 */
public class AnodiEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(AnodiEvaluator.class);

    private final EvaluationSettings settings;
    private final HistogramSource source;
    private final MultiResolutionHistogramBuilder planner;
    private final JensenShannonDivergence divergence;

    public AnodiEvaluator(EvaluationSettings settings) {
        this(settings, new MultiResolutionHistogramBuilder(settings));
    }

    public AnodiEvaluator(EvaluationSettings settings, HistogramSource source) {
        if (!settings.histogramSignature().equals(source.getSignature())) {
            throw new ConfigurationException("Histogram source " + source.getSignature()
                    + " does not match settings " + settings.histogramSignature());
        }
        this.settings = settings;
        this.source = source;
        this.planner = new MultiResolutionHistogramBuilder(settings);
        this.divergence = new JensenShannonDivergence(settings.getLogBase());
    }

    public EvaluationSettings getSettings() {
        return settings;
    }

    public double upperBound() {
        return divergence.upperBound();
    }

    public double inconsistency(List<BinaryImage> images, BinaryImage reference) {
        if (reference == null) {
            throw new ValidationException("Inconsistency needs a reference image");
        }
        List<BinaryImage> all = validate(images, reference);
        HistogramCache cache = HistogramCache.build(all, source, settings.isParallel());
        int ref = images.size();

        double[] toReference = new double[images.size()];
        IntStream indices = IntStream.range(0, images.size());
        if (settings.isParallel()) {
            indices = indices.parallel();
        }
        indices.forEach(i -> toReference[i] = distance(cache.get(i), cache.get(ref)));
        return mean(toReference);
    }

    public double diversity(List<BinaryImage> images) {
        List<BinaryImage> all = validate(images, null);
        HistogramCache cache = HistogramCache.build(all, source, settings.isParallel());
        double[][] d = pairwise(cache);
        return meanOverPairs(d, images.size());
    }

    public DistanceMatrix distanceMatrix(List<BinaryImage> images) {
        return distanceMatrix(images, null);
    }

    /**
     * Pairwise distances among {@code images}, plus the reference as an extra
     * last row and column when it is not null.
     */
    public DistanceMatrix distanceMatrix(List<BinaryImage> images, BinaryImage reference) {
        List<BinaryImage> all = validate(images, reference);
        HistogramCache cache = HistogramCache.build(all, source, settings.isParallel());
        return new DistanceMatrix(pairwise(cache), reference != null ? images.size() : -1);
    }

    /**
     * Computes both scores and the distance matrix (reference last) from one
     * set of histograms.
     */
    public ScoreReport evaluate(List<BinaryImage> images, BinaryImage reference) {
        if (reference == null) {
            throw new ValidationException("Evaluation needs a reference image");
        }
        List<BinaryImage> all = validate(images, reference);
        logger.info("Evaluating {} images against a {}x{} reference with {}", images.size(),
                reference.getHeight(), reference.getWidth(), settings);

        HistogramCache cache = HistogramCache.build(all, source, settings.isParallel());
        double[][] d = pairwise(cache);
        int n = images.size();

        double[] toReference = new double[n];
        for (int i = 0; i < n; i++) {
            toReference[i] = d[i][n];
        }
        ScoreReport report = new ScoreReport(mean(toReference), meanOverPairs(d, n),
                new DistanceMatrix(d, n), cache.skippedByIndex());
        logger.info("Scores: {}", report);
        return report;
    }

    /**
     * Distance between two histogram bundles: divergence at every factor both
     * bundles have, folded by the combination policy.
     */
    public double distance(MultiResolutionHistogram a, MultiResolutionHistogram b) {
        if (a.getPatchSize() != b.getPatchSize()) {
            throw new ValidationException("Bundles use different patch sizes: "
                    + a.getPatchSize() + " vs " + b.getPatchSize());
        }
        List<Integer> factors = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (int factor : settings.getFactors()) {
            MultiResolutionHistogram.Level la = a.levelFor(factor);
            MultiResolutionHistogram.Level lb = b.levelFor(factor);
            if (la != null && lb != null) {
                factors.add(factor);
                values.add(divergence.divergence(la.getProbabilities(), lb.getProbabilities()));
            }
        }
        if (factors.isEmpty()) {
            throw new ConfigurationException("The two images share no usable resolution level");
        }
        int[] f = new int[factors.size()];
        double[] v = new double[values.size()];
        for (int i = 0; i < f.length; i++) {
            f[i] = factors.get(i);
            v[i] = values.get(i);
        }
        return settings.getCombinationPolicy().combine(f, v);
    }

    private double[][] pairwise(HistogramCache cache) {
        int n = cache.size();
        int pairs = n * (n - 1) / 2;
        int[] pi = new int[pairs];
        int[] pj = new int[pairs];
        int k = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                pi[k] = i;
                pj[k] = j;
                k++;
            }
        }

        double[] pairValues = new double[pairs];
        IntStream indices = IntStream.range(0, pairs);
        if (settings.isParallel()) {
            indices = indices.parallel();
        }
        indices.forEach(p -> pairValues[p] = distance(cache.get(pi[p]), cache.get(pj[p])));

        double[][] d = new double[n][n];
        for (int p = 0; p < pairs; p++) {
            d[pi[p]][pj[p]] = pairValues[p];
            d[pj[p]][pi[p]] = pairValues[p];
        }
        return d;
    }

    // Mean of the upper triangle of the first n rows. One image has no pairs and scores 0.
    private static double meanOverPairs(double[][] d, int n) {
        if (n < 2) {
            return 0.0;
        }
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                sum += d[i][j];
                count++;
            }
        }
        return sum / count;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Checks the whole input before any histogram work and returns the images
     * to build histograms for, reference last.
     */
    private List<BinaryImage> validate(List<BinaryImage> images, BinaryImage reference) {
        if (images == null || images.isEmpty()) {
            throw new ValidationException("Image set must not be empty");
        }
        BinaryImage first = images.get(0);
        for (int i = 0; i < images.size(); i++) {
            BinaryImage img = images.get(i);
            if (img == null) {
                throw new ValidationException("Image " + i + " is null");
            }
            if (!img.sameShape(first)) {
                throw new ValidationException("Image " + i + " is " + img.getHeight() + "x" + img.getWidth()
                        + " but image 0 is " + first.getHeight() + "x" + first.getWidth());
            }
        }

        int patchSize = settings.getPatchSize();
        checkPatchFits(first, patchSize, "set images");
        Set<Integer> common = new LinkedHashSet<>(planner.usableFactors(first.getHeight(), first.getWidth()));
        if (reference != null) {
            checkPatchFits(reference, patchSize, "reference image");
            common.retainAll(planner.usableFactors(reference.getHeight(), reference.getWidth()));
        }
        if (common.isEmpty()) {
            throw new ConfigurationException("No resolution factor of " + settings
                    + " is usable for every image");
        }

        List<BinaryImage> all = new ArrayList<>(images);
        if (reference != null) {
            all.add(reference);
        }
        return all;
    }

    private static void checkPatchFits(BinaryImage image, int patchSize, String what) {
        if (patchSize > Math.min(image.getHeight(), image.getWidth())) {
            throw new ConfigurationException("Patch size " + patchSize + " exceeds the " + what + " ("
                    + image.getHeight() + "x" + image.getWidth() + ")");
        }
    }
}
