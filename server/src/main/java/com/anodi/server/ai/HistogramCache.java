package com.anodi.server.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Histogram bundles of an ordered list of images, each computed exactly once.
 * All bundles are built before the cache is handed out and nothing writes to
 * it afterwards, so distance tasks may read it from any thread.
 */
public class HistogramCache {

    private static final Logger logger = LoggerFactory.getLogger(HistogramCache.class);

    private final List<MultiResolutionHistogram> bundles;

    private HistogramCache(List<MultiResolutionHistogram> bundles) {
        this.bundles = bundles;
    }

    public static HistogramCache build(List<BinaryImage> images, HistogramSource source, boolean parallel) {
        long start = System.currentTimeMillis();
        MultiResolutionHistogram[] out = new MultiResolutionHistogram[images.size()];
        IntStream indices = IntStream.range(0, images.size());
        if (parallel) {
            indices = indices.parallel();
        }
        indices.forEach(i -> out[i] = source.compute(images.get(i)));

        logger.debug("Built {} histogram bundles ({}) in {} ms", out.length, source.getSignature(),
                System.currentTimeMillis() - start);
        return new HistogramCache(Collections.unmodifiableList(Arrays.asList(out)));
    }

    public int size() {
        return bundles.size();
    }

    public MultiResolutionHistogram get(int index) {
        return bundles.get(index);
    }

    public Map<Integer, List<SkippedResolution>> skippedByIndex() {
        Map<Integer, List<SkippedResolution>> skipped = new LinkedHashMap<>();
        for (int i = 0; i < bundles.size(); i++) {
            List<SkippedResolution> s = bundles.get(i).getSkipped();
            if (!s.isEmpty()) {
                skipped.put(i, s);
            }
        }
        return skipped;
    }
}
