package com.anodi.server.ai;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ScoreReport {
    private final double inconsistency;
    private final double diversity;
    private final DistanceMatrix distanceMatrix;
    // matrix row -> levels skipped for that image
    private final Map<Integer, List<SkippedResolution>> skippedResolutions;

    public ScoreReport(double inconsistency, double diversity, DistanceMatrix distanceMatrix,
            Map<Integer, List<SkippedResolution>> skippedResolutions) {
        this.inconsistency = inconsistency;
        this.diversity = diversity;
        this.distanceMatrix = distanceMatrix;
        this.skippedResolutions = Collections.unmodifiableMap(new LinkedHashMap<>(skippedResolutions));
    }

    public double getInconsistency() {
        return inconsistency;
    }

    public double getDiversity() {
        return diversity;
    }

    public DistanceMatrix getDistanceMatrix() {
        return distanceMatrix;
    }

    public Map<Integer, List<SkippedResolution>> getSkippedResolutions() {
        return skippedResolutions;
    }

    @Override
    public String toString() {
        return String.format("inconsistency: %.4f | diversity: %.4f", inconsistency, diversity);
    }
}
