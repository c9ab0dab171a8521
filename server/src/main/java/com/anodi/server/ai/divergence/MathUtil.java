package com.anodi.server.ai.divergence;

import com.anodi.server.ai.ValidationException;

public class MathUtil {

    public static final double NORMALIZATION_TOLERANCE = 1e-9;

    /**
     * One bin of KL(a || M) with M = (a + b) / 2, written as
     * a * log(2a / (a + b)), which is finite for every a > 0. Zero when
     * a is zero, whatever b is.
     */
    public static double midpointTerm(double a, double b, LogBase base) {
        if (a <= 0) {
            return 0.0;
        }
        return a * base.log(2.0 * a / (a + b));
    }

    /**
     * Checks that {@code p} is a probability vector: finite, non-negative
     * entries summing to 1 within {@link #NORMALIZATION_TOLERANCE}.
     */
    public static void checkDistribution(double[] p, String name) {
        if (p == null || p.length == 0) {
            throw new ValidationException(name + " must not be empty");
        }
        double sum = 0.0;
        for (int i = 0; i < p.length; i++) {
            if (!(p[i] >= 0) || Double.isInfinite(p[i])) {
                throw new ValidationException(name + " has invalid probability " + p[i] + " at index " + i);
            }
            sum += p[i];
        }
        if (Math.abs(sum - 1.0) > NORMALIZATION_TOLERANCE) {
            throw new ValidationException(name + " is not normalized, sums to " + sum);
        }
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Mean of an empty array");
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
}
