package com.anodi.server.ai.divergence;

import com.anodi.server.ai.Histogram;
import com.anodi.server.ai.ValidationException;

/**
 * Jensen-Shannon divergence between two probability vectors:
 *
 * <pre>
 * M = (P + Q) / 2
 * JSD(P, Q) = KL(P || M) / 2 + KL(Q || M) / 2
 * </pre>
 *
 * M_i is zero only where P_i and Q_i are both zero, and those terms are
 * defined as zero, so no smoothing is applied. Each bin is evaluated in place
 * with {@link MathUtil#midpointTerm}; no M vector is allocated. The result is
 * symmetric, zero for identical inputs and bounded by
 * {@link LogBase#upperBound()}.
 */
public class JensenShannonDivergence {

    // largest floating-point excursion outside [0, bound] that is clamped
    static final double ROUND_OFF = 1e-12;

    private final LogBase base;

    public JensenShannonDivergence(LogBase base) {
        this.base = base;
    }

    public LogBase getBase() {
        return base;
    }

    public double upperBound() {
        return base.upperBound();
    }

    /**
     * Both histograms must be normalized views of the same patch size. Bins
     * are read in place, nothing is copied.
     */
    public double divergence(Histogram a, Histogram b) {
        if (a.getPatchSize() != b.getPatchSize() || a.length() != b.length()) {
            throw new ValidationException("Histograms have different patch sizes: "
                    + a.getPatchSize() + " vs " + b.getPatchSize());
        }
        if (!a.isNormalized() || !b.isNormalized()) {
            throw new ValidationException("Divergence needs normalized histograms");
        }
        double sumP = 0.0;
        double sumQ = 0.0;
        for (int i = 0; i < a.length(); i++) {
            if (a.getCount(i) == 0 && b.getCount(i) == 0) {
                continue;
            }
            double p = a.get(i);
            double q = b.get(i);
            sumP += MathUtil.midpointTerm(p, q, base);
            sumQ += MathUtil.midpointTerm(q, p, base);
        }
        return finish(sumP, sumQ);
    }

    public double divergence(double[] p, double[] q) {
        if (p == null || q == null || p.length != q.length) {
            throw new ValidationException("Histograms must have the same length: "
                    + (p == null ? "null" : String.valueOf(p.length)) + " vs "
                    + (q == null ? "null" : String.valueOf(q.length)));
        }
        MathUtil.checkDistribution(p, "P");
        MathUtil.checkDistribution(q, "Q");

        double sumP = 0.0;
        double sumQ = 0.0;
        for (int i = 0; i < p.length; i++) {
            sumP += MathUtil.midpointTerm(p[i], q[i], base);
            sumQ += MathUtil.midpointTerm(q[i], p[i], base);
        }
        return finish(sumP, sumQ);
    }

    private double finish(double klP, double klQ) {
        double jsd = 0.5 * (klP + klQ);
        double bound = base.upperBound();
        if (!Double.isFinite(jsd) || jsd < -ROUND_OFF || jsd > bound + ROUND_OFF) {
            throw new IllegalStateException("Jensen-Shannon divergence " + jsd + " outside [0, " + bound
                    + "] (KL terms " + klP + ", " + klQ + ")");
        }
        return Math.max(0.0, Math.min(bound, jsd));
    }
}
