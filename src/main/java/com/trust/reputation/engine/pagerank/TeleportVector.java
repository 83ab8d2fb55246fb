package com.trust.reputation.engine.pagerank;

/**
 * Restart distribution biased toward economically committed nodes:
 * p_i proportional to 1 + bias * econ_i.
 */
public final class TeleportVector {

    private TeleportVector() {}

    /**
     * @param economicSignal per-node signal in [0, 1]
     * @param bias           0 gives the uniform distribution
     */
    public static double[] economicallyBiased(double[] economicSignal, double bias) {
        int n = economicSignal.length;
        double[] p = new double[n];
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            p[i] = 1.0 + bias * economicSignal[i];
            total += p[i];
        }
        for (int i = 0; i < n; i++) {
            p[i] /= total;
        }
        return p;
    }
}
