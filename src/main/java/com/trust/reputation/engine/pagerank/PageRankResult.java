package com.trust.reputation.engine.pagerank;

/**
 * Stationary distribution of one power iteration run. Ranks sum to 1.
 */
public final class PageRankResult {

    private final double[] ranks;
    private final int iterations;
    private final boolean converged;
    private final double finalDelta;

    public PageRankResult(double[] ranks, int iterations, boolean converged, double finalDelta) {
        this.ranks = ranks;
        this.iterations = iterations;
        this.converged = converged;
        this.finalDelta = finalDelta;
    }

    public double[] getRanks() {
        return ranks;
    }

    public int getIterations() {
        return iterations;
    }

    public boolean isConverged() {
        return converged;
    }

    public double getFinalDelta() {
        return finalDelta;
    }
}
