package com.trust.reputation.engine.clustering;

import com.trust.reputation.model.Account;

import java.util.List;

/**
 * Working state of one clustering run: accounts in id order, their derived profiles and
 * the similarity matrix. Threshold sweeps reuse one context across steps.
 */
public final class ClusteringContext {

    private final List<AccountProfile> profiles;
    private final SimilarityMatrix matrix;

    ClusteringContext(List<AccountProfile> profiles, SimilarityMatrix matrix) {
        this.profiles = profiles;
        this.matrix = matrix;
    }

    public int size() {
        return profiles.size();
    }

    public SimilarityMatrix matrix() {
        return matrix;
    }

    public double similarity(int i, int j) {
        return matrix.get(i, j);
    }

    public Account account(int index) {
        return profiles.get(index).account();
    }

    public String accountId(int index) {
        return profiles.get(index).id();
    }

    AccountProfile profile(int index) {
        return profiles.get(index);
    }

    /** True if either account lists the other as a connection target. */
    public boolean connected(int i, int j) {
        return profiles.get(i).connectsTo(profiles.get(j)) || profiles.get(j).connectsTo(profiles.get(i));
    }

    public boolean connects(int from, int to) {
        return profiles.get(from).connectsTo(profiles.get(to));
    }
}
