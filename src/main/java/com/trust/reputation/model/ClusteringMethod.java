package com.trust.reputation.model;

public enum ClusteringMethod {
    DBSCAN,
    CONNECTIVITY,
    HIERARCHICAL,
    SIMILARITY
}
