package com.trust.reputation.model;

/**
 * What to do with a candidate group larger than maxClusterSize.
 */
public enum OversizePolicy {
    /** Re-cluster the component at a stricter threshold; truncate if that never fits. */
    SPLIT,
    /** Keep the members most similar to the rest of the component. */
    TRUNCATE,
    /** Drop the component. */
    REJECT
}
