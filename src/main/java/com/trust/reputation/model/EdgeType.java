package com.trust.reputation.model;

public enum EdgeType {
    FOLLOW,
    ENDORSE,
    COLLABORATE,
    REVIEW,
    PAYMENT,
    STAKE,
    TRUST
}
