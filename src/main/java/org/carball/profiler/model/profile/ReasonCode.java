package org.carball.profiler.model.profile;

public enum ReasonCode {
    HIGH_NULL_RATE,
    TOP1_DOMINANT,
    MIN_EQ_MAX,
    TOPK_LIMITED
}
