package com.wifi.emitter.positioning.algorithm;

/** How the projections of one reporting interval are fused. */
public enum SynthesisMode {
    /** Largest mutually consistent cluster, then weighted average. */
    CULL,
    /** Median-trimmed weighted average guarded by an agreement check. */
    MEDIAN_SAFE,
    /** Weighted average of everything. */
    NONE
}
