package com.structcheck.common.slenderness;

/** How the compressive capacity of a member is reduced for slenderness. */
public enum ReductionPolicy {
    /** λ ≤ 25: short member. */
    NONE,
    /** 25 &lt; λ ≤ 100: empirical buckling factor. */
    EMPIRICAL,
    /** λ &gt; 100: no capacity is assigned, the member must be redesigned. */
    REJECTED
}
