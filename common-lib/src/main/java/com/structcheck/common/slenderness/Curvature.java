package com.structcheck.common.slenderness;

/** Curvature shape used to pick the equivalent moment factor. */
public enum Curvature {
    /** End moments of the same sign, M1/M2 &gt; 0. */
    DOUBLE,
    /** End moments of opposite sign, M1/M2 &lt; 0. */
    SINGLE,
    ZERO_M1,
    NEGLIGIBLE_MOMENT,
    TRANSVERSE_LOADS
}
