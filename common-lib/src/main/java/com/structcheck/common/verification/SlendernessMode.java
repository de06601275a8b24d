package com.structcheck.common.verification;

/** How slenderness effects enter a flexocompression check. */
public enum SlendernessMode {
    /** First-order demands against the unreduced curve. */
    IGNORE,
    /** Slender members: Mc = δns · max(|Mu|, M2,min) for compressive demands. */
    MAGNIFY_DEMAND,
    /** Compressive side of the curve scaled by the empirical buckling factor. */
    REDUCE_CAPACITY
}
