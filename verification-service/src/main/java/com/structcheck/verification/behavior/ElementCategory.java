package com.structcheck.verification.behavior;

/** Element kind as delivered by the analysis model, before geometric classification. */
public enum ElementCategory {
    COLUMN,
    PIER,
    BEAM,
    DROP_BEAM;

    public boolean isVertical() {
        return this == COLUMN || this == PIER;
    }
}
