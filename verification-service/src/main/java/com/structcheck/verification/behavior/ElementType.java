package com.structcheck.verification.behavior;

/**
 * Geometric classification of an element.
 *
 * <p>Piers are classified by lw/tw and hw/lw:
 * <pre>
 *   lw/tw &lt; 4                  → column
 *   hw/lw ≥ 2                   → wall
 *   hw/lw &lt; 2, lw/tw ≤ 6       → wall pier, alternate method
 *   hw/lw &lt; 2, lw/tw &gt; 6       → squat wall
 * </pre>
 */
public enum ElementType {
    BEAM,
    DROP_BEAM,
    COLUMN_NONSEISMIC,
    COLUMN_SEISMIC,
    WALL,
    WALL_PIER_ALTERNATE,
    WALL_SQUAT;

    public boolean isColumn() {
        return this == COLUMN_SEISMIC || this == COLUMN_NONSEISMIC;
    }

    public boolean isWall() {
        return this == WALL || this == WALL_PIER_ALTERNATE || this == WALL_SQUAT;
    }

    public boolean isBeam() {
        return this == BEAM || this == DROP_BEAM;
    }
}
