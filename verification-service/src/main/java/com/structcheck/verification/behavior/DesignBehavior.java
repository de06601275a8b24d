package com.structcheck.verification.behavior;

/**
 * Design behavior of an element: decides which checks apply, independent of how the
 * element was modelled.
 */
public enum DesignBehavior {
    /** Pure flexure, no significant axial load. */
    FLEXURE_ONLY,
    /** Non-seismic columns and beams with significant axial load. */
    FLEXURE_COMPRESSION,
    SEISMIC_BEAM,
    /** Seismic columns and column-proportioned piers. */
    SEISMIC_COLUMN,
    /** Slender and squat walls. */
    SEISMIC_WALL,
    SEISMIC_WALL_PIER_ALT,
    /** Drop beams are designed as walls with a P-M diagram. */
    DROP_BEAM,
    /** Seismic beam with Pu &gt; Ag·f'c/10. */
    SEISMIC_BEAM_COLUMN;

    public boolean requiresPmDiagram() {
        return switch (this) {
            case FLEXURE_ONLY, SEISMIC_BEAM -> false;
            case FLEXURE_COMPRESSION, SEISMIC_COLUMN, SEISMIC_WALL, SEISMIC_WALL_PIER_ALT,
                 DROP_BEAM, SEISMIC_BEAM_COLUMN -> true;
        };
    }

    public boolean requiresSeismicChecks() {
        return switch (this) {
            case SEISMIC_BEAM, SEISMIC_COLUMN, SEISMIC_WALL, SEISMIC_WALL_PIER_ALT,
                 SEISMIC_BEAM_COLUMN -> true;
            case FLEXURE_ONLY, FLEXURE_COMPRESSION, DROP_BEAM -> false;
        };
    }

    public boolean requiresColumnChecks() {
        return this == SEISMIC_COLUMN || this == SEISMIC_BEAM_COLUMN;
    }

    public boolean requiresWallChecks() {
        return this == SEISMIC_WALL || this == SEISMIC_WALL_PIER_ALT || this == DROP_BEAM;
    }
}
