package com.structcheck.verification.behavior;

import com.structcheck.common.model.LoadCombination;
import com.structcheck.common.slenderness.SlendernessInput;
import com.structcheck.common.slenderness.StiffnessCategory;
import com.structcheck.verification.model.MemberDefinition;
import org.springframework.stereotype.Component;

/**
 * Resolves the {@link DesignBehavior} of a classified member.
 *
 * <p>Beams are the only element whose behavior depends on forces: a beam whose largest
 * axial load exceeds Ag·f'c/10 is checked as a beam-column.
 */
@Component
public class DesignBehaviorResolver {

    static final double SIGNIFICANT_AXIAL_DIVISOR = 10.0;

    public ResolvedBehavior resolve(ElementType type, MemberDefinition member) {
        boolean significantAxial = hasSignificantAxial(member);

        DesignBehavior behavior = switch (type) {
            case COLUMN_SEISMIC -> DesignBehavior.SEISMIC_COLUMN;
            case COLUMN_NONSEISMIC -> DesignBehavior.FLEXURE_COMPRESSION;
            case WALL, WALL_SQUAT -> DesignBehavior.SEISMIC_WALL;
            case WALL_PIER_ALTERNATE -> DesignBehavior.SEISMIC_WALL_PIER_ALT;
            case DROP_BEAM -> DesignBehavior.DROP_BEAM;
            case BEAM -> beamBehavior(member.seismic(), significantAxial);
        };

        StiffnessCategory stiffness = switch (type) {
            case WALL, WALL_SQUAT, WALL_PIER_ALTERNATE, DROP_BEAM -> StiffnessCategory.CRACKED_WALL;
            case COLUMN_SEISMIC, COLUMN_NONSEISMIC -> StiffnessCategory.COLUMN;
            case BEAM -> StiffnessCategory.BEAM;
        };

        double defaultK = type.isWall() ? SlendernessInput.K_WALL_BRACED : SlendernessInput.K_COLUMN;
        boolean slendernessApplies = member.category().isVertical();

        return new ResolvedBehavior(behavior, type, stiffness, defaultK, significantAxial, slendernessApplies);
    }

    private DesignBehavior beamBehavior(boolean seismic, boolean significantAxial) {
        if (significantAxial) {
            return seismic ? DesignBehavior.SEISMIC_BEAM_COLUMN : DesignBehavior.FLEXURE_COMPRESSION;
        }
        return seismic ? DesignBehavior.SEISMIC_BEAM : DesignBehavior.FLEXURE_ONLY;
    }

    /** Largest |P| over the member's combinations against Ag·f'c/10. */
    boolean hasSignificantAxial(MemberDefinition member) {
        double maxAxial = 0.0;
        for (LoadCombination combo : member.combinations()) {
            maxAxial = Math.max(maxAxial, Math.abs(combo.p()));
        }
        double threshold = member.section().grossArea() * member.section().fc() / SIGNIFICANT_AXIAL_DIVISOR;
        return maxAxial > threshold;
    }
}
