package com.structcheck.verification.behavior;

import com.structcheck.verification.model.MemberDefinition;
import org.springframework.stereotype.Component;

/**
 * Maps a member to its {@link ElementType} from its category, seismic flag and
 * plan / height proportions.
 */
@Component
public class ElementClassifier {

    static final double COLUMN_ASPECT_LIMIT = 4.0;
    static final double WALL_HEIGHT_RATIO = 2.0;
    static final double PIER_ALTERNATE_LIMIT = 6.0;

    public ElementType classify(MemberDefinition member) {
        return switch (member.category()) {
            case BEAM -> ElementType.BEAM;
            case DROP_BEAM -> ElementType.DROP_BEAM;
            case COLUMN -> member.seismic() ? ElementType.COLUMN_SEISMIC : ElementType.COLUMN_NONSEISMIC;
            case PIER -> classifyPier(member.planLength(), member.planThickness(), member.height());
        };
    }

    /**
     * @param lw plan length (mm)
     * @param tw thickness (mm)
     * @param hw height (mm)
     */
    public ElementType classifyPier(double lw, double tw, double hw) {
        double lwTw = tw > 0 ? lw / tw : 0.0;
        double hwLw = lw > 0 ? hw / lw : 0.0;

        // Piers proportioned like columns are designed as seismic columns
        if (lwTw < COLUMN_ASPECT_LIMIT) return ElementType.COLUMN_SEISMIC;
        if (hwLw >= WALL_HEIGHT_RATIO) return ElementType.WALL;
        if (lwTw <= PIER_ALTERNATE_LIMIT) return ElementType.WALL_PIER_ALTERNATE;
        return ElementType.WALL_SQUAT;
    }
}
