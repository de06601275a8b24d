package com.structcheck.verification.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.structcheck.common.model.LoadCombination;
import com.structcheck.common.model.MomentAxis;
import com.structcheck.common.model.RectangularSection;
import com.structcheck.common.verification.SlendernessMode;
import com.structcheck.verification.behavior.ElementCategory;

import java.util.List;

/**
 * One member to verify: its section on the checked bending axis, its buckling geometry
 * and the load combinations from the analysis model.
 *
 * @param id                    member identifier, also the cache invalidation key
 * @param section               section with width ⟂ and depth along the bending direction
 * @param height                unsupported length (mm)
 * @param bucklingThickness     section dimension in the buckling direction (mm)
 * @param bucklingWidth         section dimension perpendicular to it (mm)
 * @param effectiveLengthFactor k; null to take the behavior's default
 * @param cm                    equivalent moment factor; null (absent) means 1.0
 * @param braced                braced against sidesway; null (absent) means braced
 * @param axis                  moment extracted from each combination
 * @param momentAngleDeg        moment-plane angle for {@link MomentAxis#COMBINED}
 * @param slendernessMode       null to take the configured default
 */
public record MemberDefinition(
    @JsonProperty("id")                    String id,
    @JsonProperty("category")              ElementCategory category,
    @JsonProperty("seismic")               boolean seismic,
    @JsonProperty("section")               RectangularSection section,
    @JsonProperty("height")                double height,
    @JsonProperty("bucklingThickness")     double bucklingThickness,
    @JsonProperty("bucklingWidth")         double bucklingWidth,
    @JsonProperty("k")                     Double effectiveLengthFactor,
    @JsonProperty("Cm")                    Double cm,
    @JsonProperty("braced")                Boolean braced,
    @JsonProperty("axis")                  MomentAxis axis,
    @JsonProperty("momentAngleDeg")        double momentAngleDeg,
    @JsonProperty("slendernessMode")       SlendernessMode slendernessMode,
    @JsonProperty("combinations")          List<LoadCombination> combinations
) {
    /** Conservative equivalent moment factor for members that do not state one. */
    public static final double DEFAULT_CM = 1.0;

    public MemberDefinition {
        cm = cm == null ? DEFAULT_CM : cm;
        braced = braced == null ? Boolean.TRUE : braced;
        axis = axis == null ? MomentAxis.M3 : axis;
        combinations = combinations == null ? List.of() : List.copyOf(combinations);
    }

    /**
     * Braced member bending about M3 that buckles across its thinner plan dimension,
     * with Cm = 1.0 and the default k and slenderness mode.
     */
    public static MemberDefinition of(String id, ElementCategory category, boolean seismic,
                                      RectangularSection section, double height,
                                      List<LoadCombination> combinations) {
        double thickness = Math.min(section.width(), section.depth());
        double width = Math.max(section.width(), section.depth());
        return new MemberDefinition(id, category, seismic, section, height, thickness, width,
            null, DEFAULT_CM, true, MomentAxis.M3, 0.0, null, combinations);
    }

    public double planLength() {
        return Math.max(section.width(), section.depth());
    }

    public double planThickness() {
        return Math.min(section.width(), section.depth());
    }

    public MemberDefinition withSection(RectangularSection newSection) {
        return new MemberDefinition(id, category, seismic, newSection, height, bucklingThickness,
            bucklingWidth, effectiveLengthFactor, cm, braced, axis, momentAngleDeg, slendernessMode,
            combinations);
    }

    public MemberDefinition withSlendernessMode(SlendernessMode mode) {
        return new MemberDefinition(id, category, seismic, section, height, bucklingThickness,
            bucklingWidth, effectiveLengthFactor, cm, braced, axis, momentAngleDeg, mode, combinations);
    }
}
