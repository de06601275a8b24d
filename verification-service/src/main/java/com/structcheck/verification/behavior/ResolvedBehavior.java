package com.structcheck.verification.behavior;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.structcheck.common.slenderness.StiffnessCategory;

/**
 * Behavior chosen for one member together with what the flexocompression check needs
 * from it.
 *
 * @param defaultK             effective length factor when the member gives none
 * @param slendernessApplies   whether buckling of the member is analyzed at all
 */
public record ResolvedBehavior(
    @JsonProperty("behavior")           DesignBehavior behavior,
    @JsonProperty("elementType")        ElementType elementType,
    @JsonProperty("stiffnessCategory")  StiffnessCategory stiffnessCategory,
    @JsonProperty("defaultK")           double defaultK,
    @JsonProperty("significantAxial")   boolean significantAxial,
    @JsonProperty("slendernessApplies") boolean slendernessApplies
) {
    public boolean requiresPmDiagram() {
        return behavior.requiresPmDiagram();
    }
}
