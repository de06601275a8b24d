package com.structcheck.common.flexure;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Governing result of checking a demand set against one interaction curve.
 *
 * <p>{@code phiMnAtPu} is the curve's moment capacity interpolated at the critical
 * axial load, not {@code Mu × SF}. The safety factor comes from ray casting; the DCR
 * is its inverse.
 *
 * @param safetyFactor           minimum SF over all combinations ({@code +∞} with no demand)
 * @param status                 OK iff {@code safetyFactor ≥ 1.0}
 * @param criticalCombo          label of the governing combination, {@code "N/A"} with no demand
 * @param phiMnAtP0              moment capacity at P = 0 (N·mm)
 * @param phiMnAtPu              moment capacity at the critical Pu (N·mm)
 * @param criticalPu             axial load of the governing combination (N)
 * @param criticalMu             moment of the governing combination (N·mm)
 * @param exceedsAxialCapacity   critical Pu above φPn,max
 * @param phiPnMax               largest design axial capacity (N)
 * @param hasTension             at least one combination in net tension
 * @param tensionCombos          number of net-tension combinations
 * @param exceedsTensionCapacity critical Pu below φPt,min
 * @param phiPtMin               smallest (most tensile) design axial capacity (N)
 * @param comboResults           one entry per demand, in input order
 * @param lowestTier             least precise ray-cast tier used by any combination
 */
public record FlexureCheckResult(
    @JsonProperty("sf")                     double safetyFactor,
    @JsonProperty("status")                 CheckStatus status,
    @JsonProperty("criticalCombo")          String criticalCombo,
    @JsonProperty("phiMnAtP0")              double phiMnAtP0,
    @JsonProperty("phiMnAtPu")              double phiMnAtPu,
    @JsonProperty("criticalPu")             double criticalPu,
    @JsonProperty("criticalMu")             double criticalMu,
    @JsonProperty("exceedsAxialCapacity")   boolean exceedsAxialCapacity,
    @JsonProperty("phiPnMax")               double phiPnMax,
    @JsonProperty("hasTension")             boolean hasTension,
    @JsonProperty("tensionCombos")          int tensionCombos,
    @JsonProperty("exceedsTensionCapacity") boolean exceedsTensionCapacity,
    @JsonProperty("phiPtMin")               double phiPtMin,
    @JsonProperty("comboResults")           List<ComboResult> comboResults,
    @JsonProperty("lowestTier")             RayCastTier lowestTier
) {
    public FlexureCheckResult {
        comboResults = comboResults == null ? List.of() : List.copyOf(comboResults);
    }

    public double dcr() {
        return SafetyFactor.toDcr(safetyFactor);
    }

    public boolean usedFallback() {
        return lowestTier != null && lowestTier.isFallback();
    }

    /** Some combination's SF is a point-in-polygon placeholder. */
    public boolean usedPlaceholderSf() {
        return lowestTier != null && lowestTier.isPlaceholder();
    }
}
