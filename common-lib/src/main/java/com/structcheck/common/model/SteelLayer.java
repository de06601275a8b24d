package com.structcheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One layer of longitudinal reinforcement.
 *
 * @param position distance from the extreme compression fiber (mm)
 * @param area     total bar area in the layer (mm²)
 */
public record SteelLayer(
    @JsonProperty("position") double position,
    @JsonProperty("area")     double area
) {}
