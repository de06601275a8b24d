package com.structcheck.common.slenderness;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Second-order moment against first-order moment. Above the limit the structural
 * system is potentially unstable and has to be revised.
 */
public record SecondOrderCheck(
    @JsonProperty("firstOrder")  double firstOrder,
    @JsonProperty("secondOrder") double secondOrder,
    @JsonProperty("ratio")       double ratio,
    @JsonProperty("limit")       double limit,
    @JsonProperty("passes")      boolean passes
) {}
