package com.structcheck.verification.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One point of a design curve as plotted, in tonf and tonf·m. */
public record PlotPoint(
    @JsonProperty("phiMn") double phiMnTonfM,
    @JsonProperty("phiPn") double phiPnTonf
) {}
