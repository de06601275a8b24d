package com.structcheck.verification.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Report line of one member in tonf / tonf·m. Unbounded or undefined values (a safety
 * factor with no demand, an unstable member's DCR) are written as null.
 * {@code placeholderSf} is true when the governing SF may be a point-in-polygon
 * placeholder rather than a measured one, and absent otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemberEntry(
    @JsonProperty("memberId")       String memberId,
    @JsonProperty("status")         String status,
    @JsonProperty("behavior")       String behavior,
    @JsonProperty("verification")   String verification,
    @JsonProperty("sf")             Double safetyFactor,
    @JsonProperty("dcr")            Double dcr,
    @JsonProperty("criticalCombo")  String criticalCombo,
    @JsonProperty("Pu_tonf")        Double puTonf,
    @JsonProperty("Mu_tonfm")       Double muTonfM,
    @JsonProperty("phiMn0_tonfm")   Double phiMnAtP0TonfM,
    @JsonProperty("phiMnPu_tonfm")  Double phiMnAtPuTonfM,
    @JsonProperty("phiPnMax_tonf")  Double phiPnMaxTonf,
    @JsonProperty("lambda")         Double lambda,
    @JsonProperty("slendernessMode") String slendernessMode,
    @JsonProperty("rayCastTier")    String rayCastTier,
    @JsonProperty("placeholderSf")  Boolean placeholderSf,
    @JsonProperty("unstableCombos") List<String> unstableCombos,
    @JsonProperty("fingerprint")    String fingerprint,
    @JsonProperty("message")        String message,
    @JsonProperty("curve")          List<PlotPoint> curve
) {}
