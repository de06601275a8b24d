package com.structcheck.verification.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Report document of one verification run. */
public record VerificationReport(
    @JsonProperty("runId")       String runId,
    @JsonProperty("generatedAt") Instant generatedAt,
    @JsonProperty("members")     int members,
    @JsonProperty("passed")      int passed,
    @JsonProperty("failed")      int failed,
    @JsonProperty("skipped")     int skipped,
    @JsonProperty("errors")      int errors,
    @JsonProperty("entries")     List<MemberEntry> entries
) {}
