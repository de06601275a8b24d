package com.structcheck.verification.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.structcheck.common.flexure.FlexureCheckResult;
import com.structcheck.common.material.Units;
import com.structcheck.common.model.DesignPoint;
import com.structcheck.common.model.InteractionCurve;
import com.structcheck.common.verification.VerificationResult;
import com.structcheck.verification.model.MemberVerificationReport;
import com.structcheck.verification.model.ReportStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns member reports into a JSON document in tonf / tonf·m, including the design
 * curve each member was checked against.
 */
@Component
public class VerificationReportWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public VerificationReportWriter(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    VerificationReportWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public VerificationReport build(String runId, List<MemberVerificationReport> reports) {
        List<MemberEntry> entries = new ArrayList<>(reports.size());
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        int errors = 0;

        for (MemberVerificationReport report : reports) {
            entries.add(toEntry(report));
            switch (report.status()) {
                case VERIFIED -> {
                    if (report.passes()) passed++;
                    else failed++;
                }
                case SKIPPED -> skipped++;
                case FAILED -> errors++;
            }
        }
        return new VerificationReport(runId, Instant.now(clock), reports.size(),
            passed, failed, skipped, errors, entries);
    }

    public String toJson(VerificationReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize verification report runId=" + report.runId(), e);
        }
    }

    public void write(VerificationReport report, Path target) throws IOException {
        Files.writeString(target, toJson(report));
    }

    /** Design curve in tonf·m (x) / tonf (y), in curve order. */
    public static List<PlotPoint> plotCurve(InteractionCurve curve) {
        List<PlotPoint> plot = new ArrayList<>(curve.size());
        for (DesignPoint p : curve.designPoints()) {
            plot.add(new PlotPoint(round(Units.toTonfM(p.moment())), round(Units.toTonf(p.axial()))));
        }
        return plot;
    }

    MemberEntry toEntry(MemberVerificationReport report) {
        String behavior = report.behavior() != null ? report.behavior().behavior().name() : null;

        if (report.status() != ReportStatus.VERIFIED) {
            return new MemberEntry(report.memberId(), report.status().name(), behavior, null,
                null, null, null, null, null, null, null, null, null, null, null, null, null,
                report.curveFingerprint(), report.message(), null);
        }

        VerificationResult result = report.result();
        FlexureCheckResult flexure = result.flexure();
        Double lambda = result.slenderness() != null ? round(result.slenderness().lambdaRatio()) : null;

        return new MemberEntry(
            report.memberId(),
            report.status().name(),
            behavior,
            result.status().name(),
            finite(result.safetyFactor()),
            finite(result.dcr()),
            flexure.criticalCombo(),
            round(Units.toTonf(flexure.criticalPu())),
            round(Units.toTonfM(flexure.criticalMu())),
            round(Units.toTonfM(flexure.phiMnAtP0())),
            round(Units.toTonfM(flexure.phiMnAtPu())),
            round(Units.toTonf(flexure.phiPnMax())),
            lambda,
            result.mode().name(),
            flexure.lowestTier().name(),
            flexure.usedPlaceholderSf() ? Boolean.TRUE : null,
            result.unstableCombos().isEmpty() ? null : result.unstableCombos(),
            report.curveFingerprint(),
            null,
            report.curve() != null ? plotCurve(report.curve()) : null
        );
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? round(value) : null;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
