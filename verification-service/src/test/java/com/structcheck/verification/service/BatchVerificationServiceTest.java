package com.structcheck.verification.service;

import com.structcheck.common.verification.SlendernessMode;
import com.structcheck.verification.MemberFixtures;
import com.structcheck.verification.cache.CurveCache;
import com.structcheck.verification.config.VerificationSettings;
import com.structcheck.verification.logger.VerificationFlowLogger;
import com.structcheck.verification.model.MemberDefinition;
import com.structcheck.verification.model.MemberVerificationReport;
import com.structcheck.verification.model.ReportStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchVerificationServiceTest {

    private final BatchVerificationService batch = new BatchVerificationService(
        MemberFixtures.service(new CurveCache()), new VerificationFlowLogger(), VerificationSettings.defaults());

    @Test
    @DisplayName("reports come back in input order; failures become FAILED entries")
    void mixedBatch() {
        List<MemberDefinition> members = List.of(
            MemberFixtures.squatWall("W1"),
            MemberFixtures.invalidColumn("C9"),
            MemberFixtures.tallColumn("C1").withSlendernessMode(SlendernessMode.REDUCE_CAPACITY),
            MemberFixtures.beam("B1", true, 0));

        List<MemberVerificationReport> reports = batch.verifyAll(members, "run-1").block(Duration.ofSeconds(30));

        assertNotNull(reports);
        assertEquals(List.of("W1", "C9", "C1", "B1"),
            reports.stream().map(MemberVerificationReport::memberId).toList());
        assertEquals(List.of(ReportStatus.VERIFIED, ReportStatus.FAILED, ReportStatus.FAILED, ReportStatus.SKIPPED),
            reports.stream().map(MemberVerificationReport::status).toList());

        assertTrue(reports.get(1).message().contains("MPa"));
        assertTrue(reports.get(2).message().contains("lambda="));
        assertNull(reports.get(1).behavior());
    }

    @Test
    @DisplayName("parallelism below one still runs the batch")
    void zeroParallelism() {
        BatchVerificationService sequential = new BatchVerificationService(
            MemberFixtures.service(new CurveCache()), new VerificationFlowLogger(),
            new VerificationSettings(50, SlendernessMode.MAGNIFY_DEMAND, 0));

        List<MemberVerificationReport> reports = sequential
            .verifyAll(List.of(MemberFixtures.squatWall("W1"), MemberFixtures.squatWall("W2")))
            .block(Duration.ofSeconds(30));

        assertNotNull(reports);
        assertEquals(2, reports.size());
        assertTrue(reports.stream().allMatch(MemberVerificationReport::passes));
    }

    @Test
    @DisplayName("an empty batch yields an empty list")
    void emptyBatch() {
        assertEquals(List.of(), batch.verifyAll(List.of(), "run-2").block(Duration.ofSeconds(5)));
    }
}
