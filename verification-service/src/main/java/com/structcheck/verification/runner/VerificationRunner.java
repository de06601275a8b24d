package com.structcheck.verification.runner;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.structcheck.verification.model.MemberDefinition;
import com.structcheck.verification.model.MemberVerificationReport;
import com.structcheck.verification.report.VerificationReport;
import com.structcheck.verification.report.VerificationReportWriter;
import com.structcheck.verification.service.BatchVerificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Verifies the members listed in {@code verification.input} (a JSON array of
 * {@link MemberDefinition}) and writes the report to {@code verification.output}.
 *
 * <pre>
 *     java -jar verification-service.jar --verification.input=members.json --verification.output=report.json
 * </pre>
 */
@Component
@ConditionalOnProperty(name = "verification.input")
public class VerificationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(VerificationRunner.class);

    private static final TypeReference<List<MemberDefinition>> MEMBER_LIST = new TypeReference<>() {};

    private final BatchVerificationService batchService;
    private final VerificationReportWriter reportWriter;
    private final ObjectMapper objectMapper;
    private final Path input;
    private final Path output;

    public VerificationRunner(BatchVerificationService batchService,
                              VerificationReportWriter reportWriter,
                              ObjectMapper objectMapper,
                              @Value("${verification.input}") Path input,
                              @Value("${verification.output:verification-report.json}") Path output) {
        this.batchService = batchService;
        this.reportWriter = reportWriter;
        this.objectMapper = objectMapper;
        this.input = input;
        this.output = output;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        VerificationReport report = verify(readMembers());
        reportWriter.write(report, output);
        log.info("Report written runId={} members={} passed={} failed={} skipped={} errors={} file={}",
            report.runId(), report.members(), report.passed(), report.failed(),
            report.skipped(), report.errors(), output);
    }

    VerificationReport verify(List<MemberDefinition> members) {
        String runId = UUID.randomUUID().toString();
        List<MemberVerificationReport> reports = batchService.verifyAll(members, runId).block();
        return reportWriter.build(runId, reports != null ? reports : List.of());
    }

    List<MemberDefinition> readMembers() throws IOException {
        if (!Files.isRegularFile(input)) {
            throw new IOException("Member file not found: " + input);
        }
        List<MemberDefinition> members = objectMapper.readValue(input.toFile(), MEMBER_LIST);
        log.info("Loaded {} members from {}", members.size(), input);
        return members;
    }
}
