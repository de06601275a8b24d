package com.structcheck.verification.service;

import com.structcheck.common.exception.SectionInputException;
import com.structcheck.common.trace.TraceContextUtil;
import com.structcheck.verification.config.VerificationSettings;
import com.structcheck.verification.logger.VerificationFlowLogger;
import com.structcheck.verification.model.MemberDefinition;
import com.structcheck.verification.model.MemberVerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.UUID;

/**
 * Verifies many members in parallel. A failing member never fails the batch: it is
 * reported as FAILED with the reason, and the other members still complete.
 */
@Service
public class BatchVerificationService {

    private static final Logger log = LoggerFactory.getLogger(BatchVerificationService.class);

    private final FlexocompressionService flexocompressionService;
    private final VerificationFlowLogger flowLogger;
    private final VerificationSettings settings;

    public BatchVerificationService(FlexocompressionService flexocompressionService,
                                    VerificationFlowLogger flowLogger,
                                    VerificationSettings settings) {
        this.flexocompressionService = flexocompressionService;
        this.flowLogger = flowLogger;
        this.settings = settings;
    }

    public Mono<List<MemberVerificationReport>> verifyAll(List<MemberDefinition> members) {
        return verifyAll(members, UUID.randomUUID().toString());
    }

    /**
     * @return one report per member, in input order
     */
    public Mono<List<MemberVerificationReport>> verifyAll(List<MemberDefinition> members, String runId) {
        log.info("Verifying {} members runId={} parallelism={}",
            members.size(), runId, settings.batchParallelism());

        Mono<List<MemberVerificationReport>> pipeline = Flux.fromIterable(members)
            .flatMapSequential(member -> Mono.fromCallable(() -> flexocompressionService.verify(member, runId))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> Mono.just(failed(member, runId, e))),
                Math.max(1, settings.batchParallelism()))
            .collectList()
            .doOnEach(flowLogger.stage(VerificationFlowLogger.BATCH_COMPLETED));

        return TraceContextUtil.withRunId(pipeline, runId);
    }

    private MemberVerificationReport failed(MemberDefinition member, String runId, Throwable e) {
        if (e instanceof SectionInputException input) {
            log.warn("Member={} rejected runId={} subject={} reason={}",
                member.id(), runId, input.getSubject(), input.getMessage());
        } else {
            log.error("Member={} failed runId={}", member.id(), runId, e);
        }
        return MemberVerificationReport.failed(member.id(), e.getMessage());
    }
}
