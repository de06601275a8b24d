package com.structcheck.verification.logger;

import com.structcheck.common.trace.TraceContextUtil;
import com.structcheck.common.verification.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a member verification. Side effects only; no verification logic.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: member accepted for verification</li>
 *   <li>{@link #BEHAVIOR_RESOLVED}: classification and design behavior known</li>
 *   <li>{@link #CURVE_READY}: interaction curve taken from the cache or built</li>
 *   <li>{@link #SLENDERNESS_ANALYZED}: λ, Pc and the reduction policy known</li>
 *   <li>{@link #VERIFICATION_COMPLETED}: governing result available</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(VerificationFlowLogger.BATCH_COMPLETED))
 * </pre>
 */
@Component
public class VerificationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(VerificationFlowLogger.class);

    public static final String REQUEST_RECEIVED       = "REQUEST_RECEIVED";
    public static final String BEHAVIOR_RESOLVED      = "BEHAVIOR_RESOLVED";
    public static final String CURVE_READY            = "CURVE_READY";
    public static final String SLENDERNESS_ANALYZED   = "SLENDERNESS_ANALYZED";
    public static final String VERIFICATION_COMPLETED = "VERIFICATION_COMPLETED";
    public static final String BATCH_COMPLETED        = "BATCH_COMPLETED";

    /**
     * {@code doOnEach} consumer reading the run id from the Reactor Context. Fires on
     * {@code onNext} only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = TraceContextUtil.getRunId(signal.getContextView());
            TraceContextUtil.withMdc(runId, () ->
                log.info("[VerificationFlow] stage={} runId={}", stageName, runId)
            );
        };
    }

    public void logStage(String stageName, String runId, String memberId) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[VerificationFlow] stage={} runId={} memberId={}", stageName, runId, memberId)
        );
    }

    public void logResult(String runId, String memberId, VerificationResult result) {
        TraceContextUtil.withMdc(runId, () -> {
            log.info("[VerificationFlow] stage={} runId={} memberId={} status={} sf={} critical={} "
                     + "mode={} tier={}",
                     VERIFICATION_COMPLETED, runId, memberId, result.status(),
                     String.format("%.3f", result.safetyFactor()),
                     result.flexure().criticalCombo(), result.mode(), result.flexure().lowestTier());
            if (result.flexure().usedFallback()) {
                log.warn("RAY_CAST_FALLBACK runId={} memberId={} tier={} placeholderSf={}",
                    runId, memberId, result.flexure().lowestTier(), result.flexure().usedPlaceholderSf());
            }
            if (!result.unstableCombos().isEmpty()) {
                log.warn("MEMBER_UNSTABLE runId={} memberId={} combos={}",
                    runId, memberId, result.unstableCombos());
            }
        });
    }
}
