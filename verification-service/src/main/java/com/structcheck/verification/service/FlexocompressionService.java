package com.structcheck.verification.service;

import com.structcheck.common.exception.ExcessiveSlendernessException;
import com.structcheck.common.exception.SectionInputException;
import com.structcheck.common.model.DemandPoint;
import com.structcheck.common.model.InteractionCurve;
import com.structcheck.common.slenderness.CompressionReduction;
import com.structcheck.common.slenderness.SlendernessAnalyzer;
import com.structcheck.common.slenderness.SlendernessInput;
import com.structcheck.common.slenderness.SlendernessResult;
import com.structcheck.common.verification.DemandPoints;
import com.structcheck.common.verification.DemandVerifier;
import com.structcheck.common.verification.SlendernessMode;
import com.structcheck.common.verification.VerificationResult;
import com.structcheck.verification.behavior.DesignBehaviorResolver;
import com.structcheck.verification.behavior.ElementClassifier;
import com.structcheck.verification.behavior.ElementType;
import com.structcheck.verification.behavior.ResolvedBehavior;
import com.structcheck.verification.cache.CurveCache;
import com.structcheck.verification.cache.CurveKey;
import com.structcheck.verification.config.VerificationSettings;
import com.structcheck.verification.logger.VerificationFlowLogger;
import com.structcheck.verification.model.MemberDefinition;
import com.structcheck.verification.model.MemberVerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Flexocompression check of a single member: classification, curve, slenderness and
 * demand verification.
 */
@Service
public class FlexocompressionService {

    private static final Logger log = LoggerFactory.getLogger(FlexocompressionService.class);

    private final ElementClassifier classifier;
    private final DesignBehaviorResolver resolver;
    private final CurveCache curveCache;
    private final VerificationFlowLogger flowLogger;
    private final VerificationSettings settings;

    public FlexocompressionService(ElementClassifier classifier, DesignBehaviorResolver resolver,
                                   CurveCache curveCache, VerificationFlowLogger flowLogger,
                                   VerificationSettings settings) {
        this.classifier = classifier;
        this.resolver = resolver;
        this.curveCache = curveCache;
        this.flowLogger = flowLogger;
        this.settings = settings;
    }

    /**
     * @throws SectionInputException          for an invalid section or buckling geometry
     * @throws ExcessiveSlendernessException when λ exceeds the maximum and slenderness is not ignored
     */
    public MemberVerificationReport verify(MemberDefinition member, String runId) {
        flowLogger.logStage(VerificationFlowLogger.REQUEST_RECEIVED, runId, member.id());

        ElementType type = classifier.classify(member);
        ResolvedBehavior behavior = resolver.resolve(type, member);
        log.info("Member={} type={} behavior={} significantAxial={}",
            member.id(), type, behavior.behavior(), behavior.significantAxial());
        flowLogger.logStage(VerificationFlowLogger.BEHAVIOR_RESOLVED, runId, member.id());

        if (!behavior.requiresPmDiagram()) {
            log.info("Member={} skipped, behavior={} needs no P-M check", member.id(), behavior.behavior());
            return MemberVerificationReport.skipped(member.id(), behavior);
        }

        CurveKey key = new CurveKey(member.section(), settings.samplePoints());
        InteractionCurve curve = curveCache.getOrBuild(member.id(), key);
        flowLogger.logStage(VerificationFlowLogger.CURVE_READY, runId, member.id());

        SlendernessResult slenderness = null;
        if (behavior.slendernessApplies()) {
            slenderness = SlendernessAnalyzer.analyze(slendernessInput(member, behavior));
            CompressionReduction reduction = SlendernessAnalyzer.compressionReduction(slenderness);
            log.info("Member={} lambda={} slender={} Pc={} policy={}",
                member.id(), String.format("%.1f", slenderness.lambdaRatio()), slenderness.slender(),
                String.format("%.0f", slenderness.pc()), reduction.policy());
            flowLogger.logStage(VerificationFlowLogger.SLENDERNESS_ANALYZED, runId, member.id());
        }

        SlendernessMode mode = member.slendernessMode() != null ? member.slendernessMode() : settings.defaultMode();
        List<DemandPoint> demands = DemandPoints.from(member.combinations(), member.axis(), member.momentAngleDeg());
        VerificationResult result = DemandVerifier.verify(curve, demands, slenderness, mode);
        flowLogger.logResult(runId, member.id(), result);

        InteractionCurve checkedCurve = mode == SlendernessMode.REDUCE_CAPACITY && slenderness != null
            ? SlendernessAnalyzer.applyCompressionReduction(curve, slenderness)
            : curve;
        return MemberVerificationReport.verified(member.id(), behavior, result, key.fingerprint(), checkedCurve);
    }

    /** Called when a member's reinforcement is edited outside a verification run. */
    public void reinforcementChanged(String memberId) {
        curveCache.invalidate(memberId);
    }

    private SlendernessInput slendernessInput(MemberDefinition member, ResolvedBehavior behavior) {
        double k = member.effectiveLengthFactor() != null ? member.effectiveLengthFactor() : behavior.defaultK();
        return new SlendernessInput(member.height(), member.bucklingThickness(), member.bucklingWidth(),
            member.section().fc(), k, member.cm(), member.braced(), behavior.stiffnessCategory());
    }
}
