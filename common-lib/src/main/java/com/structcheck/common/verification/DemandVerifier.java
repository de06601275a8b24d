package com.structcheck.common.verification;

import com.structcheck.common.exception.ExcessiveSlendernessException;
import com.structcheck.common.flexure.CapacityEvaluator;
import com.structcheck.common.flexure.FlexureCheckResult;
import com.structcheck.common.model.DemandPoint;
import com.structcheck.common.model.InteractionCurve;
import com.structcheck.common.slenderness.CompressionReduction;
import com.structcheck.common.slenderness.DesignMoment;
import com.structcheck.common.slenderness.Magnification;
import com.structcheck.common.slenderness.SlendernessAnalyzer;
import com.structcheck.common.slenderness.SlendernessResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a demand set against an interaction curve, optionally accounting for
 * slenderness.
 *
 * <h3>Slenderness modes</h3>
 * <ul>
 *   <li>{@link SlendernessMode#MAGNIFY_DEMAND}: each compressive demand on a slender
 *       member is checked with Mc = δns·max(|Mu|, M2,min), M2,min taken over the
 *       thickness in the buckling direction. Demands past the buckling load are not
 *       folded into the safety factor; they make the result UNSTABLE.</li>
 *   <li>{@link SlendernessMode#REDUCE_CAPACITY}: first-order demands against a new
 *       curve with the compressive side reduced.</li>
 * </ul>
 *
 * <p>In both modes a member above {@link SlendernessAnalyzer#LAMBDA_MAX} is rejected
 * outright. The input curve is never modified.
 */
public final class DemandVerifier {

    private DemandVerifier() {}

    /** First-order check without slenderness. */
    public static FlexureCheckResult verify(InteractionCurve curve, List<DemandPoint> demands) {
        return CapacityEvaluator.checkFlexure(curve, demands);
    }

    /**
     * @param slenderness analysis of the member; null is treated as a short member
     * @throws ExcessiveSlendernessException when λ exceeds the maximum, unless the mode is IGNORE
     */
    public static VerificationResult verify(InteractionCurve curve, List<DemandPoint> demands,
                                            SlendernessResult slenderness, SlendernessMode mode) {
        if (slenderness == null || mode == SlendernessMode.IGNORE) {
            return plain(curve, demands, slenderness, SlendernessMode.IGNORE);
        }
        if (SlendernessAnalyzer.compressionReduction(slenderness).isRejected()) {
            throw new ExcessiveSlendernessException(slenderness.lambdaRatio(), SlendernessAnalyzer.LAMBDA_MAX);
        }
        return switch (mode) {
            case MAGNIFY_DEMAND -> magnified(curve, demands, slenderness);
            case REDUCE_CAPACITY -> reduced(curve, demands, slenderness);
            case IGNORE -> plain(curve, demands, slenderness, mode);
        };
    }

    private static VerificationResult plain(InteractionCurve curve, List<DemandPoint> demands,
                                            SlendernessResult slenderness, SlendernessMode mode) {
        FlexureCheckResult flexure = CapacityEvaluator.checkFlexure(curve, demands);
        return new VerificationResult(flexure, VerificationStatus.of(flexure.status()),
            slenderness, mode, null, List.of(), false);
    }

    private static VerificationResult magnified(InteractionCurve curve, List<DemandPoint> demands,
                                                SlendernessResult slenderness) {
        if (!slenderness.slender()) {
            return plain(curve, demands, slenderness, SlendernessMode.MAGNIFY_DEMAND);
        }

        List<DemandPoint> adjusted = new ArrayList<>(demands.size());
        List<String> unstable = new ArrayList<>();
        boolean secondOrderExceeded = false;

        for (DemandPoint demand : demands) {
            if (demand.pu() <= 0) {
                adjusted.add(demand);
                continue;
            }

            Magnification magnification = SlendernessAnalyzer.magnification(slenderness, demand.pu());
            if (magnification.unstable()) {
                unstable.add(demand.label());
                continue;
            }

            DesignMoment design = SlendernessAnalyzer.designMoment(
                demand.mu(), demand.pu(), slenderness.t(), magnification.delta());
            if (!SlendernessAnalyzer.secondOrderCheck(design.m2Design(), design.mc()).passes()) {
                secondOrderExceeded = true;
            }
            adjusted.add(demand.withMoment(design.mc()));
        }

        FlexureCheckResult flexure = CapacityEvaluator.checkFlexure(curve, adjusted);
        VerificationStatus status = unstable.isEmpty()
            ? VerificationStatus.of(flexure.status())
            : VerificationStatus.UNSTABLE;

        return new VerificationResult(flexure, status, slenderness,
            SlendernessMode.MAGNIFY_DEMAND, null, unstable, secondOrderExceeded);
    }

    private static VerificationResult reduced(InteractionCurve curve, List<DemandPoint> demands,
                                              SlendernessResult slenderness) {
        CompressionReduction reduction = SlendernessAnalyzer.compressionReduction(slenderness);
        InteractionCurve reducedCurve = SlendernessAnalyzer.applyCompressionReduction(curve, slenderness);

        FlexureCheckResult flexure = CapacityEvaluator.checkFlexure(reducedCurve, demands);
        return new VerificationResult(flexure, VerificationStatus.of(flexure.status()),
            slenderness, SlendernessMode.REDUCE_CAPACITY, reduction, List.of(), false);
    }
}
