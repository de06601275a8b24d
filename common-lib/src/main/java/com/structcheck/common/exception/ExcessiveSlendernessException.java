package com.structcheck.common.exception;

/**
 * Member slenderness is above the range where a reduced axial capacity is meaningful.
 *
 * <p>This is a hard failure: the member has to be redesigned, it is never reported as
 * a member with a near-zero capacity.
 */
public class ExcessiveSlendernessException extends SectionInputException {
    private final double lambdaRatio;
    private final double lambdaMax;

    public ExcessiveSlendernessException(double lambdaRatio, double lambdaMax) {
        super("slenderness", String.format("lambda=%.1f exceeds the maximum of %.0f", lambdaRatio, lambdaMax));
        this.lambdaRatio = lambdaRatio;
        this.lambdaMax = lambdaMax;
    }

    public double getLambdaRatio() {
        return lambdaRatio;
    }

    public double getLambdaMax() {
        return lambdaMax;
    }
}
