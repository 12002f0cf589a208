package com.roddier.model;

public class RefinementResult {
    public final double[][] wavefront;
    public final AnnularMask mask;
    public final PupilCenter center;
    public final double rOut;
    public final double defocusMm;
    public final int iterations;
    public final RefinementStatus status;
    public final FitResult lowOrderFit;

    public RefinementResult(double[][] wavefront, AnnularMask mask, PupilCenter center, double rOut,
                            double defocusMm, int iterations, RefinementStatus status, FitResult lowOrderFit) {
        this.wavefront = wavefront;
        this.mask = mask;
        this.center = center;
        this.rOut = rOut;
        this.defocusMm = defocusMm;
        this.iterations = iterations;
        this.status = status;
        this.lowOrderFit = lowOrderFit;
    }

    public RefinementResult withStatus(RefinementStatus newStatus) {
        return new RefinementResult(wavefront, mask, center, rOut, defocusMm, iterations, newStatus, lowOrderFit);
    }

    public boolean isConverged() {
        return status == RefinementStatus.CONVERGED;
    }
}
