package com.roddier.model;

public class WavefrontResult {
    public final double[][] normalizedDifference;
    public final double[][] wavefront;
    // 1.0 si el frente de onda queda en unidades del solver, si no (lambda_mm / 4pi) * dz_mm
    public final double scaleFactor;

    public WavefrontResult(double[][] normalizedDifference, double[][] wavefront, double scaleFactor) {
        this.normalizedDifference = normalizedDifference;
        this.wavefront = wavefront;
        this.scaleFactor = scaleFactor;
    }
}
