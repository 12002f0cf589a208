package com.roddier.model;

public class FitResult {
    public final double[] coefficients;
    public final ZernikeBasisSet basis;
    public final double residualRms;

    public FitResult(double[] coefficients, ZernikeBasisSet basis, double residualRms) {
        this.coefficients = coefficients;
        this.basis = basis;
        this.residualRms = residualRms;
    }

    public double coefficient(int noll) {
        return coefficients[noll - 1];
    }

    /** Amplitud del termino j en las unidades del frente de onda ajustado (p.ej. mm). */
    public double amplitude(int noll) {
        return coefficients[noll - 1] * basis.amplitudeScale(noll - 1);
    }
}
