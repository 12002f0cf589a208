package com.roddier.model;

public class RegistrationResult {
    public final double[][] intra;
    public final double[][] extraAligned;
    public final AlignmentResult alignment;
    public final PupilGeometry geometry;
    public final AnnularMask mask;

    public RegistrationResult(double[][] intra, double[][] extraAligned, AlignmentResult alignment,
                              PupilGeometry geometry, AnnularMask mask) {
        this.intra = intra;
        this.extraAligned = extraAligned;
        this.alignment = alignment;
        this.geometry = geometry;
        this.mask = mask;
    }
}
