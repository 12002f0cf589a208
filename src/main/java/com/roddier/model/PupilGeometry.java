package com.roddier.model;

public class PupilGeometry {
    public final PupilCenter center;
    public final double rOut;
    public final double rIn;

    public PupilGeometry(PupilCenter center, double rOut, double rIn) {
        this.center = center;
        this.rOut = rOut;
        this.rIn = rIn;
    }

    @Override
    public String toString() {
        return String.format("centro=%s R_out=%.2f R_in=%.2f", center, rOut, rIn);
    }
}
