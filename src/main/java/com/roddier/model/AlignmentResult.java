package com.roddier.model;

public class AlignmentResult {
    public final double[][] aligned;
    // Desplazamiento aplicado a la segunda imagen (pixeles)
    public final int shiftX;
    public final int shiftY;

    public AlignmentResult(double[][] aligned, int shiftX, int shiftY) {
        this.aligned = aligned;
        this.shiftX = shiftX;
        this.shiftY = shiftY;
    }
}
