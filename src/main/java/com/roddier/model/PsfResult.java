package com.roddier.model;

public class PsfResult {
    public final double[][] psf;
    public final double[][] psfLog;

    public PsfResult(double[][] psf, double[][] psfLog) {
        this.psf = psf;
        this.psfLog = psfLog;
    }
}
