package com.roddier.model;

public class RoddierReport {
    public final RefinementResult refinement;
    public final FitResult fit;
    public final double[][] wavefrontWaves;
    /** Suma de los modos de Zernike seleccionados, en ondas; entrada de interferograma y PSF. */
    public final double[][] modalWaves;
    public final double[][] interferogram;
    public final PsfResult psf;
    public final double wavelengthNm;

    public RoddierReport(RefinementResult refinement, FitResult fit, double[][] wavefrontWaves,
                         double[][] modalWaves, double[][] interferogram, PsfResult psf, double wavelengthNm) {
        this.refinement = refinement;
        this.fit = fit;
        this.wavefrontWaves = wavefrontWaves;
        this.modalWaves = modalWaves;
        this.interferogram = interferogram;
        this.psf = psf;
        this.wavelengthNm = wavelengthNm;
    }
}
