package com.roddier.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parametros del telescopio y del test de Roddier. Valor inmutable que recorre todo
 * el pipeline; ninguna etapa usa valores por defecto propios.
 */
public class RoddierConfig {

    public static final double DEFAULT_WAVELENGTH_NM = 555.0;

    // Telescopio
    public final double apertureMm;
    public final double focalLengthMm;
    public final double secondaryMm;
    public final double pixelSizeUm;
    public final double wavelengthNm;

    // Test
    public final double thresholdFraction;
    public final int zernikeTerms;
    public final int maxIterations;
    public final double convergenceToleranceMm;
    public final ObstructionMode obstructionMode;

    // Preprocesado
    public final double blurSigma;
    public final int cropSize;
    public final boolean flipExtra;

    // Interferograma
    public final double referenceFrequency;
    public final double referenceIntensity;
    /** Terminos de Noll que no entran en el interferograma ni en la PSF (piston por defecto). */
    public final Set<Integer> excludedModes;

    private RoddierConfig(Builder b) {
        if (!(b.apertureMm > 0)) throw new IllegalArgumentException("Apertura debe ser > 0: " + b.apertureMm);
        if (!(b.focalLengthMm > 0)) throw new IllegalArgumentException("Focal debe ser > 0: " + b.focalLengthMm);
        if (b.secondaryMm < 0 || b.secondaryMm >= b.apertureMm) {
            throw new IllegalArgumentException("Secundario fuera de rango [0, apertura): " + b.secondaryMm);
        }
        if (!(b.pixelSizeUm > 0)) throw new IllegalArgumentException("Tamano de pixel debe ser > 0: " + b.pixelSizeUm);
        if (!(b.wavelengthNm > 0)) throw new IllegalArgumentException("Longitud de onda debe ser > 0: " + b.wavelengthNm);
        if (!(b.thresholdFraction > 0 && b.thresholdFraction < 1)) {
            throw new IllegalArgumentException("Umbral fuera de (0, 1): " + b.thresholdFraction);
        }
        if (b.zernikeTerms < 4) throw new IllegalArgumentException("Se necesitan al menos 4 terminos de Zernike: " + b.zernikeTerms);
        if (b.maxIterations < 1) throw new IllegalArgumentException("Iteraciones debe ser >= 1: " + b.maxIterations);
        if (!(b.convergenceToleranceMm > 0)) throw new IllegalArgumentException("Tolerancia debe ser > 0");
        if (b.obstructionMode == null) throw new IllegalArgumentException("Modo de obstruccion nulo");
        if (b.blurSigma < 0) throw new IllegalArgumentException("Sigma negativo: " + b.blurSigma);
        if (b.cropSize < 0) throw new IllegalArgumentException("Recorte negativo: " + b.cropSize);
        if (b.referenceIntensity < 0) throw new IllegalArgumentException("Intensidad de referencia negativa");
        for (Integer j : b.excludedModes) {
            if (j < 1) throw new IllegalArgumentException("Indice de Noll excluido invalido: " + j);
        }

        this.apertureMm = b.apertureMm;
        this.focalLengthMm = b.focalLengthMm;
        this.secondaryMm = b.secondaryMm;
        this.pixelSizeUm = b.pixelSizeUm;
        this.wavelengthNm = b.wavelengthNm;
        this.thresholdFraction = b.thresholdFraction;
        this.zernikeTerms = b.zernikeTerms;
        this.maxIterations = b.maxIterations;
        this.convergenceToleranceMm = b.convergenceToleranceMm;
        this.obstructionMode = b.obstructionMode;
        this.blurSigma = b.blurSigma;
        this.cropSize = b.cropSize;
        this.flipExtra = b.flipExtra;
        this.referenceFrequency = b.referenceFrequency;
        this.referenceIntensity = b.referenceIntensity;
        this.excludedModes = Collections.unmodifiableSet(new TreeSet<>(b.excludedModes));
    }

    public static RoddierConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.apertureMm = apertureMm;
        b.focalLengthMm = focalLengthMm;
        b.secondaryMm = secondaryMm;
        b.pixelSizeUm = pixelSizeUm;
        b.wavelengthNm = wavelengthNm;
        b.thresholdFraction = thresholdFraction;
        b.zernikeTerms = zernikeTerms;
        b.maxIterations = maxIterations;
        b.convergenceToleranceMm = convergenceToleranceMm;
        b.obstructionMode = obstructionMode;
        b.blurSigma = blurSigma;
        b.cropSize = cropSize;
        b.flipExtra = flipExtra;
        b.referenceFrequency = referenceFrequency;
        b.referenceIntensity = referenceIntensity;
        b.excludedModes = new TreeSet<>(excludedModes);
        return b;
    }

    /** Relacion focal N = F / D. */
    public double focalRatio() { return focalLengthMm / apertureMm; }

    public double obstructionRatio() { return secondaryMm / apertureMm; }

    public double pixelSizeMm() { return pixelSizeUm / 1000.0; }

    public double wavelengthMm() { return wavelengthNm / 1e6; }

    /** Indices de Noll 1..zernikeTerms que entran en la sintesis. */
    public List<Integer> synthesisModes() {
        List<Integer> modes = new ArrayList<>();
        for (int j = 1; j <= zernikeTerms; j++) {
            if (!excludedModes.contains(j)) modes.add(j);
        }
        return modes;
    }

    @Override
    public String toString() {
        return String.format("D=%.1fmm F=%.1fmm (f/%.2f) sec=%.1fmm pix=%.2fum lambda=%.0fnm umbral=%.2f terminos=%d iter=%d",
                apertureMm, focalLengthMm, focalRatio(), secondaryMm, pixelSizeUm, wavelengthNm,
                thresholdFraction, zernikeTerms, maxIterations);
    }

    public static class Builder {
        private double apertureMm = 200.0;
        private double focalLengthMm = 1000.0;
        private double secondaryMm = 0.0;
        private double pixelSizeUm = 3.76;
        private double wavelengthNm = DEFAULT_WAVELENGTH_NM;
        private double thresholdFraction = 0.5;
        private int zernikeTerms = 28;
        private int maxIterations = 10;
        private double convergenceToleranceMm = 1e-6;
        private ObstructionMode obstructionMode = ObstructionMode.PHYSICAL_RATIO;
        private double blurSigma = 1.0;
        private int cropSize = 250;
        private boolean flipExtra = true;
        private double referenceFrequency = 1.0;
        private double referenceIntensity = 0.5;
        private Set<Integer> excludedModes = new TreeSet<>(Collections.singleton(1));

        private Builder() {}

        public Builder aperture(double mm) { this.apertureMm = mm; return this; }
        public Builder focalLength(double mm) { this.focalLengthMm = mm; return this; }
        public Builder secondary(double mm) { this.secondaryMm = mm; return this; }
        public Builder pixelSize(double um) { this.pixelSizeUm = um; return this; }
        public Builder wavelength(double nm) { this.wavelengthNm = nm; return this; }
        public Builder threshold(double fraction) { this.thresholdFraction = fraction; return this; }
        public Builder zernikeTerms(int terms) { this.zernikeTerms = terms; return this; }
        public Builder maxIterations(int iterations) { this.maxIterations = iterations; return this; }
        public Builder convergenceTolerance(double mm) { this.convergenceToleranceMm = mm; return this; }
        public Builder obstructionMode(ObstructionMode mode) { this.obstructionMode = mode; return this; }
        public Builder blurSigma(double sigma) { this.blurSigma = sigma; return this; }
        public Builder cropSize(int pixels) { this.cropSize = pixels; return this; }
        public Builder flipExtra(boolean flip) { this.flipExtra = flip; return this; }
        public Builder referenceFrequency(double frequency) { this.referenceFrequency = frequency; return this; }
        public Builder referenceIntensity(double intensity) { this.referenceIntensity = intensity; return this; }
        public Builder excludedModes(Collection<Integer> noll) { this.excludedModes = new TreeSet<>(noll); return this; }

        public RoddierConfig build() {
            return new RoddierConfig(this);
        }
    }
}
