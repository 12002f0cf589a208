package com.roddier.service;

import com.roddier.math.ArrayOps;
import com.roddier.math.Fft2;
import com.roddier.model.AnnularMask;
import com.roddier.model.PsfNormalization;
import com.roddier.model.PsfResult;

/**
 * Modelos directos para validar visualmente un frente de onda: interferograma
 * simulado y PSF.
 */
public class SynthesisModels {

    static final double LOG_EPSILON = 1e-8;

    /**
     * Interferencia del frente de onda (en ondas) con una onda plana de intensidad
     * {@code referenceIntensity}, con una portadora de tilt lineal en X+Y de
     * {@code referenceFrequency} franjas sobre la imagen.
     */
    public double[][] calculateInterferogram(double[][] wavefrontWaves, double referenceFrequency,
                                             double referenceIntensity, AnnularMask mask, boolean normalize) {
        ArrayOps.requireSameShape(wavefrontWaves, mask, "interferograma");
        if (referenceIntensity < 0) {
            throw new IllegalArgumentException("Intensidad de referencia negativa: " + referenceIntensity);
        }
        int h = wavefrontWaves.length;
        int w = wavefrontWaves[0].length;
        double[] xs = linspace(w);
        double[] ys = linspace(h);
        double reference = Math.sqrt(referenceIntensity);

        double[][] out = new double[h][w];
        double peak = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!mask.get(y, x)) continue;
                double tilt = 2 * Math.PI * referenceFrequency * ((xs[x] + ys[y]) / 2);
                double phase = 2 * Math.PI * wavefrontWaves[y][x] + tilt;
                double re = Math.cos(phase) + reference;
                double im = Math.sin(phase);
                double v = re * re + im * im;
                out[y][x] = v;
                if (v > peak) peak = v;
            }
        }
        if (normalize && peak > 0) {
            for (double[] row : out) {
                for (int x = 0; x < w; x++) row[x] /= peak;
            }
        }
        return out;
    }

    /**
     * PSF de la pupila {@code mask * exp(i 2pi W waveScale)}: FFT centrada
     * (ifftshift, FFT, fftshift), |E|^2 normalizada, y log10(PSF + 1e-8).
     * {@code waveScale} pasa las unidades del frente de onda a ondas.
     */
    public PsfResult calculatePsf(double[][] wavefront, AnnularMask mask, double waveScale,
                                  PsfNormalization normalization) {
        ArrayOps.requireSameShape(wavefront, mask, "PSF");
        int h = wavefront.length;
        int w = wavefront[0].length;

        double[] pupil = new double[h * 2 * w];
        for (int y = 0; y < h; y++) {
            int row = y * 2 * w;
            for (int x = 0; x < w; x++) {
                if (!mask.get(y, x)) continue;
                double phase = 2 * Math.PI * wavefront[y][x] * waveScale;
                pupil[row + 2 * x] = Math.cos(phase);
                pupil[row + 2 * x + 1] = Math.sin(phase);
            }
        }

        double[] field = Fft2.ifftshift(pupil, h, w);
        Fft2.forward(field, h, w);
        field = Fft2.fftshift(field, h, w);
        double[][] psf = Fft2.power(field, h, w);

        double norm = normalization == PsfNormalization.PEAK ? ArrayOps.max(psf) : ArrayOps.sum(psf);
        double[][] psfLog = new double[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (norm > 0) psf[y][x] /= norm;
                psfLog[y][x] = Math.log10(psf[y][x] + LOG_EPSILON);
            }
        }
        return new PsfResult(psf, psfLog);
    }

    // n puntos equiespaciados en [-1, 1]
    private static double[] linspace(int n) {
        double[] v = new double[n];
        if (n == 1) return v;
        for (int i = 0; i < n; i++) v[i] = -1.0 + 2.0 * i / (n - 1);
        return v;
    }
}
