package com.roddier.service;

import com.roddier.math.ArrayOps;
import com.roddier.math.Fft2;
import com.roddier.model.AnnularMask;
import com.roddier.model.WavefrontResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resuelve la ecuacion de Roddier linealizada (Poisson) en el dominio de Fourier.
 *
 * <p>Convencion fija: W = mascara * escala * IFFT( FFT(dI/I0) / (-k^2) ), con k en
 * ciclos/pixel, componente continua a cero y bins con k^2 <= 1e-8 a cero.</p>
 *
 * <p>Dos escalas fisicas: {@link #physicalScale} ((lambda / 4pi) * dz) y
 * {@link #opdScale}, que da la diferencia de camino optico en mm a partir de la
 * ecuacion de transporte -dz * laplaciano(W) = dI/I0 en el plano de la imagen
 * desenfocada. El refinamiento y el pipeline trabajan siempre con {@link #opdScale}.</p>
 */
public class WavefrontSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(WavefrontSolver.class);

    static final double MIN_FREQ_SQUARED = 1e-8;

    /**
     * Fraccion del maximo de intra + extra por debajo de la cual la diferencia
     * normalizada se anula. Con el corte en e^-2 la integral de la senal de borde de
     * una pupila suavizada coincide con la de un borde nitido.
     */
    public static final double SIGNAL_FLOOR = Math.exp(-2.0);

    /** (extra - intra) / (extra + intra), cero donde la suma es cero. */
    public double[][] normalizedDifference(double[][] intra, double[][] extra) {
        return normalizedDifference(intra, extra, 0.0);
    }

    /**
     * Igual que {@link #normalizedDifference(double[][], double[][])} pero tambien a cero
     * donde intra + extra no supera {@code floorFraction} veces su maximo.
     */
    public double[][] normalizedDifference(double[][] intra, double[][] extra, double floorFraction) {
        ArrayOps.requireSameShape(intra, extra, "diferencia normalizada");
        int h = intra.length;
        int w = intra[0].length;
        boolean floored = floorFraction > 0;
        double floor = 0.0;
        if (floored) {
            double maxSum = Double.NEGATIVE_INFINITY;
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) maxSum = Math.max(maxSum, extra[y][x] + intra[y][x]);
            }
            floor = Math.max(0.0, floorFraction * maxSum);
        }
        double[][] out = new double[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double sum = extra[y][x] + intra[y][x];
                boolean valid = floored ? sum > floor : sum != 0;
                out[y][x] = valid ? (extra[y][x] - intra[y][x]) / sum : 0.0;
            }
        }
        return out;
    }

    /** Frente de onda en unidades del solver (sin escala fisica). */
    public double[][] solve(double[][] deltaNorm, AnnularMask mask) {
        return solve(deltaNorm, mask, 1.0);
    }

    /** Frente de onda con la escala (lambda_mm / 4pi) * dz_mm. */
    public double[][] solve(double[][] deltaNorm, AnnularMask mask, double wavelengthNm, double defocusMm) {
        return solve(deltaNorm, mask, physicalScale(wavelengthNm, defocusMm));
    }

    public WavefrontResult reconstruct(double[][] intra, double[][] extra, AnnularMask mask,
                                       double wavelengthNm, double defocusMm) {
        double[][] delta = normalizedDifference(intra, extra);
        double scale = physicalScale(wavelengthNm, defocusMm);
        return new WavefrontResult(delta, solve(delta, mask, scale), scale);
    }

    /**
     * Diferencia de camino optico en mm: diferencia normalizada con el corte
     * {@link #SIGNAL_FLOOR} y escala {@link #opdScale}.
     */
    public WavefrontResult reconstructOpd(double[][] intra, double[][] extra, AnnularMask mask,
                                          double pixelSizeMm, double defocusMm) {
        double[][] delta = normalizedDifference(intra, extra, SIGNAL_FLOOR);
        double scale = opdScale(pixelSizeMm, defocusMm);
        return new WavefrontResult(delta, solve(delta, mask, scale), scale);
    }

    public static double physicalScale(double wavelengthNm, double defocusMm) {
        double wavelengthMm = wavelengthNm / 1e6;
        return (wavelengthMm / (4 * Math.PI)) * defocusMm;
    }

    /**
     * -pixel_mm^2 / (4 pi^2 dz): pasa la salida del solver (k en ciclos/pixel) a OPD en mm.
     * El signo deja un tilt positivo cuando la imagen extra esta desplazada hacia +x.
     */
    public static double opdScale(double pixelSizeMm, double defocusMm) {
        if (!(pixelSizeMm > 0) || !(defocusMm > 0)) {
            throw new IllegalArgumentException(String.format(
                    "Escala OPD con pixel=%s mm y dz=%s mm", pixelSizeMm, defocusMm));
        }
        return -(pixelSizeMm * pixelSizeMm) / (4 * Math.PI * Math.PI * defocusMm);
    }

    private double[][] solve(double[][] deltaNorm, AnnularMask mask, double scale) {
        ArrayOps.requireSameShape(deltaNorm, mask, "solver de frente de onda");
        int h = deltaNorm.length;
        int w = deltaNorm[0].length;
        if (mask.isEmpty()) {
            LOGGER.warn("Mascara vacia, el frente de onda es nulo");
            return new double[h][w];
        }

        double[] data = Fft2.toComplex(deltaNorm);
        Fft2.forward(data, h, w);

        double[] fy = Fft2.frequencies(h);
        double[] fx = Fft2.frequencies(w);
        data[0] = 0.0;
        data[1] = 0.0;
        for (int y = 0; y < h; y++) {
            int row = y * 2 * w;
            for (int x = 0; x < w; x++) {
                double k2 = fx[x] * fx[x] + fy[y] * fy[y];
                int i = row + 2 * x;
                if (k2 > MIN_FREQ_SQUARED) {
                    data[i] /= -k2;
                    data[i + 1] /= -k2;
                } else {
                    data[i] = 0.0;
                    data[i + 1] = 0.0;
                }
            }
        }
        Fft2.inverse(data, h, w);

        double[][] wavefront = Fft2.realPart(data, h, w);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                wavefront[y][x] = mask.get(y, x) ? wavefront[y][x] * scale : 0.0;
            }
        }
        return wavefront;
    }
}
