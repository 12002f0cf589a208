package com.roddier.service;

import com.roddier.exceptions.PupilGeometryException;
import com.roddier.math.ArrayOps;
import com.roddier.math.Fft2;
import com.roddier.model.AlignmentResult;
import com.roddier.model.AnnularMask;
import com.roddier.model.ObstructionMode;
import com.roddier.model.PupilCenter;
import com.roddier.model.PupilGeometry;
import com.roddier.model.RegistrationResult;
import com.roddier.model.RoddierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ImageRegistrar {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImageRegistrar.class);

    public RegistrationResult register(double[][] intra, double[][] extra, RoddierConfig config) {
        ArrayOps.requireSameShape(intra, extra, "registro intra/extra");

        AlignmentResult alignment = align(intra, extra);

        // Geometria sobre la media de ambas imagenes ya alineadas
        double[][] average = ArrayOps.scale(ArrayOps.add(intra, alignment.aligned), 0.5);
        PupilGeometry geometry = estimateCenterAndRadii(average, config.thresholdFraction,
                config.obstructionMode, config.obstructionRatio());
        AnnularMask mask = buildAnnularMask(geometry.center, geometry.rIn, geometry.rOut,
                intra.length, intra[0].length);

        LOGGER.debug("Registro: desplazamiento=({}, {}) {} pixeles_validos={}",
                alignment.shiftX, alignment.shiftY, geometry, mask.count());
        return new RegistrationResult(ArrayOps.copy(intra), alignment.aligned, alignment, geometry, mask);
    }

    /**
     * Alinea {@code b} sobre {@code a} con el maximo de la correlacion cruzada calculada
     * en frecuencia. El desplazamiento es entero; imagenes planas no se desplazan.
     */
    public AlignmentResult align(double[][] a, double[][] b) {
        ArrayOps.requireSameShape(a, b, "alineado");
        int h = a.length;
        int w = a[0].length;

        if (isFlat(a) || isFlat(b)) {
            LOGGER.warn("Imagen plana en el alineado, se usa desplazamiento nulo");
            return new AlignmentResult(ArrayOps.copy(b), 0, 0);
        }

        double[] fa = Fft2.toComplex(centered(a));
        double[] fb = Fft2.toComplex(centered(b));
        Fft2.forward(fa, h, w);
        Fft2.forward(fb, h, w);

        // A * conj(B)
        double[] cross = new double[fa.length];
        for (int i = 0; i < fa.length; i += 2) {
            double ar = fa[i], ai = fa[i + 1];
            double br = fb[i], bi = fb[i + 1];
            cross[i] = ar * br + ai * bi;
            cross[i + 1] = ai * br - ar * bi;
        }
        Fft2.inverse(cross, h, w);
        double[][] corr = Fft2.realPart(cross, h, w);

        int bestX = 0, bestY = 0;
        double best = Double.NEGATIVE_INFINITY;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (corr[y][x] > best) {
                    best = corr[y][x];
                    bestX = x;
                    bestY = y;
                }
            }
        }
        int dx = bestX > w / 2 ? bestX - w : bestX;
        int dy = bestY > h / 2 ? bestY - h : bestY;

        return new AlignmentResult(shift(b, dx, dy), dx, dy);
    }

    /**
     * Centroide ponderado por intensidad de los pixeles por encima de
     * {@code thresholdFraction * pico}. R_out es la distancia maxima al centroide;
     * R_in depende de {@code mode}.
     */
    public PupilGeometry estimateCenterAndRadii(double[][] image, double thresholdFraction,
                                                ObstructionMode mode, double obstructionRatio) {
        ArrayOps.requireRectangular(image, "estimacion de radios");
        double peak = ArrayOps.max(image);
        if (!(peak > 0)) {
            throw new PupilGeometryException("la imagen no tiene intensidad positiva");
        }
        double threshold = thresholdFraction * peak;

        double sw = 0, sx = 0, sy = 0;
        for (int y = 0; y < image.length; y++) {
            for (int x = 0; x < image[0].length; x++) {
                double v = image[y][x];
                if (v > threshold) {
                    sw += v;
                    sx += v * x;
                    sy += v * y;
                }
            }
        }
        if (sw == 0) {
            throw new PupilGeometryException("ningun pixel supera el umbral " + thresholdFraction);
        }
        PupilCenter center = new PupilCenter(sx / sw, sy / sw);

        double rMax = 0;
        double rMin = Double.POSITIVE_INFINITY;
        for (int y = 0; y < image.length; y++) {
            for (int x = 0; x < image[0].length; x++) {
                if (image[y][x] > threshold) {
                    double r = center.distanceTo(x, y);
                    if (r > rMax) rMax = r;
                    if (r < rMin) rMin = r;
                }
            }
        }
        if (rMax <= 0) {
            throw new PupilGeometryException("pupila de area nula en " + center);
        }

        double rIn = mode == ObstructionMode.AUTO ? rMin : rMax * obstructionRatio;
        return new PupilGeometry(center, rMax, rIn);
    }

    public AnnularMask buildAnnularMask(PupilCenter center, double rIn, double rOut, int height, int width) {
        if (rIn > rOut) {
            throw new PupilGeometryException(String.format("R_in %.2f > R_out %.2f", rIn, rOut));
        }
        AnnularMask mask = AnnularMask.annulus(center, rIn, rOut, height, width);
        if (mask.isEmpty()) {
            throw new PupilGeometryException(String.format("mascara anular vacia (centro=%s R_in=%.2f R_out=%.2f)",
                    center, rIn, rOut));
        }
        return mask;
    }

    /**
     * Traslacion con interpolacion bilineal y relleno a cero:
     * salida(y, x) = entrada(y - dy, x - dx). Desplazamientos enteros copian exacto.
     */
    public double[][] shift(double[][] image, double dx, double dy) {
        int h = image.length;
        int w = image[0].length;
        double[][] out = new double[h][w];
        for (int y = 0; y < h; y++) {
            double sy = y - dy;
            int y0 = (int) Math.floor(sy);
            double fy = sy - y0;
            for (int x = 0; x < w; x++) {
                double sx = x - dx;
                int x0 = (int) Math.floor(sx);
                double fx = sx - x0;
                out[y][x] = (1 - fy) * ((1 - fx) * sample(image, y0, x0) + fx * sample(image, y0, x0 + 1))
                        + fy * ((1 - fx) * sample(image, y0 + 1, x0) + fx * sample(image, y0 + 1, x0 + 1));
            }
        }
        return out;
    }

    private static double sample(double[][] image, int y, int x) {
        if (y < 0 || y >= image.length || x < 0 || x >= image[0].length) return 0.0;
        return image[y][x];
    }

    private static boolean isFlat(double[][] image) {
        return ArrayOps.max(image) == ArrayOps.min(image);
    }

    private static double[][] centered(double[][] image) {
        double mean = ArrayOps.mean(image);
        double[][] out = new double[image.length][image[0].length];
        for (int y = 0; y < image.length; y++) {
            for (int x = 0; x < image[0].length; x++) out[y][x] = image[y][x] - mean;
        }
        return out;
    }
}
