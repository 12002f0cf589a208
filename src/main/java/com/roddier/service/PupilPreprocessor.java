package com.roddier.service;

import com.roddier.exceptions.PupilGeometryException;
import com.roddier.math.ArrayOps;
import com.roddier.model.PreparedPair;
import com.roddier.model.PupilCenter;
import com.roddier.model.RoddierConfig;
import ij.plugin.filter.GaussianBlur;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Preparacion de la pareja intra/extra antes del test: giro de la extra-focal,
 * recorte centrado en cada donut, suavizado y ecualizacion de energia.
 */
public class PupilPreprocessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PupilPreprocessor.class);

    private static final double CENTROID_THRESHOLD = 0.1;
    private static final double BLUR_ACCURACY = 0.002;

    public PreparedPair prepare(double[][] intra, double[][] extra, RoddierConfig config) {
        ArrayOps.requireRectangular(intra, "imagen intra-focal");
        ArrayOps.requireRectangular(extra, "imagen extra-focal");

        checkSignal(intra, "intra-focal");
        checkSignal(extra, "extra-focal");

        // La extra-focal llega girada 180 grados respecto a la intra-focal
        double[][] extraOriented = config.flipExtra ? rotate180(extra) : extra;

        double[][] intraCrop = intra;
        double[][] extraCrop = extraOriented;
        if (config.cropSize > 0) {
            PupilCenter ci = centroid(intra);
            PupilCenter ce = centroid(extraOriented);
            intraCrop = cropAround(intra, ci.cx, ci.cy, config.cropSize);
            extraCrop = cropAround(extraOriented, ce.cx, ce.cy, config.cropSize);
            LOGGER.debug("Recorte {} px en intra {} y extra {}", config.cropSize, ci, ce);
        } else {
            ArrayOps.requireSameShape(intra, extraOriented, "pareja sin recorte");
        }

        if (config.blurSigma > 0) {
            intraCrop = smooth(intraCrop, config.blurSigma);
            extraCrop = smooth(extraCrop, config.blurSigma);
        }

        double[][][] equalized = equalizeEnergy(intraCrop, extraCrop);
        return new PreparedPair(equalized[0], equalized[1]);
    }

    public double[][] rotate180(double[][] image) {
        FloatProcessor fp = toProcessor(image);
        fp.flipHorizontal();
        fp.flipVertical();
        return toArray(fp);
    }

    /**
     * Centroide de los pixeles por encima del 10% del rango normalizado. Sin pixeles
     * significativos devuelve el centro geometrico.
     */
    public PupilCenter centroid(double[][] image) {
        int h = image.length;
        int w = image[0].length;
        double min = ArrayOps.min(image);
        double range = ArrayOps.max(image) - min;
        if (range <= 0) {
            return new PupilCenter((w - 1) / 2.0, (h - 1) / 2.0);
        }
        double total = 0, sx = 0, sy = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = (image[y][x] - min) / range;
                if (v > CENTROID_THRESHOLD) {
                    total += v;
                    sx += v * x;
                    sy += v * y;
                }
            }
        }
        if (total == 0) {
            return new PupilCenter((w - 1) / 2.0, (h - 1) / 2.0);
        }
        return new PupilCenter(sx / total, sy / total);
    }

    /** Recorte cuadrado centrado en (cx, cy); fuera de la imagen se rellena con cero. */
    public double[][] cropAround(double[][] image, double cx, double cy, int size) {
        if (size < 1) throw new IllegalArgumentException("Tamano de recorte invalido: " + size);
        int x0 = (int) Math.round(cx) - size / 2;
        int y0 = (int) Math.round(cy) - size / 2;
        double[][] out = new double[size][size];
        for (int y = 0; y < size; y++) {
            int sy = y0 + y;
            if (sy < 0 || sy >= image.length) continue;
            for (int x = 0; x < size; x++) {
                int sx = x0 + x;
                if (sx < 0 || sx >= image[0].length) continue;
                out[y][x] = image[sy][sx];
            }
        }
        return out;
    }

    public double[][] smooth(double[][] image, double sigma) {
        FloatProcessor fp = toProcessor(image);
        new GaussianBlur().blurGaussian(fp, sigma, sigma, BLUR_ACCURACY);
        return toArray(fp);
    }

    /** Escala la extra-focal para que tenga la misma energia total que la intra-focal. */
    public double[][][] equalizeEnergy(double[][] intra, double[][] extra) {
        ArrayOps.requireSameShape(intra, extra, "ecualizacion de energia");
        double sumIntra = ArrayOps.sum(intra);
        double sumExtra = ArrayOps.sum(extra);
        if (sumExtra == 0) {
            throw new PupilGeometryException("imagen extra-focal con suma cero");
        }
        return new double[][][] {ArrayOps.copy(intra), ArrayOps.scale(extra, sumIntra / sumExtra)};
    }

    private static void checkSignal(double[][] image, String name) {
        ImageStatistics stats = toProcessor(image).getStatistics();
        if (stats.max <= stats.min) {
            LOGGER.warn("Imagen {} plana (valor {})", name, stats.max);
        } else {
            LOGGER.debug("Imagen {}: media={} desv={} max={}", name, stats.mean, stats.stdDev, stats.max);
        }
    }

    private static FloatProcessor toProcessor(double[][] data) {
        int w = data[0].length;
        FloatProcessor ip = new FloatProcessor(w, data.length);
        float[] px = (float[]) ip.getPixels();
        for (int y = 0; y < data.length; y++)
            for (int x = 0; x < w; x++)
                px[y * w + x] = (float) data[y][x];
        return ip;
    }

    private static double[][] toArray(FloatProcessor ip) {
        int w = ip.getWidth();
        int h = ip.getHeight();
        float[] px = (float[]) ip.getPixels();
        double[][] out = new double[h][w];
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                out[y][x] = px[y * w + x];
        return out;
    }
}
