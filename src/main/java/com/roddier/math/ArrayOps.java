package com.roddier.math;

import com.roddier.exceptions.ShapeMismatchException;
import com.roddier.model.AnnularMask;

/**
 * Operaciones elementales sobre imagenes double[fila][columna]. Nunca modifican
 * los arrays de entrada.
 */
public final class ArrayOps {

    private ArrayOps() {}

    public static String shape(double[][] a) {
        return "(" + a.length + ", " + (a.length == 0 ? 0 : a[0].length) + ")";
    }

    public static void requireRectangular(double[][] a, String what) {
        if (a == null || a.length == 0 || a[0].length == 0) {
            throw new IllegalArgumentException(what + ": imagen vacia");
        }
        int w = a[0].length;
        for (int y = 1; y < a.length; y++) {
            if (a[y].length != w) {
                throw new ShapeMismatchException(what + " (fila " + y + ")", String.valueOf(w), String.valueOf(a[y].length));
            }
        }
    }

    public static void requireSameShape(double[][] a, double[][] b, String what) {
        requireRectangular(a, what);
        requireRectangular(b, what);
        if (a.length != b.length || a[0].length != b[0].length) {
            throw new ShapeMismatchException(what, shape(a), shape(b));
        }
    }

    public static void requireSameShape(double[][] a, AnnularMask mask, String what) {
        requireRectangular(a, what);
        if (a.length != mask.height() || a[0].length != mask.width()) {
            throw new ShapeMismatchException(what, mask.shape(), shape(a));
        }
    }

    public static double[][] copy(double[][] a) {
        double[][] out = new double[a.length][];
        for (int y = 0; y < a.length; y++) out[y] = a[y].clone();
        return out;
    }

    /** Copia con ceros fuera de la mascara. */
    public static double[][] applyMask(double[][] a, AnnularMask mask) {
        return fillOutside(a, mask, 0.0);
    }

    /** Copia con {@code value} fuera de la mascara (p.ej. NaN para visualizacion). */
    public static double[][] fillOutside(double[][] a, AnnularMask mask, double value) {
        requireSameShape(a, mask, "fillOutside");
        double[][] out = new double[a.length][a[0].length];
        for (int y = 0; y < a.length; y++) {
            for (int x = 0; x < a[0].length; x++) {
                out[y][x] = mask.get(y, x) ? a[y][x] : value;
            }
        }
        return out;
    }

    public static double[][] add(double[][] a, double[][] b) {
        requireSameShape(a, b, "add");
        double[][] out = new double[a.length][a[0].length];
        for (int y = 0; y < a.length; y++) {
            for (int x = 0; x < a[0].length; x++) out[y][x] = a[y][x] + b[y][x];
        }
        return out;
    }

    public static double[][] scale(double[][] a, double factor) {
        double[][] out = new double[a.length][a[0].length];
        for (int y = 0; y < a.length; y++) {
            for (int x = 0; x < a[0].length; x++) out[y][x] = a[y][x] * factor;
        }
        return out;
    }

    public static double sum(double[][] a) {
        double s = 0;
        for (double[] row : a) for (double v : row) s += v;
        return s;
    }

    public static double max(double[][] a) {
        double m = Double.NEGATIVE_INFINITY;
        for (double[] row : a) for (double v : row) if (v > m) m = v;
        return m;
    }

    public static double min(double[][] a) {
        double m = Double.POSITIVE_INFINITY;
        for (double[] row : a) for (double v : row) if (v < m) m = v;
        return m;
    }

    public static double mean(double[][] a) {
        return sum(a) / ((double) a.length * a[0].length);
    }

    public static boolean allFinite(double[][] a) {
        for (double[] row : a) for (double v : row) if (!Double.isFinite(v)) return false;
        return true;
    }

    /** RMS sobre los pixeles de la mascara. */
    public static double rms(double[][] a, AnnularMask mask) {
        requireSameShape(a, mask, "rms");
        if (mask.isEmpty()) return 0.0;
        double s = 0;
        for (int y = 0; y < a.length; y++) {
            for (int x = 0; x < a[0].length; x++) {
                if (mask.get(y, x)) s += a[y][x] * a[y][x];
            }
        }
        return Math.sqrt(s / mask.count());
    }
}
