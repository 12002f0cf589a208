package com.roddier.math;

import org.jtransforms.fft.DoubleFFT_2D;

/**
 * FFT compleja 2D sobre arrays intercalados (re, im) fila a fila, en el formato de
 * {@link DoubleFFT_2D#complexForward(double[])}: elemento (y, x) en
 * {@code data[y * 2 * width + 2 * x]} (real) y {@code +1} (imaginaria).
 */
public final class Fft2 {

    private Fft2() {}

    public static double[] toComplex(double[][] real) {
        int h = real.length;
        int w = real[0].length;
        double[] data = new double[h * 2 * w];
        for (int y = 0; y < h; y++) {
            int row = y * 2 * w;
            for (int x = 0; x < w; x++) data[row + 2 * x] = real[y][x];
        }
        return data;
    }

    public static void forward(double[] data, int height, int width) {
        new DoubleFFT_2D(height, width).complexForward(data);
    }

    /** Inversa normalizada (divide por height * width). */
    public static void inverse(double[] data, int height, int width) {
        new DoubleFFT_2D(height, width).complexInverse(data, true);
    }

    public static double[][] realPart(double[] data, int height, int width) {
        double[][] out = new double[height][width];
        for (int y = 0; y < height; y++) {
            int row = y * 2 * width;
            for (int x = 0; x < width; x++) out[y][x] = data[row + 2 * x];
        }
        return out;
    }

    /** |z|^2 por elemento. */
    public static double[][] power(double[] data, int height, int width) {
        double[][] out = new double[height][width];
        for (int y = 0; y < height; y++) {
            int row = y * 2 * width;
            for (int x = 0; x < width; x++) {
                double re = data[row + 2 * x];
                double im = data[row + 2 * x + 1];
                out[y][x] = re * re + im * im;
            }
        }
        return out;
    }

    /** Frecuencias de muestreo en ciclos/pixel, mismo orden que la salida de la FFT. */
    public static double[] frequencies(int n) {
        double[] f = new double[n];
        int half = (n - 1) / 2;
        for (int i = 0; i <= half; i++) f[i] = (double) i / n;
        for (int i = half + 1; i < n; i++) f[i] = (double) (i - n) / n;
        return f;
    }

    /** Lleva la frecuencia cero al centro geometrico (indice n/2). */
    public static double[] fftshift(double[] data, int height, int width) {
        return roll(data, height, width, height / 2, width / 2);
    }

    /** Inversa de {@link #fftshift}, valida tambien para tamanos impares. */
    public static double[] ifftshift(double[] data, int height, int width) {
        return roll(data, height, width, height - height / 2, width - width / 2);
    }

    private static double[] roll(double[] data, int height, int width, int dy, int dx) {
        double[] out = new double[data.length];
        for (int y = 0; y < height; y++) {
            int ty = (y + dy) % height;
            for (int x = 0; x < width; x++) {
                int tx = (x + dx) % width;
                int src = y * 2 * width + 2 * x;
                int dst = ty * 2 * width + 2 * tx;
                out[dst] = data[src];
                out[dst + 1] = data[src + 1];
            }
        }
        return out;
    }
}
