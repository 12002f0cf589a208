package com.roddier.model;

import java.util.Arrays;

/**
 * Mascara booleana de la pupila valida. Inmutable: el array se copia al construir
 * y nunca se expone.
 */
public class AnnularMask {

    private final boolean[][] values;
    private final int height;
    private final int width;
    private final int count;

    public AnnularMask(boolean[][] values) {
        if (values == null || values.length == 0 || values[0].length == 0) {
            throw new IllegalArgumentException("La mascara no puede ser vacia en forma");
        }
        this.height = values.length;
        this.width = values[0].length;
        this.values = new boolean[height][width];
        int n = 0;
        for (int y = 0; y < height; y++) {
            if (values[y].length != width) {
                throw new IllegalArgumentException("Mascara irregular en la fila " + y);
            }
            for (int x = 0; x < width; x++) {
                this.values[y][x] = values[y][x];
                if (values[y][x]) n++;
            }
        }
        this.count = n;
    }

    /** Anillo R_in <= r <= R_out alrededor de {@code center}. Puede quedar vacio. */
    public static AnnularMask annulus(PupilCenter center, double rIn, double rOut, int height, int width) {
        boolean[][] v = new boolean[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double r = center.distanceTo(x, y);
                v[y][x] = r >= rIn && r <= rOut;
            }
        }
        return new AnnularMask(v);
    }

    public static AnnularMask full(int height, int width) {
        boolean[][] v = new boolean[height][width];
        for (boolean[] row : v) Arrays.fill(row, true);
        return new AnnularMask(v);
    }

    public boolean get(int y, int x) { return values[y][x]; }

    public int height() { return height; }

    public int width() { return width; }

    /** Numero de pixeles validos. */
    public int count() { return count; }

    public boolean isEmpty() { return count == 0; }

    public boolean[][] toArray() {
        boolean[][] copy = new boolean[height][];
        for (int y = 0; y < height; y++) copy[y] = values[y].clone();
        return copy;
    }

    public String shape() {
        return "(" + height + ", " + width + ")";
    }
}
