package com.roddier.model;

/** Centro de la pupila en coordenadas de pixel (x = columna, y = fila). */
public class PupilCenter {
    public final double cx;
    public final double cy;

    public PupilCenter(double cx, double cy) {
        this.cx = cx;
        this.cy = cy;
    }

    public double distanceTo(double x, double y) {
        double dx = x - cx;
        double dy = y - cy;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", cx, cy);
    }
}
