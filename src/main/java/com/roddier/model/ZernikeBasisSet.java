package com.roddier.model;

import java.util.Collections;
import java.util.List;

/**
 * Base de Zernike ortonormalizada sobre la mascara. Los mapas se comparten con el
 * llamador, no deben modificarse.
 */
public class ZernikeBasisSet {
    public final List<double[][]> maps;
    public final List<ZernikeTerm> terms;
    public final AnnularMask mask;
    public final PupilCenter center;
    public final double rOut;
    // Convierte un coeficiente ajustado en la amplitud del polinomio clasico sin normalizar
    private final double[] amplitudeScales;

    public ZernikeBasisSet(List<double[][]> maps, List<ZernikeTerm> terms, double[] amplitudeScales,
                           AnnularMask mask, PupilCenter center, double rOut) {
        this.maps = Collections.unmodifiableList(maps);
        this.terms = Collections.unmodifiableList(terms);
        this.amplitudeScales = amplitudeScales.clone();
        this.mask = mask;
        this.center = center;
        this.rOut = rOut;
    }

    public int size() { return maps.size(); }

    public int height() { return mask.height(); }

    public int width() { return mask.width(); }

    /** Mapa del indice de Noll j (1..size). */
    public double[][] forNoll(int j) { return maps.get(j - 1); }

    public double amplitudeScale(int index) { return amplitudeScales[index]; }
}
