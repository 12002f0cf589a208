package com.roddier.service;

import com.roddier.exceptions.PupilGeometryException;
import com.roddier.exceptions.ShapeMismatchException;
import com.roddier.model.AnnularMask;
import com.roddier.model.PupilCenter;
import com.roddier.model.ZernikeBasisSet;
import com.roddier.model.ZernikeTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Base de Zernike en orden de Noll sobre una pupila arbitraria.
 *
 * <p>Cada mapa se evalua con la constante de Noll, se enmascara y despues se divide
 * por su norma L2 sobre la mascara, de modo que la base es unitaria para el producto
 * escalar discreto ponderado por la mascara.</p>
 */
public class ZernikeBasis {

    private static final Logger LOGGER = LoggerFactory.getLogger(ZernikeBasis.class);

    /** Numero de terminos hasta el orden radial {@code order} incluido. */
    public static int termsForRadialOrder(int order) {
        if (order < 0) throw new IllegalArgumentException("Orden radial negativo: " + order);
        return (order + 1) * (order + 2) / 2;
    }

    public ZernikeBasisSet generate(int height, int width, AnnularMask mask, double rOut,
                                    PupilCenter center, int termCount) {
        if (termCount < 1) {
            throw new IllegalArgumentException("Se necesita al menos un termino: " + termCount);
        }
        if (mask.height() != height || mask.width() != width) {
            throw new ShapeMismatchException("base de Zernike", "(" + height + ", " + width + ")", mask.shape());
        }
        if (mask.isEmpty()) {
            throw new PupilGeometryException("mascara vacia para la base de Zernike");
        }
        if (!(rOut > 0)) {
            throw new PupilGeometryException("R_out debe ser > 0: " + rOut);
        }

        // Coordenadas polares normalizadas, a cero fuera de la pupila
        double[][] rho = new double[height][width];
        double[][] theta = new double[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (mask.get(y, x)) {
                    double dx = x - center.cx;
                    double dy = y - center.cy;
                    rho[y][x] = Math.sqrt(dx * dx + dy * dy) / rOut;
                    theta[y][x] = Math.atan2(dy, dx);
                }
            }
        }

        List<double[][]> maps = new ArrayList<>(termCount);
        List<ZernikeTerm> terms = new ArrayList<>(termCount);
        double[] amplitudeScales = new double[termCount];

        for (int j = 1; j <= termCount; j++) {
            ZernikeTerm term = ZernikeTerm.fromNoll(j);
            double nollConstant = term.m == 0 ? Math.sqrt(term.n + 1) : Math.sqrt(2.0 * (term.n + 1));
            double[] radialCoeffs = radialCoefficients(term.n, Math.abs(term.m));

            double[][] z = new double[height][width];
            double norm2 = 0;
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    if (!mask.get(y, x)) continue;
                    double v = nollConstant * radial(radialCoeffs, term.n, rho[y][x]) * angular(term.m, theta[y][x]);
                    z[y][x] = v;
                    norm2 += v * v;
                }
            }

            double norm = Math.sqrt(norm2);
            if (norm > 0) {
                for (double[] row : z) {
                    for (int x = 0; x < width; x++) row[x] /= norm;
                }
                amplitudeScales[j - 1] = nollConstant / norm;
            } else {
                LOGGER.warn("Termino {} con norma nula sobre la mascara, queda a cero", term);
                amplitudeScales[j - 1] = 0.0;
            }
            maps.add(z);
            terms.add(term);
        }
        return new ZernikeBasisSet(maps, terms, amplitudeScales, mask, center, rOut);
    }

    // Coeficientes de R_n^m: c_k para rho^(n - 2k)
    static double[] radialCoefficients(int n, int m) {
        int kMax = (n - m) / 2;
        double[] c = new double[kMax + 1];
        for (int k = 0; k <= kMax; k++) {
            double num = factorial(n - k);
            double den = factorial(k) * factorial((n + m) / 2 - k) * factorial((n - m) / 2 - k);
            c[k] = (k % 2 == 0 ? 1 : -1) * num / den;
        }
        return c;
    }

    static double radial(double[] coeffs, int n, double rho) {
        double r = 0;
        for (int k = 0; k < coeffs.length; k++) {
            r += coeffs[k] * Math.pow(rho, n - 2 * k);
        }
        return r;
    }

    private static double angular(int m, double theta) {
        if (m > 0) return Math.cos(m * theta);
        if (m < 0) return Math.sin(-m * theta);
        return 1.0;
    }

    private static double factorial(int n) {
        double f = 1;
        for (int i = 2; i <= n; i++) f *= i;
        return f;
    }
}
