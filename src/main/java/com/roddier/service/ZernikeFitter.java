package com.roddier.service;

import Jama.Matrix;
import Jama.SingularValueDecomposition;
import com.roddier.exceptions.PupilGeometryException;
import com.roddier.exceptions.ShapeMismatchException;
import com.roddier.math.ArrayOps;
import com.roddier.model.AnnularMask;
import com.roddier.model.FitResult;
import com.roddier.model.PupilCenter;
import com.roddier.model.ZernikeBasisSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

public class ZernikeFitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ZernikeFitter.class);

    private final ZernikeBasis basisGenerator;

    public ZernikeFitter() {
        this(new ZernikeBasis());
    }

    public ZernikeFitter(ZernikeBasis basisGenerator) {
        this.basisGenerator = basisGenerator;
    }

    /**
     * Minimos cuadrados sobre los pixeles de la mascara. Si el sistema no tiene rango
     * completo se devuelve la solucion de norma minima.
     */
    public FitResult fit(double[][] wavefront, AnnularMask mask, ZernikeBasisSet basis) {
        ArrayOps.requireSameShape(wavefront, mask, "ajuste de Zernike (frente de onda/mascara)");
        if (basis.height() != mask.height() || basis.width() != mask.width()) {
            throw new ShapeMismatchException("ajuste de Zernike (base/mascara)", mask.shape(),
                    "(" + basis.height() + ", " + basis.width() + ")");
        }
        if (mask.isEmpty()) {
            throw new PupilGeometryException("mascara vacia en el ajuste de Zernike");
        }

        int rows = mask.count();
        int cols = basis.size();
        double[][] a = new double[rows][cols];
        double[] b = new double[rows];
        int i = 0;
        for (int y = 0; y < mask.height(); y++) {
            for (int x = 0; x < mask.width(); x++) {
                if (!mask.get(y, x)) continue;
                for (int j = 0; j < cols; j++) a[i][j] = basis.maps.get(j)[y][x];
                b[i] = wavefront[y][x];
                i++;
            }
        }

        double[] coefficients = minimumNormSolve(new Matrix(a, rows, cols), b);

        double residual = 0;
        for (int r = 0; r < rows; r++) {
            double model = 0;
            for (int j = 0; j < cols; j++) model += a[r][j] * coefficients[j];
            double d = b[r] - model;
            residual += d * d;
        }
        double residualRms = Math.sqrt(residual / rows);
        LOGGER.debug("Ajuste de {} terminos sobre {} pixeles, residuo RMS={}", cols, rows, residualRms);
        return new FitResult(coefficients, basis, residualRms);
    }

    /** Suma ponderada de todos los mapas de la base. */
    public double[][] reconstruct(double[] coefficients, ZernikeBasisSet basis) {
        requireCoefficientCount(coefficients, basis);
        double[][] out = new double[basis.height()][basis.width()];
        for (int j = 0; j < coefficients.length; j++) {
            accumulate(out, basis.maps.get(j), coefficients[j]);
        }
        return out;
    }

    public double[][] reconstruct(double[] coefficients, ZernikeBasisSet basis, AnnularMask mask) {
        return ArrayOps.applyMask(reconstruct(coefficients, basis), mask);
    }

    /** Reconstruccion con un subconjunto de indices de Noll (1..N). */
    public double[][] reconstruct(double[] coefficients, ZernikeBasisSet basis, Collection<Integer> nollIndices) {
        requireCoefficientCount(coefficients, basis);
        double[][] out = new double[basis.height()][basis.width()];
        for (int j : nollIndices) {
            if (j < 1 || j > basis.size()) {
                throw new IllegalArgumentException("Indice de Noll fuera de la base: " + j);
            }
            accumulate(out, basis.forNoll(j), coefficients[j - 1]);
        }
        return out;
    }

    /**
     * Rellena la sombra del secundario: ajusta sobre el anillo una base definida en el
     * disco completo y devuelve la reconstruccion sobre el disco.
     */
    public double[][] fillObstruction(double[][] wavefront, AnnularMask annularMask, PupilCenter center,
                                      double rOut, int termCount) {
        ArrayOps.requireSameShape(wavefront, annularMask, "relleno de obstruccion");
        int h = annularMask.height();
        int w = annularMask.width();
        AnnularMask disk = AnnularMask.annulus(center, 0.0, rOut, h, w);
        ZernikeBasisSet diskBasis = basisGenerator.generate(h, w, disk, rOut, center, termCount);
        FitResult fit = fit(wavefront, annularMask, diskBasis);
        return reconstruct(fit.coefficients, diskBasis, disk);
    }

    private static void accumulate(double[][] out, double[][] map, double c) {
        if (c == 0) return;
        for (int y = 0; y < out.length; y++) {
            for (int x = 0; x < out[0].length; x++) out[y][x] += c * map[y][x];
        }
    }

    private static void requireCoefficientCount(double[] coefficients, ZernikeBasisSet basis) {
        if (coefficients.length != basis.size()) {
            throw new ShapeMismatchException("coeficientes de Zernike", String.valueOf(basis.size()),
                    String.valueOf(coefficients.length));
        }
    }

    // x = pinv(A) b por SVD; valores singulares por debajo de la tolerancia se descartan
    static double[] minimumNormSolve(Matrix a, double[] b) {
        int rows = a.getRowDimension();
        int cols = a.getColumnDimension();
        boolean wide = rows < cols;

        // Jama necesita filas >= columnas: para sistemas anchos se descompone A^T
        SingularValueDecomposition svd = new SingularValueDecomposition(wide ? a.transpose() : a);
        double[] s = svd.getSingularValues();
        Matrix left = wide ? svd.getU() : svd.getV();
        Matrix right = wide ? svd.getV() : svd.getU();

        double tol = Math.max(rows, cols) * (s.length > 0 ? s[0] : 0) * Math.ulp(1.0);
        double[] x = new double[cols];
        for (int k = 0; k < s.length; k++) {
            if (s[k] <= tol) continue;
            double proj = 0;
            for (int r = 0; r < rows; r++) proj += right.get(r, k) * b[r];
            proj /= s[k];
            for (int c = 0; c < cols; c++) x[c] += left.get(c, k) * proj;
        }
        return x;
    }
}
