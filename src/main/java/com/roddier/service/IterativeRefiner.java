package com.roddier.service;

import com.roddier.model.AnnularMask;
import com.roddier.model.FitResult;
import com.roddier.model.ObstructionMode;
import com.roddier.model.PupilCenter;
import com.roddier.model.RefinementResult;
import com.roddier.model.RefinementStatus;
import com.roddier.model.RefinerState;
import com.roddier.model.RegistrationResult;
import com.roddier.model.RoddierConfig;
import com.roddier.model.WavefrontResult;
import com.roddier.math.ArrayOps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ciclo registro -> solver -> ajuste de bajo orden -> correccion de foco y tilt.
 *
 * <p>El frente de onda de cada iteracion es OPD en mm ({@link WavefrontSolver#opdScale}),
 * asi que las amplitudes a2, a3 y a4 del ajuste de bajo orden son mm en el borde de
 * la pupila. El defocus se convierte en desplazamiento focal (16 N^2 a4) sobre la
 * distancia medida en la primera iteracion, y con ella el radio efectivo de la pupila.
 * El tilt desplaza cada imagen 2 N a / pixel en sentidos opuestos; el desplazamiento
 * es acumulativo porque el tilt medido despues es el residual. Termina cuando el
 * cambio de (a2, a3, a4) baja de la tolerancia o al agotar las iteraciones.</p>
 */
public class IterativeRefiner {

    private static final Logger LOGGER = LoggerFactory.getLogger(IterativeRefiner.class);

    private static final int LOW_ORDER_TERMS = 4;

    private final ImageRegistrar registrar;
    private final WavefrontSolver solver;
    private final ZernikeBasis basis;
    private final ZernikeFitter fitter;

    public IterativeRefiner() {
        this(new ImageRegistrar(), new WavefrontSolver(), new ZernikeBasis(), new ZernikeFitter());
    }

    public IterativeRefiner(ImageRegistrar registrar, WavefrontSolver solver, ZernikeBasis basis, ZernikeFitter fitter) {
        this.registrar = registrar;
        this.solver = solver;
        this.basis = basis;
        this.fitter = fitter;
    }

    public RefinementResult refine(double[][] intra, double[][] extra, RoddierConfig config) {
        ArrayOps.requireSameShape(intra, extra, "refinamiento intra/extra");
        int h = intra.length;
        int w = intra[0].length;
        double focalRatio = config.focalRatio();
        double pixelMm = config.pixelSizeMm();
        double maxRadius = 0.5 * Math.sqrt((double) h * h + (double) w * w);

        RefinerState state = RefinerState.INITIAL;
        double offsetX = 0, offsetY = 0;
        double measuredDefocusMm = Double.NaN;
        double defocusMm = Double.NaN;
        double[] previous = null;
        RefinementResult last = null;

        for (int iteration = 1; iteration <= config.maxIterations; iteration++) {
            state = transition(state, RefinerState.REGISTERING, iteration);
            double[][] intraIt = offsetX == 0 && offsetY == 0 ? intra : registrar.shift(intra, -offsetX, -offsetY);
            double[][] extraIt = offsetX == 0 && offsetY == 0 ? extra : registrar.shift(extra, offsetX, offsetY);
            RegistrationResult reg = registrar.register(intraIt, extraIt, config);
            PupilCenter center = reg.geometry.center;

            double rOut;
            AnnularMask mask;
            if (Double.isNaN(defocusMm)) {
                rOut = reg.geometry.rOut;
                mask = reg.mask;
                defocusMm = estimateDefocusMm(rOut, config.pixelSizeUm, config.focalLengthMm, config.apertureMm);
                measuredDefocusMm = defocusMm;
                LOGGER.info("Desenfoque inicial estimado: {} mm (R_out={} px)", format(defocusMm), format(rOut));
            } else {
                rOut = effectiveRadiusPx(defocusMm, config.pixelSizeUm, config.focalLengthMm, config.apertureMm);
                if (rOut < 1 || rOut > maxRadius) {
                    LOGGER.warn("Radio efectivo {} px fuera del cuadro, se detiene en la iteracion {}", format(rOut), iteration);
                    return finish(state, last, RefinementStatus.DIVERGED);
                }
                double rIn = config.obstructionMode == ObstructionMode.AUTO
                        ? Math.min(reg.geometry.rIn, rOut)
                        : rOut * config.obstructionRatio();
                mask = registrar.buildAnnularMask(center, rIn, rOut, h, w);
            }

            state = transition(state, RefinerState.SOLVING, iteration);
            WavefrontResult wf = solver.reconstructOpd(reg.intra, reg.extraAligned, mask, pixelMm, defocusMm);
            FitResult low = fitter.fit(wf.wavefront, mask, basis.generate(h, w, mask, rOut, center, LOW_ORDER_TERMS));
            last = new RefinementResult(wf.wavefront, mask, center, rOut, defocusMm, iteration,
                    RefinementStatus.EXHAUSTED, low);

            state = transition(state, RefinerState.CORRECTING, iteration);
            double[] current = {low.amplitude(2), low.amplitude(3), low.amplitude(4)};
            LOGGER.debug("Iteracion {}: tiltX={} tiltY={} defocus={} mm, dz={} mm, R_out={} px",
                    iteration, current[0], current[1], current[2], defocusMm, rOut);

            if (previous != null && maxChange(previous, current) < config.convergenceToleranceMm) {
                LOGGER.info("Refinamiento convergido en {} iteraciones (dz={} mm)", iteration, format(defocusMm));
                return finish(state, last, RefinementStatus.CONVERGED);
            }
            previous = current;

            double focalShift = 16.0 * focalRatio * focalRatio * current[2];
            double nextDefocus = measuredDefocusMm + focalShift;
            if (!(nextDefocus > 0)) {
                LOGGER.warn("Desenfoque no positivo ({} mm) tras la iteracion {}", format(nextDefocus), iteration);
                return finish(state, last, RefinementStatus.DIVERGED);
            }
            defocusMm = nextDefocus;

            // Tilt -> desplazamiento transversal de cada imagen en pixeles
            offsetX -= 2.0 * focalRatio * current[0] / pixelMm;
            offsetY -= 2.0 * focalRatio * current[1] / pixelMm;
        }

        LOGGER.info("Refinamiento agotado tras {} iteraciones sin converger", config.maxIterations);
        return finish(state, last, RefinementStatus.EXHAUSTED);
    }

    /** dz = R * pixel_mm / tan(atan((D/2) / F)). */
    public static double estimateDefocusMm(double radiusPx, double pixelSizeUm, double focalMm, double apertureMm) {
        double pixelMm = pixelSizeUm / 1000.0;
        double theta = Math.atan((apertureMm / 2) / focalMm);
        return (radiusPx * pixelMm) / Math.tan(theta);
    }

    /** Radio de la pupila desenfocada (px) para una distancia de desenfoque dada. */
    public static double effectiveRadiusPx(double defocusMm, double pixelSizeUm, double focalMm, double apertureMm) {
        double pixelMm = pixelSizeUm / 1000.0;
        return defocusMm * ((apertureMm / 2) / focalMm) / pixelMm;
    }

    private static RefinerState transition(RefinerState from, RefinerState to, int iteration) {
        LOGGER.trace("Iteracion {}: {} -> {}", iteration, from, to);
        return to;
    }

    private static RefinementResult finish(RefinerState from, RefinementResult result, RefinementStatus status) {
        transition(from, RefinerState.CONVERGED, result.iterations);
        return result.withStatus(status);
    }

    private static double maxChange(double[] a, double[] b) {
        double m = 0;
        for (int i = 0; i < a.length; i++) m = Math.max(m, Math.abs(a[i] - b[i]));
        return m;
    }

    private static String format(double v) {
        return String.format("%.4f", v);
    }
}
