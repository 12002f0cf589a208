package com.roddier.service;

import com.roddier.math.ArrayOps;
import com.roddier.model.FitResult;
import com.roddier.model.PreparedPair;
import com.roddier.model.PsfNormalization;
import com.roddier.model.PsfResult;
import com.roddier.model.RefinementResult;
import com.roddier.model.RoddierConfig;
import com.roddier.model.RoddierReport;
import com.roddier.model.ZernikeBasisSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Test de Roddier completo: preparacion, refinamiento, ajuste de Zernike y sintesis. */
public class RoddierPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(RoddierPipeline.class);

    private final PupilPreprocessor preprocessor;
    private final IterativeRefiner refiner;
    private final ZernikeBasis basis;
    private final ZernikeFitter fitter;
    private final SynthesisModels synthesis;

    public RoddierPipeline() {
        this(new PupilPreprocessor(), new IterativeRefiner(), new ZernikeBasis(), new ZernikeFitter(), new SynthesisModels());
    }

    public RoddierPipeline(PupilPreprocessor preprocessor, IterativeRefiner refiner, ZernikeBasis basis,
                           ZernikeFitter fitter, SynthesisModels synthesis) {
        this.preprocessor = preprocessor;
        this.refiner = refiner;
        this.basis = basis;
        this.fitter = fitter;
        this.synthesis = synthesis;
    }

    public RoddierReport run(double[][] intra, double[][] extra, RoddierConfig config) {
        LOGGER.info("Test de Roddier: {}", config);
        PreparedPair pair = preprocessor.prepare(intra, extra, config);
        return analyze(pair.intra, pair.extra, config);
    }

    /** Igual que {@link #run} pero con la pareja ya preparada. */
    public RoddierReport analyze(double[][] intra, double[][] extra, RoddierConfig config) {
        RefinementResult refinement = refiner.refine(intra, extra, config);
        LOGGER.info("Refinamiento {} en {} iteraciones: dz={} mm R_out={} px centro={}",
                refinement.status, refinement.iterations, String.format("%.4f", refinement.defocusMm),
                String.format("%.2f", refinement.rOut), refinement.center);

        double[][] wavefront = refinement.wavefront;
        ZernikeBasisSet full = basis.generate(wavefront.length, wavefront[0].length, refinement.mask,
                refinement.rOut, refinement.center, config.zernikeTerms);
        FitResult fit = fitter.fit(wavefront, refinement.mask, full);
        LOGGER.info("Ajuste de {} terminos, residuo RMS={} mm", config.zernikeTerms, fit.residualRms);

        double[][] waves = wavefrontInWaves(wavefront, config.wavelengthNm);
        if (!ArrayOps.allFinite(waves)) {
            LOGGER.warn("El frente de onda contiene valores no finitos");
        }
        LOGGER.info("Frente de onda RMS={} ondas", String.format("%.4f", ArrayOps.rms(waves, refinement.mask)));

        // Interferograma y PSF salen de los modos seleccionados, no del mapa del solver
        List<Integer> modes = config.synthesisModes();
        double[][] modal = wavefrontInWaves(fitter.reconstruct(fit.coefficients, full, modes), config.wavelengthNm);
        modal = ArrayOps.applyMask(modal, refinement.mask);
        LOGGER.debug("Sintesis con los terminos {} (excluidos {})", modes, config.excludedModes);
        double[][] interferogram = synthesis.calculateInterferogram(modal, config.referenceFrequency,
                config.referenceIntensity, refinement.mask, true);
        PsfResult psf = synthesis.calculatePsf(modal, refinement.mask, 1.0, PsfNormalization.SUM);

        return new RoddierReport(refinement, fit, waves, modal, interferogram, psf, config.wavelengthNm);
    }

    /** Frente de onda en mm a ondas. */
    public static double[][] wavefrontInWaves(double[][] wavefrontMm, double wavelengthNm) {
        return ArrayOps.scale(wavefrontMm, 1e6 / wavelengthNm);
    }
}
