package com.roddier.service;

import com.roddier.math.ArrayOps;
import com.roddier.model.AnnularMask;
import com.roddier.model.RefinementResult;
import com.roddier.model.RefinementStatus;
import com.roddier.model.RoddierConfig;
import com.roddier.model.WavefrontResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IterativeRefinerTest {

    private final IterativeRefiner refiner = new IterativeRefiner();

    @Test
    void testRefine_identicalPairConverges() {
        double[][] donut = PupilTestUtils.donut(64, 32, 32, 6, 25, 100.0);
        RoddierConfig config = PupilTestUtils.rawConfig(15);

        RefinementResult result = refiner.refine(donut, donut, config);

        assertEquals(RefinementStatus.CONVERGED, result.status);
        assertTrue(result.isConverged());
        assertEquals(2, result.iterations);
        double expectedDz = IterativeRefiner.estimateDefocusMm(25, config.pixelSizeUm,
                config.focalLengthMm, config.apertureMm);
        assertEquals(expectedDz, result.defocusMm, 1e-12);
        assertEquals(25.0, result.rOut, 1e-9);
        for (double c : result.lowOrderFit.coefficients) assertEquals(0.0, c, 1e-15);
    }

    @Test
    void testRefine_singleIterationIsExhausted() {
        double[][] donut = PupilTestUtils.donut(64, 32, 32, 6, 25, 100.0);
        RoddierConfig config = PupilTestUtils.rawConfig(15).toBuilder().maxIterations(1).build();

        RefinementResult result = refiner.refine(donut, donut, config);

        assertEquals(RefinementStatus.EXHAUSTED, result.status);
        assertEquals(1, result.iterations);
        assertEquals(64, result.wavefront.length);
    }

    @Test
    void testRefine_subPixelShiftIsCorrected() {
        double[][] intra = PupilTestUtils.softDisk(96, 48, 48, 30, 1.0, 100.0);
        double[][] extra = new ImageRegistrar().shift(intra, 0.4, 0);
        RoddierConfig config = PupilTestUtils.rawConfig(15);

        RefinementResult first = refiner.refine(intra, extra, config.toBuilder().maxIterations(1).build());
        RefinementResult result = refiner.refine(intra, extra, config);

        // Extra desplazada hacia +x: tilt X positivo del orden de s * pixel / (4 N)
        double tiltFirst = first.lowOrderFit.amplitude(2);
        double expected = 0.4 * config.pixelSizeMm() / (4 * config.focalRatio());
        assertTrue(tiltFirst > 0.3 * expected && tiltFirst < 1.5 * expected,
                "tilt inicial " + tiltFirst + " frente a " + expected);
        assertEquals(0.0, first.lowOrderFit.amplitude(3), 0.1 * expected);

        assertNotEquals(RefinementStatus.DIVERGED, result.status);
        assertTrue(result.iterations > 1);
        assertTrue(Math.abs(result.lowOrderFit.amplitude(2)) < 0.5 * Math.abs(tiltFirst),
                "tilt final " + result.lowOrderFit.amplitude(2));
        assertEquals(first.rOut, result.rOut, 1.0);
        assertEquals(first.defocusMm, result.defocusMm, 0.03 * first.defocusMm);
    }

    @Test
    void testRefine_weakRadialSignalKeepsMeasuredPupil() {
        double[][][] pair = PupilTestUtils.radialContrastPair(96, 30, 0.02);
        RoddierConfig config = PupilTestUtils.rawConfig(15);

        RefinementResult first = refiner.refine(pair[0], pair[1], config.toBuilder().maxIterations(1).build());
        RefinementResult result = refiner.refine(pair[0], pair[1], config);

        assertEquals(30.0, first.rOut, 0.5);
        assertNotEquals(0.0, first.lowOrderFit.amplitude(4));
        assertNotEquals(RefinementStatus.DIVERGED, result.status);
        assertEquals(first.rOut, result.rOut, 1.0);
        assertEquals(first.defocusMm, result.defocusMm, 0.03 * first.defocusMm);
        assertTrue(ArrayOps.allFinite(result.wavefront));
    }

    @Test
    void testRefine_runawayDefocusDiverges() {
        // Solver que exagera el frente de onda: el desenfoque corregido se sale del cuadro
        WavefrontSolver amplified = new WavefrontSolver() {
            @Override
            public WavefrontResult reconstructOpd(double[][] intra, double[][] extra, AnnularMask mask,
                                                  double pixelSizeMm, double defocusMm) {
                WavefrontResult r = super.reconstructOpd(intra, extra, mask, pixelSizeMm, defocusMm);
                return new WavefrontResult(r.normalizedDifference, ArrayOps.scale(r.wavefront, 1e4), r.scaleFactor * 1e4);
            }
        };
        IterativeRefiner runaway = new IterativeRefiner(new ImageRegistrar(), amplified, new ZernikeBasis(), new ZernikeFitter());
        double[][][] pair = PupilTestUtils.radialContrastPair(96, 30, 0.02);
        RoddierConfig config = PupilTestUtils.rawConfig(15);

        RefinementResult result = runaway.refine(pair[0], pair[1], config);

        assertEquals(RefinementStatus.DIVERGED, result.status);
        assertFalse(result.isConverged());
        assertEquals(1, result.iterations);
        double measured = IterativeRefiner.estimateDefocusMm(result.rOut, config.pixelSizeUm,
                config.focalLengthMm, config.apertureMm);
        assertEquals(measured, result.defocusMm, 1e-12);
    }

    @Test
    void testDefocusEstimate_inverseOfEffectiveRadius() {
        double dz = IterativeRefiner.estimateDefocusMm(40, 3.76, 1000, 200);
        // 40 px * 0.00376 mm / 0.1
        assertEquals(1.504, dz, 1e-9);
        assertEquals(40.0, IterativeRefiner.effectiveRadiusPx(dz, 3.76, 1000, 200), 1e-9);
    }
}
