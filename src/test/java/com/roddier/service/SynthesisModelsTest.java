package com.roddier.service;

import com.roddier.math.ArrayOps;
import com.roddier.model.AnnularMask;
import com.roddier.model.PsfNormalization;
import com.roddier.model.PsfResult;
import com.roddier.model.PupilCenter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SynthesisModelsTest {

    private static final int SIZE = 64;
    private static final PupilCenter CENTER = new PupilCenter(31.5, 31.5);

    private final SynthesisModels models = new SynthesisModels();
    private final AnnularMask pupil = AnnularMask.annulus(CENTER, 5, 20, SIZE, SIZE);

    @Test
    void testPsf_flatWavefrontPeaksAtCenter() {
        PsfResult result = models.calculatePsf(new double[SIZE][SIZE], pupil, 1.0, PsfNormalization.SUM);

        assertEquals(1.0, ArrayOps.sum(result.psf), 1e-9, "Normalizada a suma unidad");
        assertEquals(ArrayOps.max(result.psf), result.psf[SIZE / 2][SIZE / 2], 1e-15, "Pico en el centro");
        assertTrue(ArrayOps.min(result.psf) >= 0);
    }

    @Test
    void testPsf_aberratedIsFiniteAndLogBounded() {
        double[][] w = PupilTestUtils.defocus(SIZE, CENTER.cx, CENTER.cy, 20);
        PsfResult result = models.calculatePsf(w, pupil, 0.5, PsfNormalization.PEAK);

        assertTrue(ArrayOps.allFinite(result.psf));
        assertTrue(ArrayOps.allFinite(result.psfLog), "El log no puede contener -infinito");
        assertEquals(1.0, ArrayOps.max(result.psf), 1e-12);
        assertTrue(ArrayOps.min(result.psf) >= 0);
        assertTrue(ArrayOps.min(result.psfLog) >= Math.log10(SynthesisModels.LOG_EPSILON) - 1e-12);
    }

    @Test
    void testPsf_emptyPupilStaysFinite() {
        PsfResult result = models.calculatePsf(new double[8][8], new AnnularMask(new boolean[8][8]),
                1.0, PsfNormalization.SUM);
        assertEquals(0.0, ArrayOps.max(result.psf), 0.0);
        assertEquals(-8.0, result.psfLog[0][0], 1e-12);
    }

    @Test
    void testInterferogram_shapeRangeAndMask() {
        double[][] w = PupilTestUtils.defocus(SIZE, CENTER.cx, CENTER.cy, 20);
        double[][] fringes = models.calculateInterferogram(w, 3.0, 0.5, pupil, true);

        assertEquals(SIZE, fringes.length);
        assertEquals(SIZE, fringes[0].length);
        assertTrue(ArrayOps.allFinite(fringes));
        assertTrue(ArrayOps.min(fringes) >= 0);
        assertEquals(1.0, ArrayOps.max(fringes), 1e-12);
        assertEquals(0.0, fringes[0][0], 0.0, "Fuera de la pupila vale cero");
    }

    @Test
    void testInterferogram_unnormalizedBounds() {
        double[][] fringes = models.calculateInterferogram(new double[SIZE][SIZE], 0.0, 1.0, pupil, false);
        // |1 + 1|^2 con fase nula en toda la pupila
        assertEquals(4.0, fringes[31][45], 1e-12);
        assertThrows(IllegalArgumentException.class,
                () -> models.calculateInterferogram(new double[SIZE][SIZE], 1.0, -0.1, pupil, false));
    }
}
