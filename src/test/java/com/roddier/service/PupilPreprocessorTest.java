package com.roddier.service;

import com.roddier.exceptions.PupilGeometryException;
import com.roddier.math.ArrayOps;
import com.roddier.model.PreparedPair;
import com.roddier.model.PupilCenter;
import com.roddier.model.RoddierConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PupilPreprocessorTest {

    private final PupilPreprocessor preprocessor = new PupilPreprocessor();

    @Test
    void testRotate180() {
        double[][] rotated = preprocessor.rotate180(new double[][] {{1, 2, 3}, {4, 5, 6}});
        assertArrayEquals(new double[] {6, 5, 4}, rotated[0], 0.0);
        assertArrayEquals(new double[] {3, 2, 1}, rotated[1], 0.0);
    }

    @Test
    void testCentroid_findsOffCenterDonut() {
        double[][] donut = PupilTestUtils.donut(80, 30, 45, 5, 15, 10.0);
        PupilCenter c = preprocessor.centroid(donut);
        assertEquals(30.0, c.cx, 1e-9);
        assertEquals(45.0, c.cy, 1e-9);

        PupilCenter flat = preprocessor.centroid(new double[10][20]);
        assertEquals(9.5, flat.cx, 0.0);
        assertEquals(4.5, flat.cy, 0.0);
    }

    @Test
    void testCropAround_centersAndPads() {
        double[][] img = new double[10][10];
        img[5][5] = 7;
        double[][] crop = preprocessor.cropAround(img, 5, 5, 4);
        assertEquals(4, crop.length);
        assertEquals(7.0, crop[2][2], 0.0);

        img[0][0] = 3;
        double[][] corner = preprocessor.cropAround(img, 0, 0, 4);
        assertEquals(0.0, corner[0][0], 0.0, "Relleno a cero fuera de la imagen");
        assertEquals(3.0, corner[2][2], 0.0);
        assertThrows(IllegalArgumentException.class, () -> preprocessor.cropAround(img, 5, 5, 0));
    }

    @Test
    void testSmooth_spreadsPointAndKeepsEnergy() {
        double[][] img = new double[21][21];
        img[10][10] = 1;
        double[][] blurred = preprocessor.smooth(img, 1.5);
        assertTrue(blurred[10][10] < 1.0);
        assertTrue(blurred[10][11] > 0.0);
        assertEquals(1.0, ArrayOps.sum(blurred), 1e-2);
    }

    @Test
    void testEqualizeEnergy() {
        double[][] intra = {{1, 1}, {1, 1}};
        double[][] extra = {{2, 2}, {2, 0}};
        double[][][] eq = preprocessor.equalizeEnergy(intra, extra);
        assertEquals(4.0, ArrayOps.sum(eq[0]), 1e-12);
        assertEquals(4.0, ArrayOps.sum(eq[1]), 1e-12);
        assertEquals(4.0 / 3.0, eq[1][0][0], 1e-12);

        assertThrows(PupilGeometryException.class,
                () -> preprocessor.equalizeEnergy(intra, new double[2][2]));
    }

    @Test
    void testPrepare_cropsBothFramesToSameSize() {
        double[][] intra = PupilTestUtils.donut(120, 50, 60, 8, 20, 50.0);
        double[][] extra = PupilTestUtils.donut(120, 70, 55, 8, 20, 25.0);
        RoddierConfig config = RoddierConfig.builder().cropSize(64).blurSigma(0.8).flipExtra(true).build();

        PreparedPair pair = preprocessor.prepare(intra, extra, config);

        assertEquals(64, pair.intra.length);
        assertEquals(64, pair.extra[0].length);
        assertEquals(ArrayOps.sum(pair.intra), ArrayOps.sum(pair.extra), 1e-6 * ArrayOps.sum(pair.intra));
        PupilCenter ci = preprocessor.centroid(pair.intra);
        assertEquals(32.0, ci.cx, 0.5);
        assertEquals(32.0, ci.cy, 0.5);
    }
}
