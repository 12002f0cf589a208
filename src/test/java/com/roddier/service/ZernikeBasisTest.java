package com.roddier.service;

import com.roddier.exceptions.PupilGeometryException;
import com.roddier.exceptions.ShapeMismatchException;
import com.roddier.model.AnnularMask;
import com.roddier.model.PupilCenter;
import com.roddier.model.ZernikeBasisSet;
import com.roddier.model.ZernikeTerm;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ZernikeBasisTest {

    private static final PupilCenter CENTER = new PupilCenter(31.5, 31.5);

    private final ZernikeBasis basis = new ZernikeBasis();

    @Test
    void testGenerate_countShapeAndMasking() {
        AnnularMask mask = AnnularMask.annulus(CENTER, 8, 30, 64, 64);
        ZernikeBasisSet set = basis.generate(64, 64, mask, 30, CENTER, 15);

        assertEquals(15, set.size());
        for (double[][] map : set.maps) {
            assertEquals(64, map.length);
            assertEquals(64, map[0].length);
            double norm2 = 0;
            for (int y = 0; y < 64; y++) {
                for (int x = 0; x < 64; x++) {
                    if (!mask.get(y, x)) {
                        assertEquals(0.0, map[y][x], 0.0, "Fuera de la mascara vale cero");
                    }
                    norm2 += map[y][x] * map[y][x];
                }
            }
            assertEquals(1.0, norm2, 1e-9, "Cada mapa tiene norma unidad sobre la mascara");
        }
    }

    @Test
    void testNollOrdering() {
        int[][] expected = {
                {0, 0}, {1, 1}, {1, -1}, {2, 0}, {2, -2}, {2, 2},
                {3, -1}, {3, 1}, {3, -3}, {3, 3}, {4, 0}
        };
        for (int j = 1; j <= expected.length; j++) {
            ZernikeTerm t = ZernikeTerm.fromNoll(j);
            assertEquals(expected[j - 1][0], t.n, "n de Noll " + j);
            assertEquals(expected[j - 1][1], t.m, "m de Noll " + j);
        }
        assertEquals("Defocus", ZernikeTerm.fromNoll(4).name());
        assertEquals("Spherical", ZernikeTerm.fromNoll(11).name());
        assertEquals("Sec. astigmatism 0", ZernikeTerm.fromNoll(12).name());
        assertEquals("Tetrafoil X", ZernikeTerm.fromNoll(14).name());
        assertEquals(4, ZernikeTerm.fromNoll(14).m);
        assertEquals("Sec. coma X", ZernikeTerm.fromNoll(16).name());
        assertEquals(1, ZernikeTerm.fromNoll(16).m);
        assertEquals("Sec. spherical", ZernikeTerm.fromNoll(22).name());
        assertEquals(0, ZernikeTerm.fromNoll(22).m);
        assertEquals("Z23", ZernikeTerm.fromNoll(23).name());
        assertThrows(IllegalArgumentException.class, () -> ZernikeTerm.fromNoll(0));
    }

    @Test
    void testGenerate_isDeterministic() {
        AnnularMask mask = AnnularMask.annulus(CENTER, 0, 25, 64, 64);
        ZernikeBasisSet a = basis.generate(64, 64, mask, 25, CENTER, 10);
        ZernikeBasisSet b = basis.generate(64, 64, mask, 25, CENTER, 10);
        for (int j = 0; j < 10; j++) {
            assertArrayEquals(a.maps.get(j)[20], b.maps.get(j)[20], 0.0);
            assertEquals(a.amplitudeScale(j), b.amplitudeScale(j), 0.0);
        }
    }

    @Test
    void testRadialPolynomials() {
        // R_2^0 = 2 rho^2 - 1, R_4^0 = 6 rho^4 - 6 rho^2 + 1, R_3^1 = 3 rho^3 - 2 rho
        double rho = 0.7;
        assertEquals(2 * rho * rho - 1, ZernikeBasis.radial(ZernikeBasis.radialCoefficients(2, 0), 2, rho), 1e-12);
        assertEquals(6 * Math.pow(rho, 4) - 6 * rho * rho + 1,
                ZernikeBasis.radial(ZernikeBasis.radialCoefficients(4, 0), 4, rho), 1e-12);
        assertEquals(3 * Math.pow(rho, 3) - 2 * rho,
                ZernikeBasis.radial(ZernikeBasis.radialCoefficients(3, 1), 3, rho), 1e-12);
    }

    @Test
    void testTermsForRadialOrder() {
        assertEquals(1, ZernikeBasis.termsForRadialOrder(0));
        assertEquals(6, ZernikeBasis.termsForRadialOrder(2));
        assertEquals(15, ZernikeBasis.termsForRadialOrder(4));
        assertEquals(28, ZernikeBasis.termsForRadialOrder(6));
    }

    @Test
    void testGenerate_invalidInputsThrow() {
        AnnularMask mask = AnnularMask.annulus(CENTER, 0, 20, 64, 64);
        assertThrows(PupilGeometryException.class,
                () -> basis.generate(64, 64, new AnnularMask(new boolean[64][64]), 20, CENTER, 4));
        assertThrows(ShapeMismatchException.class, () -> basis.generate(32, 64, mask, 20, CENTER, 4));
        assertThrows(PupilGeometryException.class, () -> basis.generate(64, 64, mask, 0, CENTER, 4));
        assertThrows(IllegalArgumentException.class, () -> basis.generate(64, 64, mask, 20, CENTER, 0));
    }
}
