package com.roddier.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class RoddierConfigTest {

    @Test
    void testDefaults() {
        RoddierConfig c = RoddierConfig.defaults();
        assertEquals(555.0, c.wavelengthNm, 0.0);
        assertEquals(0.5, c.thresholdFraction, 0.0);
        assertEquals(28, c.zernikeTerms);
        assertEquals(ObstructionMode.PHYSICAL_RATIO, c.obstructionMode);
        assertEquals(5.0, c.focalRatio(), 1e-12);
        assertEquals(0.00376, c.pixelSizeMm(), 1e-15);
        assertEquals(555e-6, c.wavelengthMm(), 1e-18);
    }

    @Test
    void testToBuilder_copiesAndOverrides() {
        RoddierConfig base = RoddierConfig.builder().aperture(150).secondary(45).build();
        RoddierConfig copy = base.toBuilder().wavelength(656).build();

        assertEquals(150.0, copy.apertureMm, 0.0);
        assertEquals(0.3, copy.obstructionRatio(), 1e-12);
        assertEquals(656.0, copy.wavelengthNm, 0.0);
        assertEquals(555.0, base.wavelengthNm, 0.0);
    }

    @Test
    void testInvalidValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> RoddierConfig.builder().aperture(0).build());
        assertThrows(IllegalArgumentException.class, () -> RoddierConfig.builder().focalLength(-1).build());
        assertThrows(IllegalArgumentException.class, () -> RoddierConfig.builder().secondary(200).build());
        assertThrows(IllegalArgumentException.class, () -> RoddierConfig.builder().pixelSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> RoddierConfig.builder().wavelength(Double.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> RoddierConfig.builder().threshold(1.0).build());
        assertThrows(IllegalArgumentException.class, () -> RoddierConfig.builder().zernikeTerms(3).build());
        assertThrows(IllegalArgumentException.class, () -> RoddierConfig.builder().maxIterations(0).build());
        assertThrows(IllegalArgumentException.class, () -> RoddierConfig.builder().obstructionMode(null).build());
        assertThrows(IllegalArgumentException.class, () -> RoddierConfig.builder().cropSize(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> RoddierConfig.builder().excludedModes(Arrays.asList(1, 0)).build());
    }

    @Test
    void testSynthesisModes_skipPistonByDefault() {
        RoddierConfig c = RoddierConfig.builder().zernikeTerms(6).build();
        assertEquals(Arrays.asList(2, 3, 4, 5, 6), c.synthesisModes());

        RoddierConfig all = c.toBuilder().excludedModes(Collections.emptySet()).build();
        assertEquals(Arrays.asList(1, 2, 3, 4, 5, 6), all.synthesisModes());

        RoddierConfig noTilt = c.toBuilder().excludedModes(Arrays.asList(1, 2, 3, 40)).build();
        assertEquals(Arrays.asList(4, 5, 6), noTilt.synthesisModes());
        assertThrows(UnsupportedOperationException.class, () -> noTilt.excludedModes.add(7));
    }
}
