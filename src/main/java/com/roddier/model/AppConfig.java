package com.roddier.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.TreeSet;
import java.util.prefs.Preferences;

public class AppConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(AppConfig.class);
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // Telescopio
    private static final String KEY_APERTURE = "aperture_mm";
    private static final String KEY_FOCAL = "focal_length";
    private static final String KEY_SECONDARY = "secondary_mm";
    private static final String KEY_PIXEL = "pixel_size";
    private static final String KEY_WAVELENGTH = "wavelength_nm";

    // Test de Roddier
    private static final String KEY_THRESHOLD = "threshold";
    private static final String KEY_TERMS = "zernike_terms";
    private static final String KEY_ITERATIONS = "max_iterations";
    private static final String KEY_TOLERANCE = "convergence_tolerance_mm";
    private static final String KEY_OBSTRUCTION = "obstruction_mode";

    // Preprocesado
    private static final String KEY_CROP = "crop_size";
    private static final String KEY_BLUR = "blur_sigma";
    private static final String KEY_FLIP = "flip_extra";

    // Interferograma
    private static final String KEY_REF_FREQ = "reference_frequency";
    private static final String KEY_REF_INT = "reference_intensity";
    private static final String KEY_EXCLUDED = "excluded_modes";

    public static RoddierConfig load() {
        return load(prefs);
    }

    public static void save(RoddierConfig config) {
        save(prefs, config);
    }

    /** Lee la configuracion de un nodo concreto; las claves ausentes toman el valor por defecto. */
    public static RoddierConfig load(Preferences node) {
        RoddierConfig d = RoddierConfig.defaults();
        ObstructionMode mode;
        String storedMode = node.get(KEY_OBSTRUCTION, d.obstructionMode.name());
        try {
            mode = ObstructionMode.valueOf(storedMode);
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Modo de obstruccion '{}' desconocido en {}, se usa {}",
                    storedMode, node.absolutePath(), d.obstructionMode);
            mode = d.obstructionMode;
        }
        return d.toBuilder()
                .aperture(node.getDouble(KEY_APERTURE, d.apertureMm))
                .focalLength(node.getDouble(KEY_FOCAL, d.focalLengthMm))
                .secondary(node.getDouble(KEY_SECONDARY, d.secondaryMm))
                .pixelSize(node.getDouble(KEY_PIXEL, d.pixelSizeUm))
                .wavelength(node.getDouble(KEY_WAVELENGTH, d.wavelengthNm))
                .threshold(node.getDouble(KEY_THRESHOLD, d.thresholdFraction))
                .zernikeTerms(node.getInt(KEY_TERMS, d.zernikeTerms))
                .maxIterations(node.getInt(KEY_ITERATIONS, d.maxIterations))
                .convergenceTolerance(node.getDouble(KEY_TOLERANCE, d.convergenceToleranceMm))
                .obstructionMode(mode)
                .cropSize(node.getInt(KEY_CROP, d.cropSize))
                .blurSigma(node.getDouble(KEY_BLUR, d.blurSigma))
                .flipExtra(node.getBoolean(KEY_FLIP, d.flipExtra))
                .referenceFrequency(node.getDouble(KEY_REF_FREQ, d.referenceFrequency))
                .referenceIntensity(node.getDouble(KEY_REF_INT, d.referenceIntensity))
                .excludedModes(parseModes(node.get(KEY_EXCLUDED, null), d.excludedModes))
                .build();
    }

    public static void save(Preferences node, RoddierConfig c) {
        node.putDouble(KEY_APERTURE, c.apertureMm);
        node.putDouble(KEY_FOCAL, c.focalLengthMm);
        node.putDouble(KEY_SECONDARY, c.secondaryMm);
        node.putDouble(KEY_PIXEL, c.pixelSizeUm);
        node.putDouble(KEY_WAVELENGTH, c.wavelengthNm);
        node.putDouble(KEY_THRESHOLD, c.thresholdFraction);
        node.putInt(KEY_TERMS, c.zernikeTerms);
        node.putInt(KEY_ITERATIONS, c.maxIterations);
        node.putDouble(KEY_TOLERANCE, c.convergenceToleranceMm);
        node.put(KEY_OBSTRUCTION, c.obstructionMode.name());
        node.putInt(KEY_CROP, c.cropSize);
        node.putDouble(KEY_BLUR, c.blurSigma);
        node.putBoolean(KEY_FLIP, c.flipExtra);
        node.putDouble(KEY_REF_FREQ, c.referenceFrequency);
        node.putDouble(KEY_REF_INT, c.referenceIntensity);
        node.put(KEY_EXCLUDED, formatModes(c.excludedModes));
    }

    /** "1,4,11" -> {1, 4, 11}; cadena vacia -> ningun termino excluido. */
    public static Set<Integer> parseModes(String text, Set<Integer> fallback) {
        if (text == null) return fallback;
        Set<Integer> modes = new TreeSet<>();
        for (String part : text.split(",")) {
            String token = part.trim();
            if (token.isEmpty()) continue;
            try {
                modes.add(Integer.parseInt(token));
            } catch (NumberFormatException e) {
                LOGGER.warn("Termino excluido '{}' no es un indice de Noll, se usan {}", token, fallback);
                return fallback;
            }
        }
        return modes;
    }

    static String formatModes(Set<Integer> modes) {
        StringBuilder sb = new StringBuilder();
        for (Integer j : modes) {
            if (sb.length() > 0) sb.append(',');
            sb.append(j);
        }
        return sb.toString();
    }
}
