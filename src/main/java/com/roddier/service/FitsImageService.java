package com.roddier.service;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

public class FitsImageService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FitsImageService.class);

    /** Imagen del HDU primario en valores fisicos (BZERO + BSCALE * dato). */
    public double[][] load(File file) throws IOException, FitsException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new IOException("FITS sin HDU primario: " + file);
            }
            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0.0);
            double bscale = header.getDoubleValue("BSCALE", 1.0);

            Object kernel = hdu.getKernel();
            // Cubos: se usa el primer plano
            if (kernel instanceof Object[] && ((Object[]) kernel).length > 0 && ((Object[]) kernel)[0] instanceof Object[]) {
                LOGGER.warn("{} es un cubo, se usa el primer plano", file.getName());
                kernel = ((Object[]) kernel)[0];
            }
            double[][] data = toDouble(kernel, bzero, bscale);
            if (data == null) {
                throw new IOException("Tipo de imagen FITS no soportado en " + file + ": "
                        + (kernel == null ? "sin datos" : kernel.getClass().getSimpleName()));
            }
            LOGGER.debug("Cargado {} ({} x {})", file.getName(), data[0].length, data.length);
            return data;
        }
    }

    public void write(File file, double[][] data) throws IOException, FitsException {
        try (Fits fits = new Fits()) {
            fits.addHDU(Fits.makeHDU(data));
            fits.write(file);
        }
        LOGGER.debug("Escrito {}", file.getName());
    }

    private static double[][] toDouble(Object k, double bzero, double bscale) {
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = bzero + bscale * s[i][j];
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = bzero + bscale * s[i][j];
            return d;
        }
        if (k instanceof byte[][]) {
            // BITPIX 8 es sin signo
            byte[][] s = (byte[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = bzero + bscale * (s[i][j] & 0xFF);
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = bzero + bscale * f[i][j];
            return d;
        }
        if (k instanceof double[][]) {
            double[][] f = (double[][]) k;
            double[][] d = new double[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = bzero + bscale * f[i][j];
            return d;
        }
        return null;
    }
}
