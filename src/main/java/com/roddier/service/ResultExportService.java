package com.roddier.service;

import com.roddier.model.FitResult;
import com.roddier.model.RoddierReport;
import com.roddier.model.ZernikeTerm;
import nom.tam.fits.FitsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;

public class ResultExportService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultExportService.class);

    public static final String CSV_HEADER = "noll,n,m,name,coefficient,amplitude_mm,amplitude_waves";

    private final FitsImageService fitsService;

    public ResultExportService() {
        this(new FitsImageService());
    }

    public ResultExportService(FitsImageService fitsService) {
        this.fitsService = fitsService;
    }

    public void writeCoefficients(File csv, FitResult fit, double wavelengthNm) throws IOException {
        double wavelengthMm = wavelengthNm / 1e6;
        try (BufferedWriter out = Files.newBufferedWriter(csv.toPath(), StandardCharsets.UTF_8)) {
            out.write(CSV_HEADER);
            out.newLine();
            for (ZernikeTerm t : fit.basis.terms) {
                double amplitude = fit.amplitude(t.noll);
                out.write(String.format(Locale.ROOT, "%d,%d,%d,%s,%.9e,%.9e,%.6f",
                        t.noll, t.n, t.m, t.name(), fit.coefficient(t.noll), amplitude, amplitude / wavelengthMm));
                out.newLine();
            }
        }
    }

    /** Escribe mapas FITS y la tabla de coeficientes en {@code dir}. */
    public void export(File dir, RoddierReport report) throws IOException, FitsException {
        if (!dir.isDirectory() && !dir.mkdirs()) {
            throw new IOException("No se pudo crear el directorio de salida: " + dir);
        }
        fitsService.write(new File(dir, "wavefront.fits"), report.wavefrontWaves);
        fitsService.write(new File(dir, "wavefront_modal.fits"), report.modalWaves);
        fitsService.write(new File(dir, "interferogram.fits"), report.interferogram);
        fitsService.write(new File(dir, "psf.fits"), report.psf.psf);
        fitsService.write(new File(dir, "psf_log.fits"), report.psf.psfLog);
        writeCoefficients(new File(dir, "zernike.csv"), report.fit, report.wavelengthNm);
        LOGGER.info("Resultados exportados en {}", dir.getAbsolutePath());
    }

    /** Tabla legible de coeficientes para el log. */
    public String formatTable(FitResult fit, double wavelengthNm) {
        double wavelengthMm = wavelengthNm / 1e6;
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-5s %-20s %12s%n", "Noll", "Termino", "Ondas"));
        for (ZernikeTerm t : fit.basis.terms) {
            sb.append(String.format(Locale.ROOT, "%-5d %-20s %12.4f%n", t.noll, t.name(), fit.amplitude(t.noll) / wavelengthMm));
        }
        return sb.toString();
    }
}
