package com.roddier.main;

import com.roddier.model.AppConfig;
import com.roddier.model.ObstructionMode;
import com.roddier.model.RoddierConfig;
import com.roddier.model.RoddierReport;
import com.roddier.service.FitsImageService;
import com.roddier.service.ResultExportService;
import com.roddier.service.RoddierPipeline;
import com.roddier.service.ZernikeBasis;
import nom.tam.fits.FitsException;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Test de Roddier desde la linea de comandos: lee la pareja intra/extra en FITS,
 * ejecuta el analisis y escribe los mapas y coeficientes en el directorio de salida.
 */
public class RoddierTestCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(RoddierTestCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    @Option(name = "-intra", usage = "Imagen FITS intra-focal", metaVar = "FILE")
    private File intra;

    @Option(name = "-extra", usage = "Imagen FITS extra-focal", metaVar = "FILE")
    private File extra;

    @Option(name = "-out", usage = "Directorio de salida", metaVar = "DIR")
    private File out = new File("roddier-out");

    // Telescopio; sin valor se usa la configuracion guardada
    @Option(name = "-aperture", usage = "Apertura en mm")
    private Double aperture;

    @Option(name = "-focal", usage = "Focal en mm")
    private Double focal;

    @Option(name = "-secondary", usage = "Diametro del secundario en mm")
    private Double secondary;

    @Option(name = "-pixel", usage = "Tamano de pixel en um")
    private Double pixel;

    @Option(name = "-lambda", usage = "Longitud de onda en nm")
    private Double wavelength;

    // Test
    @Option(name = "-terms", usage = "Numero de terminos de Zernike", forbids = "-order")
    private Integer terms;

    @Option(name = "-order", usage = "Orden radial maximo de Zernike (alternativa a -terms)", forbids = "-terms")
    private Integer order;

    @Option(name = "-iterations", usage = "Maximo de iteraciones de refinamiento")
    private Integer iterations;

    @Option(name = "-threshold", usage = "Umbral de la pupila, fraccion del maximo")
    private Double threshold;

    @Option(name = "-obstruction", usage = "AUTO o PHYSICAL_RATIO")
    private ObstructionMode obstruction;

    @Option(name = "-crop", usage = "Lado del recorte en px (0 sin recorte)")
    private Integer crop;

    @Option(name = "-blur", usage = "Sigma del suavizado gaussiano en px")
    private Double blur;

    @Option(name = "-exclude", usage = "Terminos de Noll fuera del interferograma y la PSF, p.ej. 1,4 (vacio: ninguno)",
            metaVar = "J,J")
    private String exclude;

    @Option(name = "-noflip", usage = "No girar 180 grados la imagen extra-focal")
    private boolean noFlip;

    @Option(name = "-save", usage = "Guardar los parametros del telescopio como predeterminados")
    private boolean save;

    @Option(name = "-help", aliases = {"--help", "-h", "-?"}, usage = "Muestra la ayuda.")
    private boolean help;

    private final RoddierPipeline pipeline;
    private final FitsImageService fitsService;
    private final ResultExportService exportService;

    public RoddierTestCommand() {
        this(new RoddierPipeline(), new FitsImageService(), new ResultExportService());
    }

    RoddierTestCommand(RoddierPipeline pipeline, FitsImageService fitsService, ResultExportService exportService) {
        this.pipeline = pipeline;
        this.fitsService = fitsService;
        this.exportService = exportService;
    }

    public static void main(String[] args) {
        Locale.setDefault(Locale.US);
        System.exit(new RoddierTestCommand().run(args));
    }

    public int run(String[] args) {
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.format("Error: %s%n", e.getMessage());
            return usage(parser, EXIT_USAGE);
        }
        if (help) {
            return usage(parser, EXIT_OK);
        }
        if (intra == null || extra == null) {
            System.err.println("Error: se necesitan -intra y -extra");
            return usage(parser, EXIT_USAGE);
        }

        RoddierConfig config;
        try {
            config = applyOverrides(AppConfig.load());
        } catch (IllegalArgumentException e) {
            System.err.format("Error: %s%n", e.getMessage());
            return EXIT_USAGE;
        }
        if (save) {
            AppConfig.save(config);
            LOGGER.info("Configuracion guardada");
        }

        try {
            double[][] intraImage = fitsService.load(intra);
            double[][] extraImage = fitsService.load(extra);
            RoddierReport report = pipeline.run(intraImage, extraImage, config);
            if (!report.refinement.isConverged()) {
                LOGGER.warn("El refinamiento no ha convergido ({}), revise el desenfoque de las imagenes",
                        report.refinement.status);
            }
            LOGGER.info("Coeficientes de Zernike:\n{}", exportService.formatTable(report.fit, config.wavelengthNm));
            exportService.export(out, report);
            return EXIT_OK;
        } catch (IOException | FitsException e) {
            LOGGER.error("Error de E/S: {}", e.getMessage(), e);
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            LOGGER.error("El test de Roddier ha fallado: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    RoddierConfig applyOverrides(RoddierConfig base) {
        RoddierConfig.Builder b = base.toBuilder();
        if (aperture != null) b.aperture(aperture);
        if (focal != null) b.focalLength(focal);
        if (secondary != null) b.secondary(secondary);
        if (pixel != null) b.pixelSize(pixel);
        if (wavelength != null) b.wavelength(wavelength);
        if (terms != null) b.zernikeTerms(terms);
        if (order != null) b.zernikeTerms(ZernikeBasis.termsForRadialOrder(order));
        if (iterations != null) b.maxIterations(iterations);
        if (threshold != null) b.threshold(threshold);
        if (obstruction != null) b.obstructionMode(obstruction);
        if (crop != null) b.cropSize(crop);
        if (blur != null) b.blurSigma(blur);
        if (noFlip) b.flipExtra(false);
        if (exclude != null) b.excludedModes(AppConfig.parseModes(exclude, base.excludedModes));
        return b.build();
    }

    private static int usage(CmdLineParser parser, int code) {
        PrintStream stream = (code == EXIT_OK ? System.out : System.err);
        stream.println("Uso: roddier -intra INTRA.fits -extra EXTRA.fits [-out DIR] [OPCIONES]");
        if (code == EXIT_OK) {
            stream.println("Opciones:");
            parser.printUsage(stream);
        } else {
            stream.println("Use -help para ver todas las opciones.");
        }
        return code;
    }
}
