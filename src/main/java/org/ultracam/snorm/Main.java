package org.ultracam.snorm;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.ultracam.snorm.fit.FitException;

/**
 * Command line entry point:
 * <pre>
 * snorm device nccd iname oname x1 x2 y1 y2 xf1 xf2 ncoeff [thresh]
 * </pre>
 * Values not given as arguments are prompted for on standard input.
 *
 * @author ultracam
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_VALIDATION = 1;
    public static final int EXIT_CONFIGURATION = 2;
    public static final int EXIT_FIT = 3;
    public static final int EXIT_IO = 4;

    private static final String[] PROMPTS = {
        "Plot device (null for none)",
        "CCD number",
        "Input flat field",
        "Output normalized flat field",
        "First X of the OK range",
        "Last X of the OK range",
        "First Y of the extraction rows",
        "Last Y of the extraction rows",
        "First X of the fit range",
        "Last X of the fit range",
        "Number of spline knots (>0) or -(polynomial degree + 1) (<0)",
        "Rejection threshold, in RMS"
    };

    private final BufferedReader in;
    private final PrintStream out;

    Main(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        configureLogging();
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(new Main(in, System.out).execute(args, System.err));
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException x) {
            LOG.log(Level.WARNING, "Could not load logging configuration", x);
        }
    }

    /**
     * Run the normalization and map its outcome to an exit code.
     *
     * @param args The command line arguments
     * @param err Where to report failures
     * @return The exit code
     */
    int execute(String[] args, PrintStream err) {
        try {
            NormalizationConfig config = parse(args);
            LOG.log(Level.FINE, "Running with {0}", config);
            new SpectralFlatNormalizer(config).run();
            return EXIT_OK;
        } catch (ValidationException x) {
            err.println("Invalid input: " + x.getMessage());
            return EXIT_VALIDATION;
        } catch (ConfigurationException x) {
            err.println("Configuration error: " + x.getMessage());
            return EXIT_CONFIGURATION;
        } catch (FitException x) {
            err.println("Fit failed: " + x.getMessage());
            return EXIT_FIT;
        } catch (FlatFieldException x) {
            err.println("Normalization failed: " + x.getMessage());
            return EXIT_FIT;
        } catch (IOException x) {
            err.println("I/O error: " + x.getMessage());
            LOG.log(Level.FINE, "I/O error", x);
            return EXIT_IO;
        }
    }

    /**
     * Build the configuration from positional arguments, prompting for any
     * that are missing.
     *
     * @param args The arguments
     * @return The validated configuration
     * @throws ValidationException If a value is missing, malformed or out of
     * range
     * @throws IOException If standard input cannot be read
     */
    NormalizationConfig parse(String[] args) throws ValidationException, IOException {
        if (args.length > PROMPTS.length) {
            throw new ValidationException("Too many arguments: expected at most " + PROMPTS.length + ", got " + args.length);
        }
        NormalizationConfig.Builder builder = NormalizationConfig.builder()
                .device(value(args, 0))
                .nccd(intValue(args, 1))
                .input(value(args, 2))
                .output(value(args, 3))
                .okRange(intValue(args, 4), intValue(args, 5))
                .extractionRange(intValue(args, 6), intValue(args, 7))
                .fitRange(intValue(args, 8), intValue(args, 9))
                .ncoeff(intValue(args, 10));
        if (args.length > 11) {
            builder.threshold(doubleValue(args, 11));
        } else if (args.length < 11) {
            String thresh = prompt(11, String.valueOf(NormalizationConfig.DEFAULT_THRESHOLD));
            builder.threshold(parseDouble(11, thresh));
        }
        return builder.build();
    }

    private String value(String[] args, int index) throws ValidationException, IOException {
        return index < args.length ? args[index] : prompt(index, null);
    }

    private int intValue(String[] args, int index) throws ValidationException, IOException {
        String text = value(args, index);
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException x) {
            throw new ValidationException(PROMPTS[index] + ": not an integer: " + text, x);
        }
    }

    private double doubleValue(String[] args, int index) throws ValidationException, IOException {
        return parseDouble(index, value(args, index));
    }

    private static double parseDouble(int index, String text) throws ValidationException {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException x) {
            throw new ValidationException(PROMPTS[index] + ": not a number: " + text, x);
        }
    }

    private String prompt(int index, String defaultValue) throws ValidationException, IOException {
        out.print(PROMPTS[index] + (defaultValue == null ? "" : " [" + defaultValue + "]") + ": ");
        out.flush();
        String line = in.readLine();
        if (line == null) {
            throw new ValidationException("No value given for: " + PROMPTS[index]);
        }
        if (line.trim().isEmpty() && defaultValue != null) {
            return defaultValue;
        }
        return line;
    }
}
