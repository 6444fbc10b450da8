package org.ultracam.snorm;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.ultracam.snorm.fit.RobustFit;
import org.ultracam.snorm.fit.RobustFitter;
import org.ultracam.snorm.io.FrameIO;

/**
 * Normalizes a spectroscopic flat field so that its mean column profile is
 * unity: extracts the profile, fits it robustly in log space, extends the fit
 * linearly beyond the fit domain and divides the frame by the exponential of
 * the result.
 *
 * @author ultracam
 */
public class SpectralFlatNormalizer {

    private static final Logger LOG = Logger.getLogger(SpectralFlatNormalizer.class.getName());

    private final NormalizationConfig config;
    private final ProfileExtractor extractor;
    private final RobustFitter fitter;
    private final Extrapolator extrapolator;

    public SpectralFlatNormalizer(NormalizationConfig config) {
        this.config = config;
        this.extractor = new ProfileExtractor(config);
        this.fitter = config.createFitter();
        this.extrapolator = new Extrapolator(config.getFitDomain());
    }

    public NormalizationConfig getConfig() {
        return config;
    }

    /**
     * Normalize the configured CCD of a frame held in memory.
     *
     * @param frame The flat field
     * @return The profile, fit, curve and normalized frame
     * @throws ValidationException If the frame has fewer CCDs than the one
     * selected
     * @throws ConfigurationException If the frame geometry does not suit the
     * extraction ranges
     * @throws FlatFieldException If the fit or normalization fails
     */
    public NormalizationResult process(Frame frame) throws FlatFieldException {
        int nccd = config.getNccd();
        if (nccd > frame.getNumberOfCcds()) {
            throw new ValidationException(String.format("nccd = %d but the frame has only %d CCDs", nccd, frame.getNumberOfCcds()));
        }
        int ccd = nccd - 1;
        FitDomain domain = config.getFitDomain();

        Profile profile = Timed.execute(() -> extractor.extract(frame.getWindows(ccd)), "Profile extraction took %dms");
        RobustFit fit = Timed.execute(() -> fitter.fit(profile.getFitX(domain), profile.getFitValues(domain)), "Fitting %s took %dms", fitter.getModel());
        ExtrapolatedCurve curve = extrapolator.extrapolate(fit.getCurve(), profile.getOkX());
        Normalizer normalizer = new Normalizer(curve, config.getEdgePolicy());
        Frame normalized = Timed.execute(() -> normalizer.normalize(frame, ccd), "Normalization took %dms");

        LOG.log(Level.INFO, "CCD {0}: {1} fitted over {2} in {3} cycles, rms = {4}, rejected x = {5}",
                new Object[]{nccd, fitter.getModel(), domain, fit.getNumberOfCycles(), fit.getRms(), Arrays.toString(fit.getRejectedX())});
        return new NormalizationResult(profile, fit, curve, normalized);
    }

    /**
     * Read the input frame, normalize it, write the fit table to the device if
     * one is given and write the output frame. Both files are written to
     * temporary files first and only moved into place once both are complete.
     *
     * @return The result of the normalization
     * @throws FlatFieldException If the normalization fails, in which case no
     * output is written
     * @throws IOException If a file cannot be read or written, in which case
     * no output is written
     */
    public NormalizationResult run() throws FlatFieldException, IOException {
        Path inputPath = FrameIO.resolve(config.getInput());
        FrameIO input = FrameIO.forName(config.getInput());
        Frame frame = Timed.execute(Level.FINE, () -> input.read(inputPath), "Reading %s took %dms", inputPath);

        NormalizationResult result = process(frame);

        Path outputPath = FrameIO.resolve(config.getOutput());
        FrameIO output = FrameIO.forName(config.getOutput());
        Path tablePath = FitTableWriter.isNullDevice(config.getDevice()) ? null : Paths.get(config.getDevice().trim());
        Path tableTemp = null;
        Path frameTemp = null;
        boolean tableMoved = false;
        boolean done = false;
        try {
            if (tablePath != null) {
                tableTemp = createTempFile(tablePath);
                new FitTableWriter(result).write(tableTemp);
            }
            Path temp = createTempFile(outputPath);
            frameTemp = temp;
            Timed.execute(Level.FINE, () -> {
                output.write(result.getFrame(), temp);
                return null;
            }, "Writing %s took %dms", outputPath);
            if (tableTemp != null) {
                move(tableTemp, tablePath);
                tableMoved = true;
            }
            move(frameTemp, outputPath);
            done = true;
        } finally {
            if (!done) {
                deleteQuietly(tableTemp);
                deleteQuietly(frameTemp);
                if (tableMoved) {
                    deleteQuietly(tablePath);
                }
            }
        }
        LOG.log(Level.INFO, "Wrote {0}", outputPath);
        return result;
    }

    private static Path createTempFile(Path target) throws IOException {
        return Files.createTempFile(target.toAbsolutePath().getParent(), ".snorm", ".tmp");
    }

    private static void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException x) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException x) {
            LOG.log(Level.WARNING, "Could not delete " + path, x);
        }
    }
}
