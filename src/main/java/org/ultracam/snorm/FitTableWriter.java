package org.ultracam.snorm;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.ultracam.snorm.fit.RobustFit;

/**
 * Writes the profile, the fitted curve and the rejection flags as a text
 * table, one line per OK range sample: {@code x profile curve flag}. The flag
 * is 0 for a fitted sample, 1 for a rejected one and 2 for a sample outside
 * the fit domain.
 *
 * @author ultracam
 */
public class FitTableWriter {

    public static final int FITTED = 0;
    public static final int REJECTED = 1;
    public static final int OUTSIDE = 2;

    private final NormalizationResult result;

    public FitTableWriter(NormalizationResult result) {
        this.result = result;
    }

    /**
     * @param device The device name
     * @return {@code true} if the device means no table should be written
     */
    public static boolean isNullDevice(String device) {
        if (device == null) {
            return true;
        }
        String trimmed = device.trim();
        return trimmed.isEmpty() || trimmed.equalsIgnoreCase("null") || trimmed.equalsIgnoreCase("/null");
    }

    public void write(Path path) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer);
        }
    }

    public void write(Writer writer) throws IOException {
        Profile profile = result.getProfile();
        RobustFit fit = result.getFit();
        ExtrapolatedCurve curve = result.getCurve();
        FitDomain domain = curve.getFitDomain();
        int fitIndex = 0;
        for (int i = 0; i < profile.size(); i++) {
            if (!profile.isInOkDomain(i)) {
                continue;
            }
            int x = profile.getX(i);
            int flag;
            if (domain.contains(x)) {
                flag = fit.isRejected(fitIndex++) ? REJECTED : FITTED;
            } else {
                flag = OUTSIDE;
            }
            writer.write(String.format(Locale.ROOT, "%d %.8g %.8g %d%n", x, profile.getValue(i), curve.predict(x), flag));
        }
        writer.flush();
    }
}
