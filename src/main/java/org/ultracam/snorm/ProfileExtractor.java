package org.ultracam.snorm;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.ultracam.snorm.fit.NonFiniteValueException;

/**
 * Collapses the window covering the extraction rows into a mean column
 * profile, in log space over the OK X range.
 *
 * @author ultracam
 */
public class ProfileExtractor {

    private static final Logger LOG = Logger.getLogger(ProfileExtractor.class.getName());

    private final int x1;
    private final int x2;
    private final int y1;
    private final int y2;

    public ProfileExtractor(int x1, int x2, int y1, int y2) {
        this.x1 = x1;
        this.x2 = x2;
        this.y1 = y1;
        this.y2 = y2;
    }

    public ProfileExtractor(NormalizationConfig config) {
        this(config.getX1(), config.getX2(), config.getY1(), config.getY2());
    }

    /**
     * Find the window whose rows span {@code [y1, y2]}. If several do, the
     * first in frame order is returned.
     *
     * @param windows The windows of one CCD
     * @param y1 The first row coordinate
     * @param y2 The last row coordinate
     * @return The covering window, or empty if there is none
     */
    public static Optional<Window> findCoveringWindow(List<Window> windows, int y1, int y2) {
        Window found = null;
        for (Window window : windows) {
            if (window.coversY(y1, y2)) {
                if (found == null) {
                    found = window;
                } else {
                    LOG.log(Level.WARNING, "Rows [{0},{1}] are also covered by {2}, using {3}", new Object[]{y1, y2, window, found});
                }
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Extract the profile from the windows of one CCD.
     *
     * @param windows The windows of the CCD
     * @return The profile, logged within the OK range
     * @throws ConfigurationException If no window covers the extraction rows,
     * or the window has no column in the OK range
     * @throws NonFiniteValueException If a mean within the OK range is not
     * positive, so has no logarithm
     */
    public Profile extract(List<Window> windows) throws ConfigurationException, NonFiniteValueException {
        Optional<Window> covering = findCoveringWindow(windows, y1, y2);
        if (!covering.isPresent()) {
            throw new ConfigurationException(String.format("No window covers the Y range [%d,%d]", y1, y2));
        }
        Window window = covering.get();
        LOG.log(Level.FINE, "Extracting profile from {0}", window);

        int nx = window.getNx();
        int ny = window.getNy();
        float[][] data = window.getData();
        int[] x = new int[nx];
        double[] values = new double[nx];
        int nOk = 0;
        for (int column = 0; column < nx; column++) {
            double sum = 0;
            for (int row = 0; row < ny; row++) {
                sum += data[row][column];
            }
            double mean = sum / ny;
            x[column] = window.xOf(column);
            if (x[column] >= x1 && x[column] <= x2) {
                if (!(mean > 0) || Double.isInfinite(mean)) {
                    throw new NonFiniteValueException(String.format("Mean of column at x=%d is %s, which has no logarithm", x[column], mean));
                }
                values[column] = Math.log(mean);
                nOk++;
            } else {
                values[column] = mean;
            }
        }
        if (nOk == 0) {
            throw new ConfigurationException(String.format("%s has no column in the OK range [%d,%d]", window, x1, x2));
        }
        return new Profile(x, values, x1, x2);
    }
}
