package org.ultracam.snorm;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.ultracam.snorm.fit.NonFiniteValueException;

/**
 * Divides windows, column by column, by the exponential of an extrapolated log
 * profile.
 *
 * @author ultracam
 */
public class Normalizer {

    private static final Logger LOG = Logger.getLogger(Normalizer.class.getName());

    /**
     * What to do with columns outside the OK range of the curve.
     */
    public enum EdgePolicy {
        /**
         * Leave them as they are.
         */
        LEAVE,
        /**
         * Divide them by the linear continuation of the curve.
         */
        EXTRAPOLATE
    }

    private final ExtrapolatedCurve curve;
    private final EdgePolicy edgePolicy;

    public Normalizer(ExtrapolatedCurve curve, EdgePolicy edgePolicy) {
        this.curve = curve;
        this.edgePolicy = edgePolicy;
    }

    public EdgePolicy getEdgePolicy() {
        return edgePolicy;
    }

    /**
     * Normalize every window of one CCD, leaving the other CCDs as they are.
     *
     * @param frame The frame to normalize
     * @param ccd The CCD index, starting at 0
     * @return A new frame
     * @throws NonFiniteValueException If a divisor is zero or not finite
     */
    public Frame normalize(Frame frame, int ccd) throws NonFiniteValueException {
        List<Window> normalized = new ArrayList<>();
        for (Window window : frame.getWindows(ccd)) {
            normalized.add(normalize(window));
        }
        return frame.withWindows(ccd, normalized);
    }

    /**
     * @param window The window to normalize
     * @return A normalized copy of the window
     * @throws NonFiniteValueException If a divisor is zero or not finite
     */
    public Window normalize(Window window) throws NonFiniteValueException {
        Window copy = window.copy();
        normalizeInPlace(copy);
        return copy;
    }

    /**
     * @param window The window to normalize, overwritten with the result
     * @return The number of columns divided
     * @throws NonFiniteValueException If a divisor is zero or not finite, in
     * which case the window is left unchanged
     */
    public int normalizeInPlace(Window window) throws NonFiniteValueException {
        int nx = window.getNx();
        double[] divisors = new double[nx];
        int nColumns = 0;
        for (int column = 0; column < nx; column++) {
            int x = window.xOf(column);
            if (edgePolicy == EdgePolicy.EXTRAPOLATE || (x >= curve.getXMin() && x <= curve.getXMax())) {
                double divisor = Math.exp(curve.predict(x));
                if (!Double.isFinite(divisor) || divisor == 0) {
                    throw new NonFiniteValueException(String.format("Normalization at x=%d is %s", x, divisor));
                }
                divisors[column] = divisor;
                nColumns++;
            } else {
                divisors[column] = Double.NaN;
            }
        }
        for (float[] row : window.getData()) {
            for (int column = 0; column < nx; column++) {
                if (!Double.isNaN(divisors[column])) {
                    row[column] = (float) (row[column] / divisors[column]);
                }
            }
        }
        LOG.log(Level.FINE, "Normalized {0} of {1} columns of {2}", new Object[]{nColumns, nx, window});
        return nColumns;
    }
}
