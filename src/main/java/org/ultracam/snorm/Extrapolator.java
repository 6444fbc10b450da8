package org.ultracam.snorm;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.ultracam.snorm.fit.CurveModel.FittedCurve;

/**
 * Extends a fit beyond its domain linearly, from the value and first
 * derivative at each end, so that the curve stays continuous and smooth at
 * the domain boundaries whatever the behaviour of the model outside them.
 *
 * @author ultracam
 */
public class Extrapolator {

    private static final Logger LOG = Logger.getLogger(Extrapolator.class.getName());

    private final FitDomain domain;

    public Extrapolator(FitDomain domain) {
        this.domain = domain;
    }

    /**
     * Build the curve over the OK range of the given X coordinates.
     *
     * @param fit The converged fit
     * @param okX The OK range X coordinates, ascending
     * @return The extrapolated curve
     */
    public ExtrapolatedCurve extrapolate(FittedCurve fit, int[] okX) {
        if (okX.length == 0) {
            throw new IllegalArgumentException("No X coordinates to extrapolate over");
        }
        ExtrapolatedCurve curve = new ExtrapolatedCurve(fit, domain, okX);
        LOG.log(Level.FINE, "Extrapolating {0} over [{1},{2}], slopes {3} and {4}",
                new Object[]{domain, curve.getXMin(), curve.getXMax(), curve.getLowSlope(), curve.getHighSlope()});
        return curve;
    }
}
