package org.ultracam.snorm;

import org.ultracam.snorm.fit.CurveModel.FittedCurve;

/**
 * The fitted log profile over the whole X axis: the fit itself within the fit
 * domain, straight lines matching its value and slope at either end outside
 * it.
 *
 * @author ultracam
 */
public class ExtrapolatedCurve {

    private final FittedCurve fit;
    private final FitDomain domain;
    private final double lowValue;
    private final double lowSlope;
    private final double highValue;
    private final double highSlope;
    private final int[] x;
    private final double[] values;

    ExtrapolatedCurve(FittedCurve fit, FitDomain domain, int[] x) {
        this.fit = fit;
        this.domain = domain;
        this.lowValue = fit.value(domain.getXf1());
        this.lowSlope = fit.derivative(domain.getXf1());
        this.highValue = fit.value(domain.getXf2());
        this.highSlope = fit.derivative(domain.getXf2());
        this.x = x.clone();
        this.values = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            values[i] = predict(x[i]);
        }
    }

    /**
     * Predicted log intensity at any X.
     *
     * @param xValue The X coordinate
     * @return The fit within {@code [xf1, xf2]}, the linear continuation
     * beyond
     */
    public double predict(double xValue) {
        if (xValue < domain.getXf1()) {
            return lowValue + lowSlope * (xValue - domain.getXf1());
        } else if (xValue > domain.getXf2()) {
            return highValue + highSlope * (xValue - domain.getXf2());
        } else {
            return fit.value(xValue);
        }
    }

    public FitDomain getFitDomain() {
        return domain;
    }

    /**
     * @return The X coordinates the curve was tabulated at (the OK range
     * samples of the profile)
     */
    public int[] getX() {
        return x.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    public int getXMin() {
        return x[0];
    }

    public int getXMax() {
        return x[x.length - 1];
    }

    public double getLowSlope() {
        return lowSlope;
    }

    public double getHighSlope() {
        return highSlope;
    }
}
