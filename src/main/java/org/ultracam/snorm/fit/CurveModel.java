package org.ultracam.snorm.fit;

/**
 * A family of curves that can be fitted to a set of samples by linear least
 * squares.
 *
 * @author ultracam
 */
public interface CurveModel {

    /**
     * Fit the model to the given samples.
     *
     * @param x The sample coordinates
     * @param y The sample values
     * @return The fitted curve
     * @throws FitDegeneracyException If the samples do not constrain every
     * parameter
     */
    FittedCurve fit(double[] x, double[] y) throws FitDegeneracyException;

    /**
     * The number of free parameters, and therefore the minimum number of
     * samples a fit needs.
     *
     * @return The number of parameters
     */
    int getNumberOfParameters();

    public interface FittedCurve {

        double value(double x);

        double derivative(double x);
    }
}
