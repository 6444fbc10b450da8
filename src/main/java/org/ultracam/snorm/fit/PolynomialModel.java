package org.ultracam.snorm.fit;

import java.util.Arrays;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;

/**
 * Polynomial of fixed degree. The fit is done in the normalized coordinate
 * {@code u = (x - centre) / halfWidth} of the fitted samples so that high
 * degrees over wide pixel ranges stay well conditioned.
 *
 * @author ultracam
 */
public class PolynomialModel implements CurveModel {

    private final int degree;

    public PolynomialModel(int degree) {
        if (degree < 0) {
            throw new IllegalArgumentException("Negative polynomial degree: " + degree);
        }
        this.degree = degree;
    }

    public int getDegree() {
        return degree;
    }

    @Override
    public int getNumberOfParameters() {
        return degree + 1;
    }

    @Override
    public PolynomialCurve fit(double[] x, double[] y) throws FitDegeneracyException {
        if (x.length < getNumberOfParameters()) {
            throw new FitDegeneracyException(String.format("%d samples cannot constrain a polynomial of degree %d", x.length, degree));
        }
        double min = Arrays.stream(x).min().getAsDouble();
        double max = Arrays.stream(x).max().getAsDouble();
        double centre = 0.5 * (min + max);
        double halfWidth = max > min ? 0.5 * (max - min) : 1.0;

        // Vandermonde matrix, highest power first
        double[][] design = new double[x.length][degree + 1];
        for (int i = 0; i < x.length; i++) {
            double u = (x[i] - centre) / halfWidth;
            double power = 1.0;
            for (int j = degree; j >= 0; j--) {
                design[i][j] = power;
                power *= u;
            }
        }
        return new PolynomialCurve(LeastSquares.solve(design, y), centre, halfWidth);
    }

    @Override
    public String toString() {
        return "PolynomialModel{" + "degree=" + degree + '}';
    }

    public static class PolynomialCurve implements FittedCurve {

        private final double[] coefficients;
        private final double centre;
        private final double halfWidth;
        private final PolynomialFunction function;
        private final PolynomialFunction derivative;

        /**
         * Create a polynomial curve.
         *
         * @param coefficients The coefficients in the normalized coordinate,
         * highest degree first
         * @param centre The x value mapped to u=0
         * @param halfWidth The x distance mapped to u=1
         */
        PolynomialCurve(double[] coefficients, double centre, double halfWidth) {
            this.coefficients = coefficients.clone();
            this.centre = centre;
            this.halfWidth = halfWidth;
            // PolynomialFunction wants the constant term first
            double[] ascending = new double[coefficients.length];
            for (int i = 0; i < coefficients.length; i++) {
                ascending[i] = coefficients[coefficients.length - 1 - i];
            }
            this.function = new PolynomialFunction(ascending);
            this.derivative = function.polynomialDerivative();
        }

        /**
         * @return The coefficients in the normalized coordinate, highest degree
         * first
         */
        public double[] getCoefficients() {
            return coefficients.clone();
        }

        public double getCentre() {
            return centre;
        }

        public double getHalfWidth() {
            return halfWidth;
        }

        @Override
        public double value(double x) {
            return function.value((x - centre) / halfWidth);
        }

        @Override
        public double derivative(double x) {
            return derivative.value((x - centre) / halfWidth) / halfWidth;
        }

        @Override
        public String toString() {
            return "PolynomialCurve{" + "coefficients=" + Arrays.toString(coefficients) + ", centre=" + centre + ", halfWidth=" + halfWidth + '}';
        }
    }
}
