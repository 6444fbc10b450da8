package org.ultracam.snorm.fit;

import java.util.Arrays;

/**
 * Least-squares B-spline with a clamped knot vector over a fixed interval and
 * evenly spaced interior knots. The interval end points are not used as
 * interior knots.
 *
 * @author ultracam
 */
public class SplineModel implements CurveModel {

    public static final int CUBIC = 3;

    private final int nInteriorKnots;
    private final int degree;
    private final double xStart;
    private final double xEnd;
    private final double[] knots;

    public SplineModel(int nInteriorKnots, double xStart, double xEnd) {
        this(nInteriorKnots, CUBIC, xStart, xEnd);
    }

    public SplineModel(int nInteriorKnots, int degree, double xStart, double xEnd) {
        if (nInteriorKnots < 0) {
            throw new IllegalArgumentException("Negative number of knots: " + nInteriorKnots);
        }
        if (degree < 1) {
            throw new IllegalArgumentException("Spline degree must be at least 1: " + degree);
        }
        if (!(xEnd > xStart)) {
            throw new IllegalArgumentException("Empty spline interval [" + xStart + "," + xEnd + "]");
        }
        this.nInteriorKnots = nInteriorKnots;
        this.degree = degree;
        this.xStart = xStart;
        this.xEnd = xEnd;
        this.knots = new double[nInteriorKnots + 2 * (degree + 1)];
        Arrays.fill(knots, 0, degree + 1, xStart);
        double spacing = (xEnd - xStart) / (nInteriorKnots + 1);
        for (int i = 1; i <= nInteriorKnots; i++) {
            knots[degree + i] = xStart + i * spacing;
        }
        Arrays.fill(knots, degree + 1 + nInteriorKnots, knots.length, xEnd);
    }

    /**
     * @return The interior knot positions
     */
    public double[] getInteriorKnots() {
        return Arrays.copyOfRange(knots, degree + 1, degree + 1 + nInteriorKnots);
    }

    public int getDegree() {
        return degree;
    }

    @Override
    public int getNumberOfParameters() {
        return nInteriorKnots + degree + 1;
    }

    @Override
    public BSplineCurve fit(double[] x, double[] y) throws FitDegeneracyException {
        int nCoefficients = getNumberOfParameters();
        if (x.length < nCoefficients) {
            throw new FitDegeneracyException(String.format("%d samples cannot constrain a spline with %d coefficients", x.length, nCoefficients));
        }
        double[][] design = new double[x.length][nCoefficients];
        double[] basis = new double[degree + 1];
        for (int i = 0; i < x.length; i++) {
            if (x[i] < xStart || x[i] > xEnd) {
                throw new IllegalArgumentException("Sample at x=" + x[i] + " outside spline interval [" + xStart + "," + xEnd + "]");
            }
            int span = findSpan(knots, degree, nCoefficients, x[i]);
            basisFunctions(knots, degree, span, x[i], basis);
            System.arraycopy(basis, 0, design[i], span - degree, degree + 1);
        }
        return new BSplineCurve(knots, LeastSquares.solve(design, y), degree);
    }

    @Override
    public String toString() {
        return "SplineModel{" + "nInteriorKnots=" + nInteriorKnots + ", degree=" + degree + ", xStart=" + xStart + ", xEnd=" + xEnd + '}';
    }

    /**
     * Index of the knot span containing x. The last span is closed so that the
     * right hand end of the interval is included.
     */
    static int findSpan(double[] knots, int degree, int nCoefficients, double x) {
        int n = nCoefficients - 1;
        if (x >= knots[n + 1]) {
            return n;
        }
        if (x <= knots[degree]) {
            return degree;
        }
        int low = degree;
        int high = n + 1;
        int mid = (low + high) / 2;
        while (x < knots[mid] || x >= knots[mid + 1]) {
            if (x < knots[mid]) {
                high = mid;
            } else {
                low = mid;
            }
            mid = (low + high) / 2;
        }
        return mid;
    }

    /**
     * The degree+1 basis functions that are non-zero on the given span (Cox-de
     * Boor recursion).
     */
    static void basisFunctions(double[] knots, int degree, int span, double x, double[] result) {
        double[] left = new double[degree + 1];
        double[] right = new double[degree + 1];
        result[0] = 1.0;
        for (int j = 1; j <= degree; j++) {
            left[j] = x - knots[span + 1 - j];
            right[j] = knots[span + j] - x;
            double saved = 0.0;
            for (int r = 0; r < j; r++) {
                double temp = result[r] / (right[r + 1] + left[j - r]);
                result[r] = saved + right[r + 1] * temp;
                saved = left[j - r] * temp;
            }
            result[j] = saved;
        }
    }

    public static class BSplineCurve implements FittedCurve {

        private final double[] knots;
        private final double[] coefficients;
        private final int degree;
        private final BSplineCurve derivative;

        BSplineCurve(double[] knots, double[] coefficients, int degree) {
            if (knots.length != coefficients.length + degree + 1) {
                throw new IllegalArgumentException("Expected " + (coefficients.length + degree + 1) + " knots, got " + knots.length);
            }
            this.knots = knots.clone();
            this.coefficients = coefficients.clone();
            this.degree = degree;
            this.derivative = degree > 0 ? differentiate() : null;
        }

        private BSplineCurve differentiate() {
            double[] dCoefficients = new double[coefficients.length - 1];
            for (int i = 0; i < dCoefficients.length; i++) {
                double width = knots[i + degree + 1] - knots[i + 1];
                dCoefficients[i] = width > 0 ? degree * (coefficients[i + 1] - coefficients[i]) / width : 0.0;
            }
            return new BSplineCurve(Arrays.copyOfRange(knots, 1, knots.length - 1), dCoefficients, degree - 1);
        }

        public double[] getKnots() {
            return knots.clone();
        }

        public double[] getCoefficients() {
            return coefficients.clone();
        }

        public int getDegree() {
            return degree;
        }

        /**
         * Evaluate the spline. Outside the knot interval the value of the end
         * polynomial pieces is continued.
         */
        @Override
        public double value(double x) {
            int span = findSpan(knots, degree, coefficients.length, x);
            double[] basis = new double[degree + 1];
            basisFunctions(knots, degree, span, x, basis);
            double sum = 0;
            for (int r = 0; r <= degree; r++) {
                sum += basis[r] * coefficients[span - degree + r];
            }
            return sum;
        }

        @Override
        public double derivative(double x) {
            return derivative == null ? 0.0 : derivative.value(x);
        }

        @Override
        public String toString() {
            return "BSplineCurve{" + "degree=" + degree + ", knots=" + Arrays.toString(knots) + ", coefficients=" + Arrays.toString(coefficients) + '}';
        }
    }
}
