package org.ultracam.snorm.fit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.util.BitSet;
import java.util.List;
import org.junit.Test;
import org.ultracam.snorm.fit.PolynomialModel.PolynomialCurve;

public class RobustFitterTest {

    private static double[] xRange(int from, int to) {
        double[] result = new double[to - from + 1];
        for (int i = 0; i < result.length; i++) {
            result[i] = from + i;
        }
        return result;
    }

    /**
     * Quadratic plus small deterministic ripple, with outliers of 0.2 at 25,
     * 50 and 75.
     */
    private static double[] quadraticWithOutliers(double[] x) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = 1.0 + 0.01 * x[i] - 0.0001 * x[i] * x[i] + 0.01 * Math.sin(2.3 * x[i] + 0.7);
            if (x[i] == 25 || x[i] == 50 || x[i] == 75) {
                y[i] += 0.2;
            }
        }
        return y;
    }

    /**
     * Quartic trend with a small step at x = 47. The step is small enough
     * that the quartic term dominates, which is what lets the polynomial beat
     * the spline here. This pins the behaviour for this profile only: with a
     * large step the spline fits better.
     */
    private static double[] quarticWithStep(double[] x) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double u = (x[i] - 50) / 40;
            y[i] = 2 * u * u * u * u + (x[i] >= 47 ? 0.0005 : 0);
        }
        return y;
    }

    @Test
    public void testRejectsOutliers() throws FitException {
        double[] x = xRange(10, 90);
        RobustFitter fitter = new RobustFitter(new PolynomialModel(2), 3.0);
        RobustFit fit = fitter.fit(x, quadraticWithOutliers(x));

        assertTrue(fit.getNumberOfCycles() <= 4);
        assertEquals(2, fit.getNumberOfCycles());
        assertArrayEquals(new double[]{25, 50, 75}, fit.getRejectedX(), 0);
        List<CycleStats> cycles = fit.getCycles();
        assertEquals(0.03909, cycles.get(0).getRms(), 1e-4);
        assertEquals(3, cycles.get(0).getNumberRejected());
        assertEquals(81, cycles.get(0).getNumberActive());
        assertEquals(0.007093, fit.getRms(), 1e-5);
        assertEquals(0, cycles.get(1).getNumberRejected());
        assertEquals(78, cycles.get(1).getNumberActive());
        // the outliers are at least five times the final rms away
        for (double rejected : fit.getRejectedX()) {
            double expected = 1.0 + 0.01 * rejected - 0.0001 * rejected * rejected;
            assertTrue(Math.abs(fit.getCurve().value(rejected) - expected) < 0.05);
        }
    }

    @Test
    public void testMaskOnlyShrinks() throws FitException {
        double[] x = xRange(10, 90);
        RobustFit fit = new RobustFitter(new PolynomialModel(2), 3.0).fit(x, quadraticWithOutliers(x));
        int previous = x.length;
        for (CycleStats stats : fit.getCycles()) {
            assertTrue(stats.getNumberActive() <= previous);
            previous = stats.getNumberActive() - stats.getNumberRejected();
        }
        BitSet mask = fit.getMask();
        assertEquals(previous, mask.cardinality());
        assertTrue(mask.length() <= x.length);
        assertTrue(fit.isRejected(15));
        assertFalse(fit.isRejected(16));
    }

    @Test
    public void testRefitIsIdempotent() throws FitException {
        double[] x = xRange(10, 90);
        double[] y = quadraticWithOutliers(x);
        RobustFitter fitter = new RobustFitter(new PolynomialModel(2), 3.0);
        RobustFit fit = fitter.fit(x, y);

        BitSet mask = fit.getMask();
        double[] activeX = new double[mask.cardinality()];
        double[] activeY = new double[mask.cardinality()];
        int n = 0;
        for (int i = mask.nextSetBit(0); i >= 0; i = mask.nextSetBit(i + 1)) {
            activeX[n] = x[i];
            activeY[n] = y[i];
            n++;
        }
        RobustFit refit = fitter.fit(activeX, activeY);
        assertEquals(1, refit.getNumberOfCycles());
        assertEquals(0, refit.getRejectedX().length);
        assertEquals(fit.getRms(), refit.getRms(), 1e-15);
        PolynomialCurve first = (PolynomialCurve) fit.getCurve();
        PolynomialCurve second = (PolynomialCurve) refit.getCurve();
        assertArrayEquals(first.getCoefficients(), second.getCoefficients(), 1e-15);
    }

    @Test
    public void testCycleCap() throws FitException {
        double[] x = xRange(10, 90);
        RobustFitter fitter = new RobustFitter(new PolynomialModel(2), 3.0, 1, 0);
        try {
            fitter.fit(x, quadraticWithOutliers(x));
            fail("Should not converge in a single cycle");
        } catch (NonConvergenceException x1) {
            assertEquals(1, x1.getCycles());
        }
    }

    @Test
    public void testConstantProfile() throws FitException {
        double[] x = xRange(0, 20);
        double[] y = new double[x.length];
        java.util.Arrays.fill(y, Math.log(1234.5));
        RobustFit fit = new RobustFitter(new PolynomialModel(3), 3.0).fit(x, y);
        assertEquals(1, fit.getNumberOfCycles());
        assertEquals(0, fit.getRejectedX().length);
        assertEquals(Math.log(1234.5), fit.getCurve().value(7), 1e-12);
    }

    @Test
    public void testSplineWorseThanPolynomialOnQuarticStep() throws FitException {
        double[] x = xRange(10, 90);
        double[] y = quarticWithStep(x);
        RobustFit spline = new RobustFitter(new SplineModel(5, 10, 90), 3.0).fit(x, y);
        RobustFit poly = new RobustFitter(new PolynomialModel(4), 3.0).fit(x, y);
        assertEquals(1, spline.getNumberOfCycles());
        assertEquals(1, poly.getNumberOfCycles());
        assertEquals(4.83e-4, spline.getRms(), 1e-5);
        assertEquals(9.2e-5, poly.getRms(), 1e-6);
        assertTrue(spline.getRms() > poly.getRms());
    }

    @Test(expected = FitDegeneracyException.class)
    public void testTooFewSamples() throws FitException {
        new RobustFitter(new PolynomialModel(3), 3.0).fit(new double[]{1, 2, 3}, new double[]{1, 2, 3});
    }

    @Test(expected = NonFiniteValueException.class)
    public void testNaNSample() throws FitException {
        double[] x = xRange(0, 10);
        double[] y = new double[x.length];
        y[4] = Double.NaN;
        new RobustFitter(new PolynomialModel(1), 3.0).fit(x, y);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThresholdMustExceedOne() {
        new RobustFitter(new PolynomialModel(1), 1.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMismatchedLengths() throws FitException {
        new RobustFitter(new PolynomialModel(1), 3.0).fit(new double[]{1, 2, 3}, new double[]{1, 2});
    }
}
