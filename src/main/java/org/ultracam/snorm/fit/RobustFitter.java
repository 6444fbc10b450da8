package org.ultracam.snorm.fit;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.ultracam.snorm.fit.CurveModel.FittedCurve;

/**
 * Iterative sigma-clipping fit.
 *
 * Each cycle fits the model to the active samples and computes the RMS of
 * their residuals. Samples whose absolute residual is not below
 * {@code threshold * rms} are dropped and the model is refitted, until a
 * cycle rejects nothing. Rejected samples are never re-admitted, so the active
 * set shrinks monotonically.
 *
 * The loop is bounded by a maximum number of cycles and, optionally, by a
 * wall-clock timeout.
 *
 * @author ultracam
 */
public class RobustFitter {

    private static final Logger LOG = Logger.getLogger(RobustFitter.class.getName());

    public static final int DEFAULT_MAX_CYCLES = 100;

    // An RMS this small relative to the data is rounding noise, nothing to clip
    private static final double EXACT_FIT_RMS = 1e-12;

    private final CurveModel model;
    private final double threshold;
    private final int maxCycles;
    private final long timeoutMillis;

    public RobustFitter(CurveModel model, double threshold) {
        this(model, threshold, DEFAULT_MAX_CYCLES, 0);
    }

    /**
     * Create a fitter.
     *
     * @param model The model family to fit
     * @param threshold The rejection threshold, as a multiple of the RMS
     * @param maxCycles The maximum number of fit cycles
     * @param timeoutMillis The maximum time to spend, or 0 for no limit
     */
    public RobustFitter(CurveModel model, double threshold, int maxCycles, long timeoutMillis) {
        if (!(threshold > 1)) {
            throw new IllegalArgumentException("Rejection threshold must exceed 1: " + threshold);
        }
        if (maxCycles < 1) {
            throw new IllegalArgumentException("Maximum number of cycles must be positive: " + maxCycles);
        }
        this.model = model;
        this.threshold = threshold;
        this.maxCycles = maxCycles;
        this.timeoutMillis = timeoutMillis;
    }

    public CurveModel getModel() {
        return model;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Fit the samples.
     *
     * @param x The sample coordinates
     * @param y The sample values
     * @return The converged fit
     * @throws FitDegeneracyException If the active set can no longer
     * constrain the model
     * @throws NonConvergenceException If the cycle cap or timeout is reached
     * @throws NonFiniteValueException If a sample, coefficient or RMS is not
     * finite
     */
    public RobustFit fit(double[] x, double[] y) throws FitDegeneracyException, NonConvergenceException, NonFiniteValueException {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y lengths differ: " + x.length + " != " + y.length);
        }
        double scale = 1.0;
        for (int i = 0; i < y.length; i++) {
            if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
                throw new NonFiniteValueException(String.format("Sample %d is not finite: (%s, %s)", i, x[i], y[i]));
            }
            scale = Math.max(scale, Math.abs(y[i]));
        }
        long deadline = timeoutMillis > 0 ? System.currentTimeMillis() + timeoutMillis : Long.MAX_VALUE;
        List<CycleStats> cycles = new ArrayList<>();
        FitState state = FitState.initial(x.length);

        for (;;) {
            int nActive = state.getNumberActive();
            if (nActive < model.getNumberOfParameters()) {
                throw new FitDegeneracyException(String.format("Cycle %d: %d active samples cannot constrain %d parameters of %s",
                        state.getCycle(), nActive, model.getNumberOfParameters(), model));
            }
            FittedCurve curve = fitActive(state, x, y);

            double[] residuals = new double[x.length];
            double sumSquares = 0;
            for (int i = 0; i < x.length; i++) {
                residuals[i] = Math.abs(y[i] - curve.value(x[i]));
                if (state.isActive(i)) {
                    sumSquares += residuals[i] * residuals[i];
                }
            }
            double rms = Math.sqrt(sumSquares / nActive);
            if (!Double.isFinite(rms)) {
                throw new NonFiniteValueException(String.format("Cycle %d: RMS is %s for %s", state.getCycle(), rms, curve));
            }

            BitSet newActive = state.getActive();
            if (rms > EXACT_FIT_RMS * scale) {
                double limit = threshold * rms;
                for (int i = newActive.nextSetBit(0); i >= 0; i = newActive.nextSetBit(i + 1)) {
                    if (!(residuals[i] < limit)) {
                        newActive.clear(i);
                    }
                }
            }
            int nRejected = nActive - newActive.cardinality();
            CycleStats stats = new CycleStats(state.getCycle(), nActive, rms, nRejected);
            cycles.add(stats);
            LOG.log(Level.FINE, "{0}", stats);

            if (nRejected == 0) {
                LOG.log(Level.FINE, "Converged after {0} cycles with {1} of {2} samples, rms = {3}",
                        new Object[]{state.getCycle(), nActive, x.length, rms});
                return new RobustFit(curve, x, state.getActive(), cycles);
            }
            if (state.getCycle() >= maxCycles) {
                throw new NonConvergenceException(String.format("Still rejecting after %d cycles (last cycle rejected %d)", state.getCycle(), nRejected), state.getCycle());
            }
            if (System.currentTimeMillis() > deadline) {
                throw new NonConvergenceException(String.format("Timed out after %d cycles and %dms", state.getCycle(), timeoutMillis), state.getCycle());
            }
            state = state.next(newActive);
        }
    }

    private FittedCurve fitActive(FitState state, double[] x, double[] y) throws FitDegeneracyException, NonFiniteValueException {
        int nActive = state.getNumberActive();
        double[] activeX = new double[nActive];
        double[] activeY = new double[nActive];
        int n = 0;
        for (int i = 0; i < x.length; i++) {
            if (state.isActive(i)) {
                activeX[n] = x[i];
                activeY[n] = y[i];
                n++;
            }
        }
        FittedCurve curve = model.fit(activeX, activeY);
        for (int i = 0; i < nActive; i++) {
            if (!Double.isFinite(curve.value(activeX[i]))) {
                throw new NonFiniteValueException(String.format("Cycle %d: fit is not finite at x=%s", state.getCycle(), activeX[i]));
            }
        }
        return curve;
    }
}
