package org.ultracam.snorm.fit;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import org.ultracam.snorm.fit.CurveModel.FittedCurve;

/**
 * Outcome of a converged robust fit.
 *
 * @author ultracam
 */
public class RobustFit {

    private final FittedCurve curve;
    private final double[] x;
    private final BitSet mask;
    private final List<CycleStats> cycles;

    RobustFit(FittedCurve curve, double[] x, BitSet mask, List<CycleStats> cycles) {
        this.curve = curve;
        this.x = x.clone();
        this.mask = (BitSet) mask.clone();
        this.cycles = Collections.unmodifiableList(new ArrayList<>(cycles));
    }

    public FittedCurve getCurve() {
        return curve;
    }

    /**
     * @return The final active set, indexed like the fitted samples
     */
    public BitSet getMask() {
        return (BitSet) mask.clone();
    }

    public List<CycleStats> getCycles() {
        return cycles;
    }

    public int getNumberOfCycles() {
        return cycles.size();
    }

    /**
     * @return The RMS of the final cycle, in which nothing was rejected
     */
    public double getRms() {
        return cycles.get(cycles.size() - 1).getRms();
    }

    public boolean isRejected(int index) {
        return !mask.get(index);
    }

    /**
     * @return The x values of the samples clipped during the fit, ascending
     * in sample order
     */
    public double[] getRejectedX() {
        double[] result = new double[x.length - mask.cardinality()];
        int n = 0;
        for (int i = 0; i < x.length; i++) {
            if (!mask.get(i)) {
                result[n++] = x[i];
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "RobustFit{" + "cycles=" + cycles.size() + ", active=" + mask.cardinality() + "/" + x.length + ", curve=" + curve + '}';
    }
}
