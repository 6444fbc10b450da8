package org.ultracam.snorm;

import java.util.Arrays;

/**
 * Mean intensity per column of one window. Values whose X lies in the OK range
 * {@code [x1, x2]} hold natural logarithms; the others are kept linear and are
 * never fitted.
 *
 * @author ultracam
 */
public class Profile {

    private final int[] x;
    private final double[] values;
    private final int x1;
    private final int x2;

    Profile(int[] x, double[] values, int x1, int x2) {
        if (x.length != values.length) {
            throw new IllegalArgumentException("x and value lengths differ");
        }
        this.x = x.clone();
        this.values = values.clone();
        this.x1 = x1;
        this.x2 = x2;
    }

    public int size() {
        return x.length;
    }

    public int getX(int index) {
        return x[index];
    }

    public double getValue(int index) {
        return values[index];
    }

    public boolean isInOkDomain(int index) {
        return x[index] >= x1 && x[index] <= x2;
    }

    public int getX1() {
        return x1;
    }

    public int getX2() {
        return x2;
    }

    /**
     * @return The X coordinates of the samples in the OK range, ascending
     */
    public int[] getOkX() {
        return Arrays.stream(x).filter(v -> v >= x1 && v <= x2).toArray();
    }

    /**
     * @param domain The fit domain
     * @return The X coordinates of the samples within the fit domain
     */
    public double[] getFitX(FitDomain domain) {
        return Arrays.stream(x).filter(domain::contains).asDoubleStream().toArray();
    }

    /**
     * @param domain The fit domain
     * @return The log values of the samples within the fit domain
     */
    public double[] getFitValues(FitDomain domain) {
        double[] result = new double[x.length];
        int n = 0;
        for (int i = 0; i < x.length; i++) {
            if (domain.contains(x[i])) {
                result[n++] = values[i];
            }
        }
        return Arrays.copyOf(result, n);
    }

    @Override
    public String toString() {
        return "Profile{" + "samples=" + x.length + ", ok=[" + x1 + "," + x2 + "]}";
    }
}
