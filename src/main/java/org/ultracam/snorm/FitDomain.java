package org.ultracam.snorm;

/**
 * The X range {@code [xf1, xf2]}, both ends included, over which the profile
 * is fitted.
 *
 * @author ultracam
 */
public class FitDomain {

    private final int xf1;
    private final int xf2;

    public FitDomain(int xf1, int xf2) {
        if (xf1 >= xf2) {
            throw new IllegalArgumentException("Empty fit domain [" + xf1 + "," + xf2 + "]");
        }
        this.xf1 = xf1;
        this.xf2 = xf2;
    }

    public int getXf1() {
        return xf1;
    }

    public int getXf2() {
        return xf2;
    }

    public boolean contains(double x) {
        return x >= xf1 && x <= xf2;
    }

    @Override
    public String toString() {
        return "[" + xf1 + "," + xf2 + "]";
    }
}
