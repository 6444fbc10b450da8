package org.ultracam.snorm;

import java.util.Arrays;
import java.util.Objects;

/**
 * Represents one window (rectangular readout region) of a CCD. Pixel data is
 * stored row by row, {@code data[row][column]}, with row 0 at the lower left
 * corner {@code (llx, lly)}.
 *
 * @author ultracam
 */
public class Window {

    private final float[][] data;
    private final int llx;
    private final int lly;
    private final int xbin;
    private final int ybin;

    public Window(float[][] data, int llx, int lly, int xbin, int ybin) {
        if (xbin < 1 || ybin < 1) {
            throw new IllegalArgumentException("Invalid binning factors " + xbin + "x" + ybin);
        }
        int nx = data.length == 0 ? 0 : data[0].length;
        for (float[] row : data) {
            if (row.length != nx) {
                throw new IllegalArgumentException("Ragged window data");
            }
        }
        this.data = data;
        this.llx = llx;
        this.lly = lly;
        this.xbin = xbin;
        this.ybin = ybin;
    }

    /**
     * Deep copy of this window.
     *
     * @return A window with the same geometry and a copy of the pixels
     */
    public Window copy() {
        float[][] copy = new float[data.length][];
        for (int row = 0; row < data.length; row++) {
            copy[row] = data[row].clone();
        }
        return new Window(copy, llx, lly, xbin, ybin);
    }

    public float[][] getData() {
        return data;
    }

    public int getNx() {
        return data.length == 0 ? 0 : data[0].length;
    }

    public int getNy() {
        return data.length;
    }

    public int getLlx() {
        return llx;
    }

    public int getLly() {
        return lly;
    }

    public int getXbin() {
        return xbin;
    }

    public int getYbin() {
        return ybin;
    }

    /**
     * Unbinned X pixel coordinate of a column.
     *
     * @param column The column index, starting at 0
     * @return The X coordinate
     */
    public int xOf(int column) {
        return llx + xbin * column;
    }

    /**
     * Unbinned Y pixel coordinate of a row.
     *
     * @param row The row index, starting at 0
     * @return The Y coordinate
     */
    public int yOf(int row) {
        return lly + ybin * row;
    }

    public int getXMax() {
        return xOf(getNx() - 1);
    }

    public int getYMax() {
        return yOf(getNy() - 1);
    }

    /**
     * Test whether the rows of this window span the given Y range.
     *
     * @param y1 The first row coordinate
     * @param y2 The last row coordinate
     * @return <code>true</code> if {@code [y1,y2]} lies within this window
     */
    public boolean coversY(int y1, int y2) {
        return getNy() > 0 && lly <= y1 && getYMax() >= y2;
    }

    @Override
    public String toString() {
        return "Window{" + "llx=" + llx + ", lly=" + lly + ", nx=" + getNx() + ", ny=" + getNy() + ", xbin=" + xbin + ", ybin=" + ybin + '}';
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 71 * hash + this.llx;
        hash = 71 * hash + this.lly;
        hash = 71 * hash + this.xbin;
        hash = 71 * hash + this.ybin;
        hash = 71 * hash + Arrays.deepHashCode(this.data);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final Window other = (Window) obj;
        if (this.llx != other.llx || this.lly != other.lly) {
            return false;
        }
        if (this.xbin != other.xbin || this.ybin != other.ybin) {
            return false;
        }
        return Objects.deepEquals(this.data, other.data);
    }
}
