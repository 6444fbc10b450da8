package org.ultracam.snorm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.ultracam.snorm.io.HeaderItem;

/**
 * A multi-CCD frame: an ordered header plus, for every CCD, an ordered list of
 * windows. The binning factors and full detector dimensions are shared by every
 * window of the frame.
 *
 * @author ultracam
 */
public class Frame {

    private final Map<String, HeaderItem> header;
    private final List<List<Window>> ccds;
    private final int xbin;
    private final int ybin;
    private final int nxtot;
    private final int nytot;

    public Frame(Map<String, HeaderItem> header, List<List<Window>> ccds, int xbin, int ybin, int nxtot, int nytot) {
        this.header = Collections.unmodifiableMap(new LinkedHashMap<>(header));
        List<List<Window>> copy = new ArrayList<>(ccds.size());
        for (List<Window> windows : ccds) {
            for (Window window : windows) {
                if (window.getXbin() != xbin || window.getYbin() != ybin) {
                    throw new IllegalArgumentException("Window binning differs from frame binning: " + window);
                }
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(windows)));
        }
        this.ccds = Collections.unmodifiableList(copy);
        this.xbin = xbin;
        this.ybin = ybin;
        this.nxtot = nxtot;
        this.nytot = nytot;
    }

    public Map<String, HeaderItem> getHeader() {
        return header;
    }

    public int getNumberOfCcds() {
        return ccds.size();
    }

    /**
     * The windows of one CCD.
     *
     * @param ccd The CCD index, starting at 0
     * @return The windows in file order
     */
    public List<Window> getWindows(int ccd) {
        return ccds.get(ccd);
    }

    public List<List<Window>> getCcds() {
        return ccds;
    }

    public int getXbin() {
        return xbin;
    }

    public int getYbin() {
        return ybin;
    }

    public int getNxtot() {
        return nxtot;
    }

    public int getNytot() {
        return nytot;
    }

    /**
     * Create a frame identical to this one except for the windows of one CCD.
     *
     * @param ccd The CCD index, starting at 0
     * @param windows The replacement windows
     * @return The new frame
     */
    public Frame withWindows(int ccd, List<Window> windows) {
        List<List<Window>> replaced = new ArrayList<>(ccds);
        replaced.set(ccd, windows);
        return new Frame(header, replaced, xbin, ybin, nxtot, nytot);
    }

    @Override
    public String toString() {
        return "Frame{" + "nccd=" + ccds.size() + ", xbin=" + xbin + ", ybin=" + ybin + ", nxtot=" + nxtot + ", nytot=" + nytot + ", headerItems=" + header.size() + '}';
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 79 * hash + Objects.hashCode(this.ccds);
        hash = 79 * hash + this.xbin;
        hash = 79 * hash + this.ybin;
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
        final Frame other = (Frame) obj;
        if (this.xbin != other.xbin || this.ybin != other.ybin) {
            return false;
        }
        if (this.nxtot != other.nxtot || this.nytot != other.nytot) {
            return false;
        }
        return Objects.equals(this.header, other.header) && Objects.equals(this.ccds, other.ccds);
    }
}
