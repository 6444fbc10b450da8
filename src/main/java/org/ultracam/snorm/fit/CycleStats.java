package org.ultracam.snorm.fit;

/**
 * Summary of one sigma-clipping cycle. The RMS is that of the active samples
 * before the cycle's rejection.
 *
 * @author ultracam
 */
public class CycleStats {

    private final int cycle;
    private final int nActive;
    private final double rms;
    private final int nRejected;

    CycleStats(int cycle, int nActive, double rms, int nRejected) {
        this.cycle = cycle;
        this.nActive = nActive;
        this.rms = rms;
        this.nRejected = nRejected;
    }

    public int getCycle() {
        return cycle;
    }

    public int getNumberActive() {
        return nActive;
    }

    public double getRms() {
        return rms;
    }

    public int getNumberRejected() {
        return nRejected;
    }

    @Override
    public String toString() {
        return String.format("cycle %d: %d active, rms = %.6g, %d rejected", cycle, nActive, rms, nRejected);
    }
}
