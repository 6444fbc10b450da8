package org.ultracam.snorm.fit;

import java.util.BitSet;

/**
 * Immutable state handed from one sigma-clipping cycle to the next.
 *
 * @author ultracam
 */
final class FitState {

    private final int cycle;
    private final BitSet active;

    private FitState(int cycle, BitSet active) {
        this.cycle = cycle;
        this.active = active;
    }

    static FitState initial(int nSamples) {
        BitSet all = new BitSet(nSamples);
        all.set(0, nSamples);
        return new FitState(1, all);
    }

    /**
     * State for the next cycle. The new mask must be a subset of the current
     * one.
     */
    FitState next(BitSet newActive) {
        BitSet grown = (BitSet) newActive.clone();
        grown.andNot(active);
        if (!grown.isEmpty()) {
            throw new IllegalStateException("Active set may only shrink, cycle " + cycle + " tried to re-admit " + grown);
        }
        return new FitState(cycle + 1, (BitSet) newActive.clone());
    }

    int getCycle() {
        return cycle;
    }

    BitSet getActive() {
        return (BitSet) active.clone();
    }

    int getNumberActive() {
        return active.cardinality();
    }

    boolean isActive(int index) {
        return active.get(index);
    }
}
