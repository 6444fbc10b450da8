package org.ultracam.snorm.fit;

/**
 * Thrown when sigma-clipping is still rejecting points after the cycle cap or
 * the timeout has been reached.
 *
 * @author ultracam
 */
public class NonConvergenceException extends FitException {

    private static final long serialVersionUID = 1L;

    private final int cycles;

    public NonConvergenceException(String message, int cycles) {
        super(message);
        this.cycles = cycles;
    }

    public int getCycles() {
        return cycles;
    }
}
