package org.ultracam.snorm.fit;

/**
 * Thrown when a NaN or infinite value turns up in the profile, the fit or the
 * normalization, so that it never reaches the output frame.
 *
 * @author ultracam
 */
public class NonFiniteValueException extends FitException {

    private static final long serialVersionUID = 1L;

    public NonFiniteValueException(String message) {
        super(message);
    }
}
