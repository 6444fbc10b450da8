package org.ultracam.snorm.fit;

/**
 * Thrown when the active samples cannot constrain every model parameter.
 *
 * @author ultracam
 */
public class FitDegeneracyException extends FitException {

    private static final long serialVersionUID = 1L;

    public FitDegeneracyException(String message) {
        super(message);
    }

    public FitDegeneracyException(String message, Throwable cause) {
        super(message, cause);
    }
}
