package org.ultracam.snorm;

/**
 * Thrown when a user supplied parameter is out of range or malformed.
 *
 * @author ultracam
 */
public class ValidationException extends FlatFieldException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
