package org.ultracam.snorm;

/**
 * Base class for failures of the flat-field normalization. Each subclass maps
 * to a distinct exit status of the command line tool.
 *
 * @author ultracam
 */
public abstract class FlatFieldException extends Exception {

    private static final long serialVersionUID = 1L;

    protected FlatFieldException(String message) {
        super(message);
    }

    protected FlatFieldException(String message, Throwable cause) {
        super(message, cause);
    }
}
