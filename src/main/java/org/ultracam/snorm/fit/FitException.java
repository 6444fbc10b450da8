package org.ultracam.snorm.fit;

import org.ultracam.snorm.FlatFieldException;

/**
 * Failure of the robust profile fit.
 *
 * @author ultracam
 */
public abstract class FitException extends FlatFieldException {

    private static final long serialVersionUID = 1L;

    protected FitException(String message) {
        super(message);
    }

    protected FitException(String message, Throwable cause) {
        super(message, cause);
    }
}
