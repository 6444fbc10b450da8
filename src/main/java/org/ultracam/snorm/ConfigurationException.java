package org.ultracam.snorm;

/**
 * Thrown when the parameters are individually valid but do not fit the frame
 * being processed, for example when no window covers the extraction rows.
 *
 * @author ultracam
 */
public class ConfigurationException extends FlatFieldException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }
}
