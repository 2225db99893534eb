package org.tims.convert;

/**
 * A conversion run failed and its output was left non-finalized.
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
