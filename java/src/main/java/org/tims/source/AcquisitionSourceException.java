package org.tims.source;

/**
 * Fault raised by an acquisition source while reading metadata or decoding frame data.
 */
public class AcquisitionSourceException extends RuntimeException {

    public AcquisitionSourceException(String message) {
        super(message);
    }

    public AcquisitionSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
