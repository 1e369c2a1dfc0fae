package org.hci.contrast;

/**
 * Base class for the checked failures of the contrast pipeline.
 *
 * @author hci
 */
public class ContrastException extends Exception {

    private static final long serialVersionUID = 1L;

    public ContrastException(String message) {
        super(message);
    }

    public ContrastException(String message, Throwable cause) {
        super(message, cause);
    }
}
