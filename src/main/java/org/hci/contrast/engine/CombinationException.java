package org.hci.contrast.engine;

import org.hci.contrast.ContrastException;

/**
 * Thrown when the image combination engine fails to process a set of frames.
 *
 * @author hci
 */
public class CombinationException extends ContrastException {

    private static final long serialVersionUID = 1L;

    public CombinationException(String message) {
        super(message);
    }

    public CombinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
