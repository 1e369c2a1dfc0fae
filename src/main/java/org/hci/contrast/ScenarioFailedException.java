package org.hci.contrast;

/**
 * Thrown when a whole scenario cannot be completed, for example because too
 * many injection trials failed.
 *
 * @author hci
 */
public class ScenarioFailedException extends ContrastException {

    private static final long serialVersionUID = 1L;

    public ScenarioFailedException(String message) {
        super(message);
    }

    public ScenarioFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
