package org.hci.contrast;

import java.util.Arrays;

/**
 * Thrown when an array handed to the contrast code does not have the
 * expected rank or size. Shapes are never coerced.
 *
 * @author hci
 */
public class ShapeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ShapeException(String message) {
        super(message);
    }

    public ShapeException(String message, int[] shape) {
        super(message + ", got shape " + Arrays.toString(shape));
    }
}
