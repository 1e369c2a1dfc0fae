package org.hci.contrast.mask;

import org.hci.contrast.ResidualCube;

/**
 * Invalidates (sets to NaN) pixels of a residual cube which must not
 * contribute to noise statistics. Implementations never modify their input.
 *
 * @author hci
 */
public interface PixelMask {

    ResidualCube apply(ResidualCube cube);
}
