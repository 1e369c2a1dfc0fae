package org.hci.contrast.psf;

import java.awt.geom.Point2D;
import java.io.IOException;

/**
 * Source of model PSFs (for example WebbPSF output).
 *
 * @author hci
 */
public interface PsfProvider {

    /**
     * Compute an offset PSF. The result is square with an odd size, centered
     * on pixel <code>(n-1)/2</code>, normalized to a total intensity of 1 at
     * the entrance pupil and already attenuated by the optics throughput at
     * the requested field position.
     *
     * @param filter The filter name
     * @param mask The coronagraphic mask name
     * @param position Offset from the mask center in pixels (x, y), or
     * <code>null</code> for the unocculted reference PSF
     * @return The PSF, indexed [y][x]
     * @throws IOException If the PSF cannot be produced
     */
    double[][] offsetPsf(String filter, String mask, Point2D position) throws IOException;
}
