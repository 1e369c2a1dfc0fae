package org.hci.contrast.inject;

import java.awt.geom.Point2D;
import org.hci.contrast.psf.Psfs;

/**
 * Measures the brightness of a point source at a known position by a least
 * squares fit of a PSF template amplitude, using only valid pixels under the
 * template. The result is in the same units as the template scale, i.e. the
 * peak surface brightness of an unocculted source.
 *
 * @author hci
 */
public final class FluxMeasurement {

    private FluxMeasurement() {
    }

    /**
     * @param frame One residual image, row by row
     * @param nAxis1 Row length
     * @param nAxis2 Number of rows
     * @param position Source position in pixels
     * @param template The expected source shape for unit brightness, centered
     * on its middle pixel
     * @return The fitted amplitude, or NaN if no valid pixel overlaps the
     * template
     */
    public static double amplitude(double[] frame, int nAxis1, int nAxis2, Point2D position, double[][] template) {
        Psfs.checkStamp(template);
        int n = template.length;
        double c = (n - 1) / 2.;
        double px = position.getX();
        double py = position.getY();
        int x0 = Math.max(0, (int) Math.floor(px - c));
        int x1 = Math.min(nAxis1 - 1, (int) Math.ceil(px + c));
        int y0 = Math.max(0, (int) Math.floor(py - c));
        int y1 = Math.min(nAxis2 - 1, (int) Math.ceil(py + c));
        double md = 0;
        double mm = 0;
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                double d = frame[y * nAxis1 + x];
                if (Double.isNaN(d)) {
                    continue;
                }
                double m = Psfs.sample(template, x - px + c, y - py + c);
                md += m * d;
                mm += m * m;
            }
        }
        return mm > 0 ? md / mm : Double.NaN;
    }
}
