package org.hci.contrast;

import java.awt.geom.Point2D;

/**
 * Conversions between pixel offsets and (separation, position angle) pairs.
 * Position angles are measured in degrees East of North, with North up and
 * East to the left of the image.
 *
 * @author hci
 */
public final class SkyGeometry {

    /**
     * Milli-arcseconds per radian
     */
    public static final double RAD2MAS = 180. / Math.PI * 3600. * 1000.;

    private SkyGeometry() {
    }

    /**
     * @param dx Offset along x (pixels)
     * @param dy Offset along y (pixels)
     * @return The position angle in [0,360)
     */
    public static double positionAngle(double dx, double dy) {
        double pa = Math.toDegrees(-Math.atan2(dx, dy)) % 360.;
        return pa < 0 ? pa + 360. : pa + 0.;
    }

    /**
     * @param separation Separation in pixels
     * @param positionAngle Position angle in degrees
     * @return The pixel offset (dx, dy) from the star
     */
    public static Point2D.Double offset(double separation, double positionAngle) {
        double theta = Math.toRadians(positionAngle);
        return new Point2D.Double(-separation * Math.sin(theta), separation * Math.cos(theta));
    }

    /**
     * Position of a companion relative to a given center.
     */
    public static Point2D.Double position(Point2D center, double separation, double positionAngle) {
        Point2D.Double offset = offset(separation, positionAngle);
        return new Point2D.Double(center.getX() + offset.x, center.getY() + offset.y);
    }

    /**
     * Diffraction limited FWHM (lambda/D) in pixels.
     *
     * @param wavelength Wavelength in meters
     * @param diameter Telescope diameter in meters
     * @param pixelScale Pixel scale in mas/pixel
     * @return The FWHM in pixels
     */
    public static double fwhm(double wavelength, double diameter, double pixelScale) {
        return wavelength / diameter * RAD2MAS / pixelScale;
    }
}
