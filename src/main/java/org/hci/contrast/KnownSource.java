package org.hci.contrast;

import java.awt.geom.Point2D;

/**
 * A confirmed companion, given as an offset from the host star in
 * milli-arcseconds. RA increases to the left (East), Dec upwards (North).
 *
 * @author hci
 */
public class KnownSource {

    private final double raOffset;
    private final double decOffset;

    public KnownSource(double raOffset, double decOffset) {
        if (!Double.isFinite(raOffset) || !Double.isFinite(decOffset)) {
            throw new IllegalArgumentException("Non-finite source offset: " + raOffset + ", " + decOffset);
        }
        this.raOffset = raOffset;
        this.decOffset = decOffset;
    }

    public double getRaOffset() {
        return raOffset;
    }

    public double getDecOffset() {
        return decOffset;
    }

    /**
     * Project the source onto the pixel grid.
     *
     * @param pixelScale The pixel scale in mas/pixel
     * @param center The position of the host star in pixels
     * @return The pixel position of the source
     */
    public Point2D.Double pixelPosition(double pixelScale, Point2D center) {
        return new Point2D.Double(center.getX() - raOffset / pixelScale, center.getY() + decOffset / pixelScale);
    }

    @Override
    public String toString() {
        return "KnownSource{" + "ra=" + raOffset + ", dec=" + decOffset + '}';
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 53 * hash + Double.hashCode(raOffset);
        hash = 53 * hash + Double.hashCode(decOffset);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final KnownSource other = (KnownSource) obj;
        return Double.compare(raOffset, other.raOffset) == 0 && Double.compare(decOffset, other.decOffset) == 0;
    }
}
