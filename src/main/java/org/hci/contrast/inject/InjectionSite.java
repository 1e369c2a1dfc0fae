package org.hci.contrast.inject;

import java.awt.geom.Point2D;
import org.hci.contrast.SkyGeometry;

/**
 * Where and how bright a synthetic companion is injected.
 *
 * @author hci
 */
public class InjectionSite {

    private final double separation;
    private final double positionAngle;
    private final double flux;

    /**
     * @param separation Separation in pixels
     * @param positionAngle Position angle in degrees East of North
     * @param flux Peak surface brightness of the companion, in the units of
     * the data
     */
    public InjectionSite(double separation, double positionAngle, double flux) {
        this.separation = separation;
        this.positionAngle = positionAngle;
        this.flux = flux;
    }

    public double getSeparation() {
        return separation;
    }

    public double getPositionAngle() {
        return positionAngle;
    }

    public double getFlux() {
        return flux;
    }

    /**
     * @return The offset from the star in a North up image, in pixels
     */
    public Point2D.Double offset() {
        return SkyGeometry.offset(separation, positionAngle);
    }

    public double distance(InjectionSite other) {
        return offset().distance(other.offset());
    }

    @Override
    public String toString() {
        return "InjectionSite{" + "sep=" + separation + ", pa=" + positionAngle + ", flux=" + flux + '}';
    }
}
