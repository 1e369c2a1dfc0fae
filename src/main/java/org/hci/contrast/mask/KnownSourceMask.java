package org.hci.contrast.mask;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.hci.contrast.KnownSource;
import org.hci.contrast.ResidualCube;

/**
 * Masks a disk around each known companion, in every frame of the cube.
 *
 * @author hci
 */
public class KnownSourceMask implements PixelMask {

    private static final Logger LOG = Logger.getLogger(KnownSourceMask.class.getName());

    private final double pixelScale;
    private final Point2D.Double center;
    private final double radius;
    private final List<KnownSource> sources;

    /**
     * @param pixelScale Pixel scale in mas/pixel
     * @param center Host star position in pixels
     * @param radius Mask radius in pixels, typically 12 FWHM
     * @param sources The companions to mask
     */
    public KnownSourceMask(double pixelScale, Point2D center, double radius, List<KnownSource> sources) {
        if (!(radius > 0) || Double.isInfinite(radius)) {
            throw new IllegalArgumentException("Mask radius must be positive and finite: " + radius);
        }
        if (!(pixelScale > 0) || Double.isInfinite(pixelScale)) {
            throw new IllegalArgumentException("Invalid pixel scale: " + pixelScale);
        }
        this.pixelScale = pixelScale;
        this.center = new Point2D.Double(center.getX(), center.getY());
        this.radius = radius;
        this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
    }

    @Override
    public ResidualCube apply(ResidualCube cube) {
        double[] data = cube.copyData();
        int nAxis1 = cube.getNAxis1();
        int nAxis2 = cube.getNAxis2();
        int frameSize = nAxis1 * nAxis2;
        double r2 = radius * radius;
        for (KnownSource source : sources) {
            Point2D.Double p = source.pixelPosition(pixelScale, center);
            LOG.log(Level.FINE, "Masking {0} at pixel ({1}, {2})", new Object[]{source, p.x, p.y});
            int x0 = Math.max(0, (int) Math.floor(p.x - radius));
            int x1 = Math.min(nAxis1 - 1, (int) Math.ceil(p.x + radius));
            int y0 = Math.max(0, (int) Math.floor(p.y - radius));
            int y1 = Math.min(nAxis2 - 1, (int) Math.ceil(p.y + radius));
            for (int y = y0; y <= y1; y++) {
                double dy = y - p.y;
                for (int x = x0; x <= x1; x++) {
                    double dx = x - p.x;
                    if (dx * dx + dy * dy <= r2) {
                        int offset = y * nAxis1 + x;
                        for (int frame = 0; frame < cube.getNFrames(); frame++) {
                            data[frame * frameSize + offset] = Double.NaN;
                        }
                    }
                }
            }
        }
        return cube.withData(data);
    }

    public double getRadius() {
        return radius;
    }

    public List<KnownSource> getSources() {
        return sources;
    }
}
