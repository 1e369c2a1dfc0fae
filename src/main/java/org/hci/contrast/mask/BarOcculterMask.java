package org.hci.contrast.mask;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.hci.contrast.PositionAngleRange;
import org.hci.contrast.ResidualCube;
import org.hci.contrast.SkyGeometry;

/**
 * Keeps only the azimuthal sectors ("pizza slices") which are unobstructed by
 * a bar occulter. Everything else is invalidated, so the slices supplied must
 * already account for the bar position in every roll. With no slices the
 * whole field is invalid.
 *
 * @author hci
 */
public class BarOcculterMask implements PixelMask {

    private final Point2D.Double center;
    private final List<PositionAngleRange> ranges;

    public BarOcculterMask(Point2D center, List<PositionAngleRange> ranges) {
        this.center = new Point2D.Double(center.getX(), center.getY());
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
    }

    @Override
    public ResidualCube apply(ResidualCube cube) {
        double[] original = cube.copyData();
        double[] data = new double[original.length];
        Arrays.fill(data, Double.NaN);
        int nAxis1 = cube.getNAxis1();
        int nAxis2 = cube.getNAxis2();
        int frameSize = nAxis1 * nAxis2;
        for (int y = 0; y < nAxis2; y++) {
            for (int x = 0; x < nAxis1; x++) {
                if (isUnobstructed(x - center.x, y - center.y)) {
                    int offset = y * nAxis1 + x;
                    for (int frame = 0; frame < cube.getNFrames(); frame++) {
                        data[frame * frameSize + offset] = original[frame * frameSize + offset];
                    }
                }
            }
        }
        return cube.withData(data);
    }

    /**
     * @param dx Offset from the star along x (pixels)
     * @param dy Offset from the star along y (pixels)
     * @return <code>true</code> if the position angle lies in one of the
     * slices
     */
    public boolean isUnobstructed(double dx, double dy) {
        return isUnobstructed(SkyGeometry.positionAngle(dx, dy));
    }

    public boolean isUnobstructed(double positionAngle) {
        for (PositionAngleRange range : ranges) {
            if (range.contains(positionAngle)) {
                return true;
            }
        }
        return false;
    }

    public List<PositionAngleRange> getRanges() {
        return ranges;
    }
}
