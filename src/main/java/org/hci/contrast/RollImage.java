package org.hci.contrast;

import java.awt.geom.Point2D;

/**
 * One science image taken at a given telescope roll, in detector
 * orientation. These are the frames fed to the image combination engine.
 *
 * @author hci
 */
public class RollImage {

    private final int nAxis1;
    private final int nAxis2;
    private final double[] data;
    private final Point2D.Double center;
    private final ExposureInfo exposure;

    public RollImage(int nAxis2, int nAxis1, double[] data, Point2D center, ExposureInfo exposure) {
        if (nAxis1 <= 0 || nAxis2 <= 0 || data.length != nAxis1 * nAxis2) {
            throw new ShapeException("Image data of length " + data.length + " does not match", new int[]{nAxis2, nAxis1});
        }
        this.nAxis1 = nAxis1;
        this.nAxis2 = nAxis2;
        this.data = data.clone();
        this.center = new Point2D.Double(center.getX(), center.getY());
        this.exposure = exposure;
    }

    public int getNAxis1() {
        return nAxis1;
    }

    public int getNAxis2() {
        return nAxis2;
    }

    public double get(int x, int y) {
        return data[y * nAxis1 + x];
    }

    public double[] copyData() {
        return data.clone();
    }

    public Point2D.Double getCenter() {
        return new Point2D.Double(center.x, center.y);
    }

    public ExposureInfo getExposure() {
        return exposure;
    }

    public RollImage withData(double[] newData) {
        return new RollImage(nAxis2, nAxis1, newData, center, exposure);
    }

    @Override
    public String toString() {
        return "RollImage{" + nAxis1 + "x" + nAxis2 + ", center=" + center + ", exposure=" + exposure + '}';
    }
}
