package org.hci.contrast;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import nom.tam.util.ArrayFuncs;

/**
 * A stack of KLIP residual images, one frame per KL mode truncation, in
 * surface brightness units (MJy/sr). Pixel data is stored frame by frame,
 * row by row, as in a FITS image with NAXIS3 frames of NAXIS2 rows of NAXIS1
 * pixels. Invalid pixels are NaN.
 *
 * @author hci
 */
public class ResidualCube {

    private final int nFrames;
    private final int nAxis1;
    private final int nAxis2;
    private final double[] data;
    private final double pixelScale;
    private final Point2D.Double center;
    private final String filter;
    private final String mask;
    private final List<ExposureInfo> exposures;
    private final int[] klModes;

    public ResidualCube(int nFrames, int nAxis2, int nAxis1, double[] data, double pixelScale, Point2D center,
            String filter, String mask, List<ExposureInfo> exposures, int[] klModes) {
        if (nFrames <= 0 || nAxis1 <= 0 || nAxis2 <= 0) {
            throw new ShapeException("Residual cube must have 3 non-empty dimensions", new int[]{nFrames, nAxis2, nAxis1});
        }
        if (data.length != nFrames * nAxis1 * nAxis2) {
            throw new ShapeException("Data length " + data.length + " does not match", new int[]{nFrames, nAxis2, nAxis1});
        }
        if (!(pixelScale > 0) || Double.isInfinite(pixelScale)) {
            throw new IllegalArgumentException("Invalid pixel scale: " + pixelScale);
        }
        if (!Double.isFinite(center.getX()) || !Double.isFinite(center.getY())) {
            throw new IllegalArgumentException("Non-finite center: " + center);
        }
        if (klModes != null && klModes.length != nFrames) {
            throw new ShapeException("Expected " + nFrames + " KL modes", klModes);
        }
        this.nFrames = nFrames;
        this.nAxis1 = nAxis1;
        this.nAxis2 = nAxis2;
        this.data = data.clone();
        this.pixelScale = pixelScale;
        this.center = new Point2D.Double(center.getX(), center.getY());
        this.filter = filter;
        this.mask = mask;
        this.exposures = exposures == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(exposures));
        this.klModes = klModes == null ? defaultKlModes(nFrames) : klModes.clone();
    }

    /**
     * Create a cube from a multi-dimensional primitive array, as returned by
     * nom.tam.fits for an image HDU.
     *
     * @param array An array of rank 3 (frame, y, x) of any primitive type
     * @param pixelScale Pixel scale in mas/pixel
     * @param center Star position in pixels
     * @param filter The filter name, may be null
     * @param mask The coronagraphic mask name, may be null
     * @param exposures Per roll exposures, may be null
     * @param klModes The KL mode of each frame, or null
     * @return The new cube
     * @throws ShapeException if the array does not have exactly 3 dimensions
     */
    public static ResidualCube fromArray(Object array, double pixelScale, Point2D center, String filter, String mask,
            List<ExposureInfo> exposures, int[] klModes) {
        if (array == null || !array.getClass().isArray()) {
            throw new ShapeException("Residual cube data must be an array");
        }
        int[] shape = ArrayFuncs.getDimensions(array);
        if (shape.length != 3) {
            throw new ShapeException("Residual cube must have exactly 3 dimensions (frame, y, x)", shape);
        }
        double[][][] cube = (double[][][]) ArrayFuncs.convertArray(array, double.class);
        int nFrames = shape[0];
        int nAxis2 = shape[1];
        int nAxis1 = shape[2];
        double[] flat = new double[nFrames * nAxis2 * nAxis1];
        int p = 0;
        for (double[][] frame : cube) {
            if (frame.length != nAxis2) {
                throw new ShapeException("Ragged residual cube", shape);
            }
            for (double[] row : frame) {
                if (row.length != nAxis1) {
                    throw new ShapeException("Ragged residual cube", shape);
                }
                System.arraycopy(row, 0, flat, p, nAxis1);
                p += nAxis1;
            }
        }
        return new ResidualCube(nFrames, nAxis2, nAxis1, flat, pixelScale, center, filter, mask, exposures, klModes);
    }

    public static ResidualCube fromArray(Object array, double pixelScale, Point2D center) {
        return fromArray(array, pixelScale, center, null, null, null, null);
    }

    private static int[] defaultKlModes(int nFrames) {
        int[] result = new int[nFrames];
        for (int i = 0; i < nFrames; i++) {
            result[i] = i + 1;
        }
        return result;
    }

    /**
     * Create a cube with the same metadata and new pixel data.
     *
     * @param newData The pixel data, in the same layout as this cube
     * @return The new cube
     */
    public ResidualCube withData(double[] newData) {
        return new ResidualCube(nFrames, nAxis2, nAxis1, newData, pixelScale, center, filter, mask, exposures, klModes);
    }

    /**
     * @return A copy of the pixel data
     */
    public double[] copyData() {
        return data.clone();
    }

    public double get(int frame, int x, int y) {
        return data[index(frame, x, y)];
    }

    public int index(int frame, int x, int y) {
        return (frame * nAxis2 + y) * nAxis1 + x;
    }

    /**
     * @param frame The frame index
     * @return A copy of one frame, row by row
     */
    public double[] getFrame(int frame) {
        if (frame < 0 || frame >= nFrames) {
            throw new IndexOutOfBoundsException("Frame " + frame + " of " + nFrames);
        }
        int size = nAxis1 * nAxis2;
        return Arrays.copyOfRange(data, frame * size, (frame + 1) * size);
    }

    public int getNFrames() {
        return nFrames;
    }

    public int getNAxis1() {
        return nAxis1;
    }

    public int getNAxis2() {
        return nAxis2;
    }

    public int[] getShape() {
        return new int[]{nFrames, nAxis2, nAxis1};
    }

    public double getPixelScale() {
        return pixelScale;
    }

    public Point2D.Double getCenter() {
        return new Point2D.Double(center.x, center.y);
    }

    public String getFilter() {
        return filter;
    }

    public String getMask() {
        return mask;
    }

    public List<ExposureInfo> getExposures() {
        return exposures;
    }

    public int[] getKlModes() {
        return klModes.clone();
    }

    @Override
    public String toString() {
        return "ResidualCube{" + "shape=" + Arrays.toString(getShape()) + ", pixelScale=" + pixelScale
                + ", center=" + center + ", filter=" + filter + ", mask=" + mask + '}';
    }
}
