package org.hci.contrast.raw;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.hci.contrast.ContrastCurve;
import org.hci.contrast.ResidualCube;

/**
 * Computes the raw contrast curve of each KL mode frame from the azimuthal
 * scatter of the (masked) residuals.
 * <p>
 * Annuli of width <code>resolution</code> are placed from the inner to the
 * outer working angle. At each separation the contrast is the detection
 * threshold times the sample standard deviation of the valid pixels divided
 * by the normalization (the star peak in the same units as the residuals).
 * Separations without at least two valid pixels give NaN.
 *
 * @author hci
 */
public class RawContrastEstimator {

    private static final Logger LOG = Logger.getLogger(RawContrastEstimator.class.getName());

    private final double normalization;
    private final DetectionThreshold threshold;

    /**
     * @param normalization Host star peak in the units of the residual cube,
     * see {@link FluxCalibration#normalization}
     * @param threshold The detection threshold
     */
    public RawContrastEstimator(double normalization, DetectionThreshold threshold) {
        if (!(normalization > 0) || Double.isInfinite(normalization)) {
            throw new IllegalArgumentException("Normalization must be positive and finite: " + normalization);
        }
        this.normalization = normalization;
        this.threshold = threshold;
    }

    /**
     * @param cube The masked residual cube
     * @param pixelScale Pixel scale in mas/pixel
     * @param innerAngle Inner working angle in pixels
     * @param outerAngle Outer working angle in pixels
     * @param resolution Width of one resolution element in pixels, about 2
     * FWHM
     * @param center Host star position in pixels
     * @return One curve per frame of the cube
     */
    public List<ContrastCurve> estimate(ResidualCube cube, double pixelScale, double innerAngle, double outerAngle,
            double resolution, Point2D center) {
        if (!(resolution > 0)) {
            throw new IllegalArgumentException("Resolution must be positive: " + resolution);
        }
        if (!(innerAngle >= 0) || !(outerAngle > innerAngle)) {
            throw new IllegalArgumentException("Invalid working angles: " + innerAngle + ", " + outerAngle);
        }
        double[] separations = separations(innerAngle, outerAngle, resolution);
        List<ContrastCurve> result = new ArrayList<>(cube.getNFrames());
        for (int frame = 0; frame < cube.getNFrames(); frame++) {
            double[] data = cube.getFrame(frame);
            double[] contrasts = new double[separations.length];
            for (int i = 0; i < separations.length; i++) {
                contrasts[i] = contrast(data, cube.getNAxis1(), cube.getNAxis2(), center, separations[i], resolution);
            }
            LOG.log(Level.FINE, "Frame {0}: {1} separations", new Object[]{frame, separations.length});
            result.add(new ContrastCurve(separations, contrasts, pixelScale));
        }
        return result;
    }

    static double[] separations(double innerAngle, double outerAngle, double resolution) {
        List<Double> seps = new ArrayList<>();
        for (int k = 0;; k++) {
            double sep = innerAngle + resolution * (k + 0.5);
            if (sep + resolution / 2. > outerAngle + 1e-9) {
                break;
            }
            seps.add(sep);
        }
        double[] result = new double[seps.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = seps.get(i);
        }
        return result;
    }

    private double contrast(double[] data, int nAxis1, int nAxis2, Point2D center, double separation, double resolution) {
        double[] values = annulus(data, nAxis1, nAxis2, center, separation - resolution / 2., separation + resolution / 2.);
        if (values.length < 2) {
            return Double.NaN;
        }
        double std = new StandardDeviation(true).evaluate(values);
        int nElements = (int) Math.floor(2. * Math.PI * separation / resolution);
        return threshold.multiplier(nElements) * std / normalization;
    }

    /**
     * Collect the valid pixels with rMin &lt;= r &lt; rMax.
     */
    static double[] annulus(double[] data, int nAxis1, int nAxis2, Point2D center, double rMin, double rMax) {
        double cx = center.getX();
        double cy = center.getY();
        int x0 = Math.max(0, (int) Math.floor(cx - rMax));
        int x1 = Math.min(nAxis1 - 1, (int) Math.ceil(cx + rMax));
        int y0 = Math.max(0, (int) Math.floor(cy - rMax));
        int y1 = Math.min(nAxis2 - 1, (int) Math.ceil(cy + rMax));
        double[] buffer = new double[Math.max(0, (x1 - x0 + 1) * (y1 - y0 + 1))];
        int n = 0;
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                double r = Math.hypot(x - cx, y - cy);
                if (r >= rMin && r < rMax) {
                    double v = data[y * nAxis1 + x];
                    if (!Double.isNaN(v)) {
                        buffer[n++] = v;
                    }
                }
            }
        }
        double[] result = new double[n];
        System.arraycopy(buffer, 0, result, 0, n);
        return result;
    }

    public double getNormalization() {
        return normalization;
    }
}
