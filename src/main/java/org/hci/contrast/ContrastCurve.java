package org.hci.contrast;

import java.util.Arrays;

/**
 * A 5 sigma contrast curve: contrast as a function of separation for one KL
 * mode. Separations are in pixels and increase monotonically; the pixel scale
 * is kept so that the curve can be reported in arcseconds.
 *
 * @author hci
 */
public class ContrastCurve {

    private final double[] separations;
    private final double[] contrasts;
    private final double pixelScale;

    public ContrastCurve(double[] separations, double[] contrasts, double pixelScale) {
        if (separations.length != contrasts.length) {
            throw new ShapeException("Separation and contrast lengths differ: " + separations.length + " vs " + contrasts.length);
        }
        for (int i = 1; i < separations.length; i++) {
            if (!(separations[i] > separations[i - 1])) {
                throw new IllegalArgumentException("Separations must increase: " + Arrays.toString(separations));
            }
        }
        this.separations = separations.clone();
        this.contrasts = contrasts.clone();
        this.pixelScale = pixelScale;
    }

    public int size() {
        return separations.length;
    }

    public double getSeparation(int i) {
        return separations[i];
    }

    public double getContrast(int i) {
        return contrasts[i];
    }

    public double[] getSeparations() {
        return separations.clone();
    }

    /**
     * @return The separations converted to arcseconds
     */
    public double[] getSeparationsArcsec() {
        double[] result = new double[separations.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = separations[i] * pixelScale / 1000.;
        }
        return result;
    }

    public double[] getContrasts() {
        return contrasts.clone();
    }

    public double getPixelScale() {
        return pixelScale;
    }

    /**
     * Linear interpolation of the contrast at a given separation. Separations
     * outside the sampled range give NaN, as do intervals touching a NaN
     * sample.
     *
     * @param separation The separation in pixels
     * @return The interpolated contrast, or NaN
     */
    public double interpolate(double separation) {
        int n = separations.length;
        if (n == 0 || !(separation >= separations[0]) || !(separation <= separations[n - 1])) {
            return Double.NaN;
        }
        int i = Arrays.binarySearch(separations, separation);
        if (i >= 0) {
            return contrasts[i];
        }
        int hi = -i - 1;
        int lo = hi - 1;
        double t = (separation - separations[lo]) / (separations[hi] - separations[lo]);
        return contrasts[lo] + t * (contrasts[hi] - contrasts[lo]);
    }

    @Override
    public String toString() {
        return "ContrastCurve{" + "separations=" + Arrays.toString(separations) + ", contrasts=" + Arrays.toString(contrasts) + '}';
    }
}
