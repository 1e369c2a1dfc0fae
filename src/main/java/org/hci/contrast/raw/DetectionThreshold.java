package org.hci.contrast.raw;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;

/**
 * Number of standard deviations a signal must exceed to be detected at a
 * given Gaussian confidence. When only a few independent resolution elements
 * are available (close to the inner working angle) the Student t distribution
 * is used instead (Mawet et al. 2014), which inflates the threshold.
 *
 * @author hci
 */
public class DetectionThreshold {

    private final double sigma;
    private final int smallSampleLimit;
    private final double falsePositiveFraction;

    /**
     * @param sigma The Gaussian confidence, e.g. 5
     * @param smallSampleLimit Below this number of independent elements the
     * small sample correction is applied
     */
    public DetectionThreshold(double sigma, int smallSampleLimit) {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("sigma must be positive: " + sigma);
        }
        this.sigma = sigma;
        this.smallSampleLimit = smallSampleLimit;
        this.falsePositiveFraction = 1. - new NormalDistribution().cumulativeProbability(sigma);
    }

    /**
     * @param nElements Number of independent resolution elements at the
     * separation
     * @return The threshold in units of the measured standard deviation
     */
    public double multiplier(int nElements) {
        if (nElements >= smallSampleLimit) {
            return sigma;
        }
        int n = Math.max(nElements, 2);
        TDistribution t = new TDistribution(n - 1);
        return t.inverseCumulativeProbability(1. - falsePositiveFraction) * Math.sqrt(1. + 1. / n);
    }

    public double getSigma() {
        return sigma;
    }

    public double getFalsePositiveFraction() {
        return falsePositiveFraction;
    }
}
