package org.hci.contrast.fit;

/**
 * Fraction of a companion's flux which survives PSF subtraction, as a
 * function of separation.
 *
 * @author hci
 */
public interface ThroughputModel {

    /**
     * @param separation Separation in pixels
     * @return The modelled throughput, not clamped to [0,1]
     */
    double throughput(double separation);

    double[] getParameters();
}
