package org.hci.contrast.calibrate;

import org.hci.contrast.ContrastCurve;
import org.hci.contrast.fit.ThroughputModel;

/**
 * Corrects a raw contrast curve for the throughput of the PSF subtraction.
 *
 * @author hci
 */
public final class ContrastCalibrator {

    private ContrastCalibrator() {
    }

    /**
     * Divide the raw contrast by the modelled throughput at each separation.
     * Zero throughput gives an infinite (or NaN) contrast rather than an
     * error.
     *
     * @param raw The raw curve
     * @param model The throughput model
     * @return The calibrated curve, on the same separations as the raw curve
     */
    public static ContrastCurve calibrate(ContrastCurve raw, ThroughputModel model) {
        double[] separations = raw.getSeparations();
        double[] contrasts = raw.getContrasts();
        double[] calibrated = new double[contrasts.length];
        for (int i = 0; i < contrasts.length; i++) {
            calibrated[i] = contrasts[i] / model.throughput(separations[i]);
        }
        return new ContrastCurve(separations, calibrated, raw.getPixelScale());
    }
}
