package org.hci.contrast.fit;

import org.hci.contrast.ContrastException;

/**
 * The throughput fit did not converge. Carries the last parameter estimate
 * and its RMS residual so the failure can be inspected.
 *
 * @author hci
 */
public class FitDivergenceException extends ContrastException {

    private static final long serialVersionUID = 1L;

    private final double[] lastParameters;
    private final double rms;

    public FitDivergenceException(String message, double[] lastParameters, double rms, Throwable cause) {
        super(message, cause);
        this.lastParameters = lastParameters == null ? null : lastParameters.clone();
        this.rms = rms;
    }

    public FitDivergenceException(String message, double[] lastParameters, double rms) {
        this(message, lastParameters, rms, null);
    }

    /**
     * @return The last parameters tried, or <code>null</code> if the fit was
     * never started
     */
    public double[] getLastParameters() {
        return lastParameters == null ? null : lastParameters.clone();
    }

    public double getRms() {
        return rms;
    }
}
