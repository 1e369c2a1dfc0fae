package org.hci.contrast.inject;

/**
 * The outcome of injecting one synthetic companion and measuring it again.
 *
 * @author hci
 */
public class InjectionTrial {

    private final double separation;
    private final double positionAngle;
    private final double injectedFlux;
    private final double recoveredFlux;

    public InjectionTrial(double separation, double positionAngle, double injectedFlux, double recoveredFlux) {
        this.separation = separation;
        this.positionAngle = positionAngle;
        this.injectedFlux = injectedFlux;
        this.recoveredFlux = recoveredFlux;
    }

    public double getSeparation() {
        return separation;
    }

    public double getPositionAngle() {
        return positionAngle;
    }

    public double getInjectedFlux() {
        return injectedFlux;
    }

    public double getRecoveredFlux() {
        return recoveredFlux;
    }

    /**
     * @return The fraction of the injected flux which was recovered
     */
    public double throughput() {
        return recoveredFlux / injectedFlux;
    }

    @Override
    public String toString() {
        return "InjectionTrial{" + "sep=" + separation + ", pa=" + positionAngle + ", injected=" + injectedFlux + ", recovered=" + recoveredFlux + '}';
    }
}
