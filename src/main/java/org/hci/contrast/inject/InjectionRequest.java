package org.hci.contrast.inject;

/**
 * The grid of separations and position angles at which companions are
 * injected.
 *
 * @author hci
 */
public class InjectionRequest {

    private final double[] separations;
    private final double[] positionAngles;

    /**
     * @param separations Separations in pixels
     * @param positionAngles Position angles in degrees
     */
    public InjectionRequest(double[] separations, double[] positionAngles) {
        if (separations.length == 0 || positionAngles.length == 0) {
            throw new IllegalArgumentException("At least one separation and one position angle are needed");
        }
        this.separations = separations.clone();
        this.positionAngles = positionAngles.clone();
    }

    public double[] getSeparations() {
        return separations.clone();
    }

    public double[] getPositionAngles() {
        return positionAngles.clone();
    }
}
