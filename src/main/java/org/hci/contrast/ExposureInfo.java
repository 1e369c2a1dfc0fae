package org.hci.contrast;

import java.util.Objects;

/**
 * Per-roll exposure metadata of an observation.
 *
 * @author hci
 */
public class ExposureInfo {

    private final double rollAngle;
    private final double integrationTime;

    /**
     * @param rollAngle The telescope roll angle (ROLL_REF) in degrees
     * @param integrationTime The total integration time (NINTS x EFFINTTM) in
     * seconds
     */
    public ExposureInfo(double rollAngle, double integrationTime) {
        if (!Double.isFinite(rollAngle) || !(integrationTime >= 0) || Double.isInfinite(integrationTime)) {
            throw new IllegalArgumentException("Invalid exposure: roll=" + rollAngle + " time=" + integrationTime);
        }
        this.rollAngle = rollAngle;
        this.integrationTime = integrationTime;
    }

    public double getRollAngle() {
        return rollAngle;
    }

    public double getIntegrationTime() {
        return integrationTime;
    }

    @Override
    public String toString() {
        return "ExposureInfo{" + "roll=" + rollAngle + ", time=" + integrationTime + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 41 * hash + Double.hashCode(rollAngle);
        hash = 41 * hash + Double.hashCode(integrationTime);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ExposureInfo other = (ExposureInfo) obj;
        return Double.compare(rollAngle, other.rollAngle) == 0
                && Double.compare(integrationTime, other.integrationTime) == 0;
    }
}
