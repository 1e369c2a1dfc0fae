package org.hci.contrast;

/**
 * An inclusive range of position angles ("pizza slice"), in degrees East of
 * North.
 *
 * @author hci
 */
public class PositionAngleRange {

    private final double low;
    private final double high;

    public PositionAngleRange(double low, double high) {
        if (!(low <= high) || low < 0 || high > 360) {
            throw new IllegalArgumentException("Invalid position angle range [" + low + ", " + high + "]");
        }
        this.low = low;
        this.high = high;
    }

    public double getLow() {
        return low;
    }

    public double getHigh() {
        return high;
    }

    public boolean contains(double positionAngle) {
        return positionAngle >= low && positionAngle <= high;
    }

    /**
     * Parse a range written as <code>low:high</code>
     *
     * @param text The text to parse
     * @return The range
     */
    public static PositionAngleRange parse(String text) {
        String[] parts = text.trim().split("\\s*:\\s*");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid position angle range: " + text);
        }
        return new PositionAngleRange(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]));
    }

    @Override
    public String toString() {
        return "[" + low + ", " + high + "]";
    }
}
