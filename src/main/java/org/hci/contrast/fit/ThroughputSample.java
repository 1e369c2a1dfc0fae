package org.hci.contrast.fit;

/**
 * Median throughput of the trials at one separation.
 *
 * @author hci
 */
public class ThroughputSample {

    private final double separation;
    private final double throughput;
    private final int count;

    public ThroughputSample(double separation, double throughput, int count) {
        this.separation = separation;
        this.throughput = throughput;
        this.count = count;
    }

    public double getSeparation() {
        return separation;
    }

    public double getThroughput() {
        return throughput;
    }

    /**
     * @return Number of valid trials contributing to the median
     */
    public int getCount() {
        return count;
    }

    @Override
    public String toString() {
        return "ThroughputSample{" + "sep=" + separation + ", throughput=" + throughput + ", n=" + count + '}';
    }
}
