package org.hci.contrast.engine;

import java.awt.geom.Point2D;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleUnaryOperator;
import org.hci.contrast.ResidualCube;
import org.hci.contrast.RollImage;
import org.hci.contrast.ScenarioConfig;

/**
 * Stands in for KLIP: every requested KL mode is the average of the input
 * frames times a throughput which depends only on the distance from the
 * star. No derotation is done, so the frames used with it should all have
 * roll angle 0. Optionally fails the first few calls, or runs an action
 * when a given call starts.
 *
 * @author hci
 */
public class MeanCombinationEngine implements ImageCombinationEngine {

    private final DoubleUnaryOperator throughput;
    private final int failures;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile int actionCall;
    private volatile Runnable action;

    public MeanCombinationEngine(DoubleUnaryOperator throughput, int failures) {
        this.throughput = throughput;
        this.failures = failures;
    }

    public MeanCombinationEngine(double throughput, int failures) {
        this((r) -> throughput, failures);
    }

    public MeanCombinationEngine(double throughput) {
        this(throughput, 0);
    }

    @Override
    public ResidualCube combine(ScenarioConfig scenario, List<RollImage> frames, int[] klModes) throws CombinationException {
        int call = calls.incrementAndGet();
        if (action != null && call == actionCall) {
            action.run();
        }
        if (call <= failures) {
            throw new CombinationException("Simulated failure for " + scenario);
        }
        RollImage first = frames.get(0);
        int nAxis1 = first.getNAxis1();
        int size = nAxis1 * first.getNAxis2();
        Point2D.Double center = first.getCenter();
        double[] factor = new double[size];
        for (int i = 0; i < size; i++) {
            factor[i] = throughput.applyAsDouble(Math.hypot(i % nAxis1 - center.x, i / nAxis1 - center.y));
        }
        double[] mean = new double[size];
        for (RollImage frame : frames) {
            double[] data = frame.copyData();
            for (int i = 0; i < size; i++) {
                mean[i] += factor[i] * data[i] / frames.size();
            }
        }
        double[] cube = new double[size * klModes.length];
        for (int k = 0; k < klModes.length; k++) {
            System.arraycopy(mean, 0, cube, k * size, size);
        }
        return new ResidualCube(klModes.length, first.getNAxis2(), first.getNAxis1(), cube, 60., first.getCenter(),
                null, null, null, klModes);
    }

    /**
     * @param call The 1-based call which runs the action
     * @param action The action
     */
    public void atCall(int call, Runnable action) {
        this.actionCall = call;
        this.action = action;
    }

    public int getCalls() {
        return calls.get();
    }
}
