package org.hci.contrast.fit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.SimpleCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoint;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.hci.contrast.inject.InjectionTable;
import org.hci.contrast.inject.InjectionTrial;

/**
 * Fits a {@link GeneralizedLogisticModel} to the median throughput at each
 * injected separation, using Levenberg-Marquardt least squares.
 *
 * @author hci
 */
public class ThroughputModelFitter {

    private static final Logger LOG = Logger.getLogger(ThroughputModelFitter.class.getName());

    public static final double[] DEFAULT_INITIAL_GUESS = {1., 0., 1., 0.2, 15.};
    public static final int DEFAULT_MAX_ITERATIONS = 1_000;
    public static final int DEFAULT_MIN_SEPARATIONS = 1;

    private final double[] initialGuess;
    private final int maxIterations;
    private final int minSeparations;

    public ThroughputModelFitter() {
        this(DEFAULT_INITIAL_GUESS, DEFAULT_MAX_ITERATIONS);
    }

    public ThroughputModelFitter(double[] initialGuess, int maxIterations) {
        this(initialGuess, maxIterations, DEFAULT_MIN_SEPARATIONS);
    }

    /**
     * @param initialGuess Starting parameters <code>[A, b, nu, k, s0]</code>
     * @param maxIterations Iteration limit of the optimizer
     * @param minSeparations Fewest separations with a valid throughput that
     * will be fitted. Fewer separations than parameters still give a model
     * passing through the samples.
     */
    public ThroughputModelFitter(double[] initialGuess, int maxIterations, int minSeparations) {
        if (initialGuess.length != GeneralizedLogisticModel.N_PARAMETERS) {
            throw new IllegalArgumentException("Initial guess needs " + GeneralizedLogisticModel.N_PARAMETERS + " parameters");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (minSeparations <= 0) {
            throw new IllegalArgumentException("minSeparations must be positive: " + minSeparations);
        }
        this.initialGuess = initialGuess.clone();
        this.maxIterations = maxIterations;
        this.minSeparations = minSeparations;
    }

    /**
     * Group the trials by exact separation and take the median throughput of
     * each group, ignoring NaN values. Groups without any valid value are
     * left out.
     *
     * @param table The injection results
     * @return The samples, in increasing separation
     */
    public static List<ThroughputSample> aggregate(InjectionTable table) {
        Map<Double, List<Double>> groups = new TreeMap<>();
        for (InjectionTrial trial : table.getTrials()) {
            double throughput = trial.throughput();
            if (!Double.isNaN(throughput)) {
                groups.computeIfAbsent(trial.getSeparation(), (s) -> new ArrayList<>()).add(throughput);
            }
        }
        List<ThroughputSample> result = new ArrayList<>(groups.size());
        for (Map.Entry<Double, List<Double>> entry : groups.entrySet()) {
            List<Double> values = entry.getValue();
            double[] array = new double[values.size()];
            for (int i = 0; i < array.length; i++) {
                array[i] = values.get(i);
            }
            result.add(new ThroughputSample(entry.getKey(), new Median().evaluate(array), array.length));
        }
        return result;
    }

    /**
     * @param table The injection results
     * @return The fitted model
     * @throws FitDivergenceException If there are fewer separations than
     * the configured minimum or the optimizer does not converge to finite
     * parameters
     */
    public GeneralizedLogisticModel fit(InjectionTable table) throws FitDivergenceException {
        return fit(aggregate(table));
    }

    public GeneralizedLogisticModel fit(List<ThroughputSample> samples) throws FitDivergenceException {
        if (samples.size() < minSeparations) {
            throw new FitDivergenceException("Only " + samples.size() + " separations with valid throughput, need "
                    + minSeparations, null, Double.NaN);
        }
        List<WeightedObservedPoint> observations = new ArrayList<>(samples.size());
        for (ThroughputSample sample : samples) {
            observations.add(new WeightedObservedPoint(1.0, sample.getSeparation(), sample.getThroughput()));
        }
        RecordingFunction function = new RecordingFunction();
        SimpleCurveFitter fitter = SimpleCurveFitter.create(function, initialGuess).withMaxIterations(maxIterations);
        double[] parameters;
        try {
            parameters = fitter.fit(observations);
        } catch (MathIllegalStateException x) {
            double[] last = function.last;
            throw new FitDivergenceException("Throughput fit did not converge", last, rms(observations, last), x);
        }
        for (double p : parameters) {
            if (!Double.isFinite(p)) {
                throw new FitDivergenceException("Throughput fit gave non-finite parameters", parameters, rms(observations, parameters));
            }
        }
        LOG.log(Level.FINE, "Fitted throughput parameters {0}, rms {1}",
                new Object[]{Arrays.toString(parameters), rms(observations, parameters)});
        return new GeneralizedLogisticModel(parameters);
    }

    static double rms(List<WeightedObservedPoint> observations, double[] parameters) {
        if (parameters == null) {
            return Double.NaN;
        }
        double sum = 0;
        for (WeightedObservedPoint point : observations) {
            double r = point.getY() - GeneralizedLogisticModel.evaluate(point.getX(), parameters);
            sum += r * r;
        }
        return Math.sqrt(sum / observations.size());
    }

    public double[] getInitialGuess() {
        return initialGuess.clone();
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getMinSeparations() {
        return minSeparations;
    }

    /**
     * Remembers the last parameters the optimizer evaluated, so they can be
     * reported when it gives up.
     */
    private static class RecordingFunction implements ParametricUnivariateFunction {

        private volatile double[] last;

        @Override
        public double value(double x, double... parameters) {
            last = parameters.clone();
            return GeneralizedLogisticModel.FUNCTION.value(x, parameters);
        }

        @Override
        public double[] gradient(double x, double... parameters) {
            return GeneralizedLogisticModel.FUNCTION.gradient(x, parameters);
        }
    }
}
