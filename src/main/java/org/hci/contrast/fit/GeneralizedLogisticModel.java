package org.hci.contrast.fit;

import java.util.Arrays;
import java.util.Optional;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.hci.contrast.ShapeException;
import org.hci.contrast.store.Artifact;
import org.hci.contrast.store.ArtifactCodec;

/**
 * Generalized logistic throughput curve
 * <pre>
 *   f(s) = b + A / (1 + exp(-k (s - s0)))^nu
 * </pre>
 * with parameters <code>[A, b, nu, k, s0]</code>. Throughput is low close to
 * the star, where self subtraction dominates, and levels off at
 * <code>A + b</code> far away.
 *
 * @author hci
 */
public class GeneralizedLogisticModel implements ThroughputModel {

    public static final int N_PARAMETERS = 5;

    /**
     * Stored as a single row holding the parameters.
     */
    public static final ArtifactCodec<GeneralizedLogisticModel> CODEC = new ArtifactCodec<GeneralizedLogisticModel>() {
        @Override
        public Artifact encode(GeneralizedLogisticModel model) {
            return new Artifact(new double[][]{model.getParameters()});
        }

        @Override
        public Optional<GeneralizedLogisticModel> decode(Artifact artifact) {
            if (artifact.getRows() != 1 || artifact.getColumns() != N_PARAMETERS) {
                return Optional.empty();
            }
            return Optional.of(new GeneralizedLogisticModel(artifact.getRow(0)));
        }
    };

    /**
     * The model as a function of separation for the curve fitter.
     */
    static final ParametricUnivariateFunction FUNCTION = new ParametricUnivariateFunction() {
        @Override
        public double value(double s, double... p) {
            return evaluate(s, p);
        }

        @Override
        public double[] gradient(double s, double... p) {
            double a = p[0];
            double nu = p[2];
            double k = p[3];
            double s0 = p[4];
            double e = Math.exp(-k * (s - s0));
            double g = 1 + e;
            double gNu = Math.pow(g, -nu);
            double gNu1 = Math.pow(g, -nu - 1);
            return new double[]{
                gNu,
                1,
                -a * gNu * Math.log(g),
                a * nu * gNu1 * e * (s - s0),
                -a * nu * gNu1 * e * k
            };
        }
    };

    private final double[] parameters;

    /**
     * @param parameters <code>[A, b, nu, k, s0]</code>
     */
    public GeneralizedLogisticModel(double[] parameters) {
        if (parameters.length != N_PARAMETERS) {
            throw new ShapeException("Expected " + N_PARAMETERS + " parameters", new int[]{parameters.length});
        }
        this.parameters = parameters.clone();
    }

    static double evaluate(double s, double[] p) {
        return p[1] + p[0] / Math.pow(1 + Math.exp(-p[3] * (s - p[4])), p[2]);
    }

    @Override
    public double throughput(double separation) {
        return evaluate(separation, parameters);
    }

    @Override
    public double[] getParameters() {
        return parameters.clone();
    }

    @Override
    public String toString() {
        return "GeneralizedLogisticModel{" + Arrays.toString(parameters) + '}';
    }
}
