package org.hci.contrast.fit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.hci.contrast.inject.InjectionTable;
import org.hci.contrast.inject.InjectionTrial;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

/**
 *
 * @author hci
 */
public class ThroughputModelFitterTest {

    private static final double[] TRUE_PARAMETERS = {1., 0., 1., Math.log(4.) / 5., 15.};

    private static InjectionTable logisticTable() {
        GeneralizedLogisticModel truth = new GeneralizedLogisticModel(TRUE_PARAMETERS);
        List<InjectionTrial> trials = new ArrayList<>();
        for (double sep = 4; sep <= 40; sep += 4) {
            for (double pa = 0; pa < 360; pa += 90) {
                trials.add(new InjectionTrial(sep, pa, 10., 10. * truth.throughput(sep)));
            }
        }
        return new InjectionTable(trials, true);
    }

    @Test
    public void testTrueModel() {
        GeneralizedLogisticModel truth = new GeneralizedLogisticModel(TRUE_PARAMETERS);
        assertEquals(0.8, truth.throughput(20.), 1e-12);
        assertEquals(0.5, truth.throughput(15.), 1e-12);
    }

    @Test
    public void testFitRecoversThroughput() throws FitDivergenceException {
        GeneralizedLogisticModel model = new ThroughputModelFitter().fit(logisticTable());
        assertEquals(0.8, model.throughput(20.), 1e-3);
        for (double sep = 4; sep <= 40; sep += 1) {
            assertEquals(new GeneralizedLogisticModel(TRUE_PARAMETERS).throughput(sep), model.throughput(sep), 1e-3);
        }
    }

    @Test
    public void testAggregate() {
        List<InjectionTrial> trials = new ArrayList<>();
        trials.add(new InjectionTrial(10, 0, 2., 1.));
        trials.add(new InjectionTrial(10, 90, 2., 1.4));
        trials.add(new InjectionTrial(10, 180, 2., 0.2));
        trials.add(new InjectionTrial(10, 270, 2., Double.NaN));
        trials.add(new InjectionTrial(5, 0, 1., 0.1));
        trials.add(new InjectionTrial(7, 0, 1., Double.NaN));
        List<ThroughputSample> samples = ThroughputModelFitter.aggregate(new InjectionTable(trials, true));
        assertEquals(2, samples.size());
        assertEquals(5., samples.get(0).getSeparation(), 0);
        assertEquals(0.1, samples.get(0).getThroughput(), 1e-12);
        assertEquals(10., samples.get(1).getSeparation(), 0);
        assertEquals(0.5, samples.get(1).getThroughput(), 1e-12);
        assertEquals(3, samples.get(1).getCount());
        // the median lies within the range of the group
        assertTrue(samples.get(1).getThroughput() >= 0.1 && samples.get(1).getThroughput() <= 0.7);
    }

    @Test
    public void testDivergence() {
        ThroughputModelFitter fitter = new ThroughputModelFitter(new double[]{5., 3., 4., 2., 100.}, 1);
        try {
            fitter.fit(logisticTable());
            fail("Fit should not converge in one iteration");
        } catch (FitDivergenceException x) {
            assertNotNull(x.getLastParameters());
            assertEquals(GeneralizedLogisticModel.N_PARAMETERS, x.getLastParameters().length);
            assertTrue(x.getRms() > 0);
        }
    }

    @Test
    public void testFewSeparations() throws FitDivergenceException {
        List<InjectionTrial> trials = new ArrayList<>();
        for (double sep = 10; sep <= 30; sep += 10) {
            trials.add(new InjectionTrial(sep, 0, 10., 8.));
            trials.add(new InjectionTrial(sep, 180, 10., 8.));
        }
        GeneralizedLogisticModel model = new ThroughputModelFitter().fit(new InjectionTable(trials, true));
        for (double sep = 10; sep <= 30; sep += 10) {
            assertEquals(0.8, model.throughput(sep), 1e-3);
        }
    }

    @Test
    public void testMinimumSeparations() {
        List<InjectionTrial> trials = new ArrayList<>();
        trials.add(new InjectionTrial(10, 0, 1., 0.5));
        trials.add(new InjectionTrial(20, 0, 1., 0.8));
        ThroughputModelFitter fitter = new ThroughputModelFitter(ThroughputModelFitter.DEFAULT_INITIAL_GUESS,
                ThroughputModelFitter.DEFAULT_MAX_ITERATIONS, 5);
        try {
            fitter.fit(new InjectionTable(trials, true));
            fail("Fitted fewer separations than required");
        } catch (FitDivergenceException x) {
            assertEquals(null, x.getLastParameters());
        }
        try {
            new ThroughputModelFitter().fit(new InjectionTable(new ArrayList<InjectionTrial>(), true));
            fail("Fitted an empty table");
        } catch (FitDivergenceException x) {
            assertTrue(Double.isNaN(x.getRms()));
        }
    }

    @Test
    public void testCodec() {
        GeneralizedLogisticModel model = new GeneralizedLogisticModel(TRUE_PARAMETERS);
        Optional<GeneralizedLogisticModel> decoded = GeneralizedLogisticModel.CODEC.decode(GeneralizedLogisticModel.CODEC.encode(model));
        assertTrue(decoded.isPresent());
        assertArrayEquals(TRUE_PARAMETERS, decoded.get().getParameters(), 0);
    }

    @Test
    public void testGradient() {
        double[] p = {0.9, 0.05, 1.3, 0.25, 12.};
        double[] gradient = GeneralizedLogisticModel.FUNCTION.gradient(14., p);
        for (int i = 0; i < p.length; i++) {
            double h = 1e-6;
            double[] up = p.clone();
            double[] down = p.clone();
            up[i] += h;
            down[i] -= h;
            double numeric = (GeneralizedLogisticModel.evaluate(14., up) - GeneralizedLogisticModel.evaluate(14., down)) / (2 * h);
            assertEquals("parameter " + i, numeric, gradient[i], 1e-6);
        }
    }
}
