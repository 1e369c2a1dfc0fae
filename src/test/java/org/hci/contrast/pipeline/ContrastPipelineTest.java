package org.hci.contrast.pipeline;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.Random;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.hci.contrast.ContrastCurve;
import org.hci.contrast.ContrastException;
import org.hci.contrast.Dataset;
import org.hci.contrast.ExposureInfo;
import org.hci.contrast.ResidualCube;
import org.hci.contrast.RollImage;
import org.hci.contrast.ScenarioConfig;
import org.hci.contrast.ScenarioFailedException;
import org.hci.contrast.catalog.CatalogEntry;
import org.hci.contrast.engine.MeanCombinationEngine;
import org.hci.contrast.fit.GeneralizedLogisticModel;
import org.hci.contrast.inject.InjectionRecoveryHarness;
import org.hci.contrast.inject.InjectionTable;
import org.hci.contrast.inject.InjectionTrial;
import org.hci.contrast.psf.GaussianPsfProvider;
import org.hci.contrast.store.ArtifactKey;
import org.hci.contrast.store.MemoryArtifactStore;
import org.junit.After;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Before;
import org.junit.Test;

/**
 *
 * @author hci
 */
public class ContrastPipelineTest {

    private static final int SIZE = 65;
    private static final GeneralizedLogisticModel TRUE_THROUGHPUT = new GeneralizedLogisticModel(new double[]{1., 0., 1., Math.log(4.) / 5., 15.});

    private ExecutorService trialExecutor;
    private ExecutorService scenarioExecutor;
    private MemoryArtifactStore store;
    private MeanCombinationEngine engine;

    @Before
    public void setUp() {
        trialExecutor = Executors.newFixedThreadPool(4);
        scenarioExecutor = Executors.newFixedThreadPool(2);
        store = new MemoryArtifactStore();
        engine = new MeanCombinationEngine(TRUE_THROUGHPUT::throughput, 0);
    }

    @After
    public void tearDown() {
        trialExecutor.shutdownNow();
        scenarioExecutor.shutdownNow();
    }

    static ContrastConfig config() throws IOException {
        Properties props = new Properties();
        props.setProperty("innerWorkingAngle", "4");
        props.setProperty("outerWorkingAngle", "30");
        props.setProperty("injection.round.separations", "6, 8, 10, 12, 14, 16, 18, 20, 22, 24");
        props.setProperty("injection.round.positionAngles", "0, 180");
        return new ContrastConfig(props);
    }

    static Dataset dataset(String key) {
        Point2D.Double center = new Point2D.Double(32, 32);
        List<ExposureInfo> exposures = Arrays.asList(new ExposureInfo(0, 100), new ExposureInfo(0, 100));
        CatalogEntry entry = new CatalogEntry(key, 60., center, "F356W", "MASK335R", exposures, 6., 261., 3.56e-6,
                Collections.<String>emptyList());
        Random random = new Random(1);
        double[] noise = new double[2 * SIZE * SIZE];
        for (int i = 0; i < noise.length; i++) {
            noise[i] = random.nextGaussian();
        }
        ResidualCube residuals = new ResidualCube(2, SIZE, SIZE, noise, 60., center, "F356W", "MASK335R", exposures, new int[]{5, 10});
        RollImage roll1 = new RollImage(SIZE, SIZE, new double[SIZE * SIZE], center, exposures.get(0));
        RollImage roll2 = new RollImage(SIZE, SIZE, new double[SIZE * SIZE], center, exposures.get(1));
        return new Dataset(entry, residuals, Arrays.asList(roll1, roll2));
    }

    private ContrastPipeline pipeline(ContrastConfig config) {
        return pipeline(config, trialExecutor);
    }

    private ContrastPipeline pipeline(ContrastConfig config, Executor executor) {
        DatasetLoader loader = (ScenarioConfig scenario) -> {
            if (scenario.getDatasetKey().startsWith("BAD")) {
                throw new IOException("Missing residuals for " + scenario.getDatasetKey());
            }
            return dataset(scenario.getDatasetKey());
        };
        return new ContrastPipeline(config, loader, new GaussianPsfProvider(), engine, store, executor);
    }

    @Test
    public void testRawContrast() throws IOException, ContrastException {
        ContrastPipeline pipeline = pipeline(config());
        ScenarioConfig scenario = new ScenarioConfig("ADI+RDI", 1, 1, "OBS_1");
        List<ContrastCurve> curves = pipeline.rawContrast(scenario);
        assertEquals(2, curves.size());
        assertEquals(6, curves.get(0).size());
        for (double contrast : curves.get(1).getContrasts()) {
            assertTrue(contrast > 0 && Double.isFinite(contrast));
        }
        assertTrue(store.load(new ArtifactKey(scenario, ContrastPipeline.RAW_CURVES)).isPresent());
        assertEquals(1, store.size());
    }

    @Test
    public void testCalibratedContrast() throws IOException, ContrastException {
        ContrastPipeline pipeline = pipeline(config());
        ScenarioConfig scenario = new ScenarioConfig("ADI+RDI", 1, 1, "OBS_1");
        ContrastCurve calibrated = pipeline.calibratedContrast(scenario, -1);
        ContrastCurve raw = pipeline.rawContrast(scenario).get(1);
        assertEquals(raw.size(), calibrated.size());

        GeneralizedLogisticModel model = GeneralizedLogisticModel.CODEC.decode(
                store.load(new ArtifactKey(scenario, ContrastPipeline.THROUGHPUT_MODEL, 1)).get()).get();
        assertEquals(0.8, model.throughput(20.), 0.02);
        for (int i = 0; i < raw.size(); i++) {
            assertEquals(raw.getSeparation(i), calibrated.getSeparation(i), 0);
            assertEquals(raw.getContrast(i) / model.throughput(raw.getSeparation(i)), calibrated.getContrast(i), 1e-15);
        }
        assertTrue(store.load(new ArtifactKey(scenario, InjectionRecoveryHarness.ARTIFACT_NAME, 1)).isPresent());
        assertTrue(store.load(new ArtifactKey(scenario, ContrastPipeline.CALIBRATED_CURVE, 1)).isPresent());

        int calls = engine.getCalls();
        assertTrue(calls > 0);
        ContrastCurve again = pipeline(config()).calibratedContrast(scenario, 1);
        assertEquals(calls, engine.getCalls());
        assertEquals(calibrated.getContrast(0), again.getContrast(0), 0);
    }

    @Test
    public void testRunAllIsolatesFailures() throws IOException {
        ContrastPipeline pipeline = pipeline(config());
        List<ScenarioConfig> scenarios = ScenarioConfig.expand(Arrays.asList("ADI+RDI"), Arrays.asList(1), Arrays.asList(1),
                Arrays.asList("OBS_1", "BAD_1", "OBS_2"));
        BatchReport report = pipeline.runAll(scenarios, scenarioExecutor);
        assertFalse(report.isSuccessful());
        assertEquals(2, report.getSuccesses().size());
        assertEquals(1, report.getFailures().size());
        Throwable failure = report.getFailures().get(scenarios.get(1));
        assertTrue(failure instanceof IOException);
        assertTrue(report.toString().contains("BAD_1"));
    }

    @Test
    public void testCancelledScenarioStoresNothingDownstream() throws IOException, ContrastException {
        ExecutorService serial = Executors.newSingleThreadExecutor();
        try {
            ContrastPipeline pipeline = pipeline(config(), serial);
            ScenarioConfig scenario = new ScenarioConfig("ADI+RDI", 1, 1, "OBS_1");
            engine.atCall(2, pipeline::cancel);
            try {
                pipeline.calibratedContrast(scenario, -1);
                fail("Cancelled scenario produced a curve");
            } catch (ScenarioFailedException x) {
                assertTrue(x.getMessage().contains("cancelled"));
            }
            assertEquals(2, engine.getCalls());
            assertFalse(store.load(new ArtifactKey(scenario, ContrastPipeline.THROUGHPUT_MODEL, 1)).isPresent());
            assertFalse(store.load(new ArtifactKey(scenario, ContrastPipeline.CALIBRATED_CURVE, 1)).isPresent());
            ArtifactKey tableKey = new ArtifactKey(scenario, InjectionRecoveryHarness.ARTIFACT_NAME, 1);
            assertFalse(InjectionTable.CODEC.decode(store.load(tableKey).get()).isPresent());

            // the same pipeline resumes after the cancellation
            ContrastCurve calibrated = pipeline.calibratedContrast(scenario, -1);
            assertTrue(engine.getCalls() > 2);
            assertTrue(InjectionTable.CODEC.decode(store.load(tableKey).get()).get().isComplete());
            assertTrue(store.load(new ArtifactKey(scenario, ContrastPipeline.CALIBRATED_CURVE, 1)).isPresent());
            assertTrue(calibrated.size() > 0);
        } finally {
            serial.shutdownNow();
        }
    }

    @Test
    public void testChangedInjectionTableInvalidatesModel() throws IOException, ContrastException {
        ScenarioConfig scenario = new ScenarioConfig("ADI+RDI", 1, 1, "OBS_1");
        ContrastCurve calibrated = pipeline(config()).calibratedContrast(scenario, 1);
        int calls = engine.getCalls();

        ArtifactKey tableKey = new ArtifactKey(scenario, InjectionRecoveryHarness.ARTIFACT_NAME, 1);
        InjectionTable table = InjectionTable.CODEC.decode(store.load(tableKey).get()).get();
        List<InjectionTrial> halved = new ArrayList<>();
        for (InjectionTrial trial : table.getTrials()) {
            halved.add(new InjectionTrial(trial.getSeparation(), trial.getPositionAngle(), trial.getInjectedFlux(),
                    trial.getRecoveredFlux() / 2));
        }
        store.save(tableKey, InjectionTable.CODEC.encode(new InjectionTable(halved, true)));

        ContrastCurve recalibrated = pipeline(config()).calibratedContrast(scenario, 1);
        assertEquals(calls, engine.getCalls());
        GeneralizedLogisticModel model = GeneralizedLogisticModel.CODEC.decode(
                store.load(new ArtifactKey(scenario, ContrastPipeline.THROUGHPUT_MODEL, 1)).get()).get();
        assertEquals(0.4, model.throughput(20.), 0.02);
        assertEquals(2 * calibrated.getContrast(3), recalibrated.getContrast(3), 0.1 * calibrated.getContrast(3));
    }
}
