package org.hci.contrast.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.hci.contrast.ContrastCurve;
import org.hci.contrast.ContrastException;
import org.hci.contrast.Dataset;
import org.hci.contrast.PositionAngleRange;
import org.hci.contrast.ResidualCube;
import org.hci.contrast.ScenarioConfig;
import org.hci.contrast.ScenarioFailedException;
import org.hci.contrast.calibrate.ContrastCalibrator;
import org.hci.contrast.catalog.CatalogEntry;
import org.hci.contrast.engine.ImageCombinationEngine;
import org.hci.contrast.fit.GeneralizedLogisticModel;
import org.hci.contrast.inject.InjectionPlanner;
import org.hci.contrast.inject.InjectionRecoveryHarness;
import org.hci.contrast.inject.InjectionTable;
import org.hci.contrast.mask.PixelMasks;
import org.hci.contrast.psf.PsfProvider;
import org.hci.contrast.psf.Psfs;
import org.hci.contrast.raw.DetectionThreshold;
import org.hci.contrast.raw.FluxCalibration;
import org.hci.contrast.raw.RawContrastEstimator;
import org.hci.contrast.store.ArtifactKey;
import org.hci.contrast.store.ArtifactStore;
import org.hci.contrast.store.DerivedArtifactCodec;

/**
 * Computes raw and calibrated contrast curves for scenarios, storing every
 * intermediate product so that repeated runs only do missing work.
 *
 * @author hci
 */
public class ContrastPipeline {

    private static final Logger LOG = Logger.getLogger(ContrastPipeline.class.getName());

    static final String RAW_CURVES = "cons";
    static final String THROUGHPUT_MODEL = "pp";
    static final String CALIBRATED_CURVE = "cons_cal";

    private final ContrastConfig config;
    private final DatasetLoader loader;
    private final PsfProvider psfProvider;
    private final ArtifactStore store;
    private final InjectionRecoveryHarness harness;
    private final AtomicReference<AtomicBoolean> batchCancellation = new AtomicReference<>(new AtomicBoolean(false));

    /**
     * @param config Tuning and batch settings
     * @param loader Provides scenario inputs
     * @param psfProvider Source of PSFs
     * @param engine The image combination engine
     * @param store Where products are stored
     * @param trialExecutor Runs injection trials
     */
    public ContrastPipeline(ContrastConfig config, DatasetLoader loader, PsfProvider psfProvider,
            ImageCombinationEngine engine, ArtifactStore store, Executor trialExecutor) {
        this.config = config;
        this.loader = loader;
        this.psfProvider = psfProvider;
        this.store = store;
        this.harness = new InjectionRecoveryHarness(psfProvider, engine, store, trialExecutor, config.getMaxTrialFailureFraction());
    }

    /**
     * @param scenario The scenario
     * @return One raw contrast curve per KL mode
     * @throws IOException If inputs or products cannot be read or written
     * @throws ContrastException If the curve cannot be computed
     */
    public List<ContrastCurve> rawContrast(ScenarioConfig scenario) throws IOException, ContrastException {
        return rawContrast(scenario, loader.load(scenario));
    }

    private List<ContrastCurve> rawContrast(ScenarioConfig scenario, Dataset dataset) throws IOException, ContrastException {
        ArtifactKey key = new ArtifactKey(scenario, RAW_CURVES);
        return store.getOrCompute(key, config.isOverwrite(), ContrastCurveCodec.CURVES, () -> {
            CatalogEntry entry = dataset.getEntry();
            ResidualCube cube = dataset.getResiduals();
            double pixelScale = cube.getPixelScale();
            double fwhm = entry.fwhm(config.getTelescopeDiameter());
            PixelMasks masks = PixelMasks.forObservation(pixelScale, cube.getCenter(), config.getCompanionMaskFwhm() * fwhm,
                    config.getKnownSources(), barRanges(cube));
            DetectionThreshold threshold = new DetectionThreshold(config.getSigma(), config.getSmallSampleLimit());
            RawContrastEstimator estimator = new RawContrastEstimator(normalization(dataset), threshold);
            List<ContrastCurve> curves = estimator.estimate(masks.apply(cube), pixelScale, config.getInnerWorkingAngle(),
                    config.getOuterWorkingAngle(), config.getResolutionFwhm() * fwhm, cube.getCenter());
            if (curves.get(0).size() == 0) {
                throw new ContrastException("No separations fit between the working angles for " + scenario);
            }
            LOG.log(Level.INFO, "Computed {0} raw contrast curves for {1}", new Object[]{curves.size(), scenario});
            return curves;
        });
    }

    /**
     * @param scenario The scenario
     * @param klIndex Index of the KL mode, negative values count from the
     * last mode
     * @return The calibrated contrast curve of that KL mode
     * @throws IOException If inputs or products cannot be read or written
     * @throws ContrastException If injection, fitting or any earlier step
     * fails
     */
    public ContrastCurve calibratedContrast(ScenarioConfig scenario, int klIndex) throws IOException, ContrastException {
        Dataset dataset = loader.load(scenario);
        int nModes = dataset.getResiduals().getNFrames();
        int index = klIndex < 0 ? nModes + klIndex : klIndex;
        if (index < 0 || index >= nModes) {
            throw new IllegalArgumentException("KL index " + klIndex + " out of range for " + nModes + " modes");
        }
        boolean overwrite = config.isOverwrite();
        ContrastCurve raw = rawContrast(scenario, dataset).get(index);
        InjectionTable table = injectionRecovery(scenario, dataset, index, raw);
        if (!table.isComplete()) {
            throw new ScenarioFailedException("Injection for " + scenario + " was cancelled before all trials ran");
        }
        // the model and the calibrated curve are reused only while their inputs are unchanged
        GeneralizedLogisticModel model = store.getOrCompute(new ArtifactKey(scenario, THROUGHPUT_MODEL, index), overwrite,
                new DerivedArtifactCodec<>(GeneralizedLogisticModel.CODEC, InjectionTable.CODEC.encode(table)),
                () -> config.getFitter().fit(table));
        LOG.log(Level.INFO, "Throughput model for {0} KL index {1}: {2}", new Object[]{scenario, index, model});
        return store.getOrCompute(new ArtifactKey(scenario, CALIBRATED_CURVE, index), overwrite,
                new DerivedArtifactCodec<>(ContrastCurveCodec.SINGLE, ContrastCurveCodec.SINGLE.encode(raw), GeneralizedLogisticModel.CODEC.encode(model)),
                () -> ContrastCalibrator.calibrate(raw, model));
    }

    private InjectionTable injectionRecovery(ScenarioConfig scenario, Dataset dataset, int klIndex, ContrastCurve raw) throws IOException, ContrastException {
        CatalogEntry entry = dataset.getEntry();
        ResidualCube cube = dataset.getResiduals();
        List<PositionAngleRange> bar = barRanges(cube);
        double fwhm = entry.fwhm(config.getTelescopeDiameter());
        InjectionPlanner planner = new InjectionPlanner(normalization(dataset), config.getInjectionContrastFactor(),
                config.getInjectionExclusionFwhm() * fwhm, cube.getPixelScale(), config.getKnownSources(), bar);
        return harness.run(scenario, dataset, klIndex, planner, raw, config.getInjectionRequest(bar != null),
                referencePeak(dataset), config.isOverwrite());
    }

    /**
     * Calibrate every scenario, several at a time. A failing scenario is
     * recorded in the report and does not stop the others.
     *
     * @param scenarios The scenarios to process
     * @param scenarioExecutor Runs the scenarios; must not be the executor
     * used for injection trials
     * @return The report
     */
    public BatchReport runAll(List<ScenarioConfig> scenarios, Executor scenarioExecutor) {
        int klIndex = config.getKlIndex();
        AtomicBoolean cancelled = batchCancellation.get();
        List<CompletableFuture<ContrastCurve>> futures = new ArrayList<>(scenarios.size());
        for (ScenarioConfig scenario : scenarios) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    if (cancelled.get()) {
                        throw new ScenarioFailedException("Batch cancelled before " + scenario + " started");
                    }
                    return calibratedContrast(scenario, klIndex);
                } catch (IOException | ContrastException x) {
                    throw new CompletionException(x);
                }
            }, scenarioExecutor));
        }
        BatchReport report = new BatchReport();
        for (int i = 0; i < futures.size(); i++) {
            ScenarioConfig scenario = scenarios.get(i);
            try {
                report.addSuccess(scenario, futures.get(i).join());
            } catch (CompletionException x) {
                Throwable cause = x.getCause() == null ? x : x.getCause();
                LOG.log(Level.WARNING, "Scenario " + scenario + " failed", cause);
                report.addFailure(scenario, cause);
            }
        }
        LOG.log(Level.INFO, "Batch done: {0}", report);
        return report;
    }

    /**
     * Cancel the work in progress: batches start no further scenarios and
     * injection runs start no further trials. Scenarios in progress fail and
     * store incomplete injection tables, which later runs recompute. Work
     * started after this call is not affected.
     */
    public void cancel() {
        batchCancellation.getAndSet(new AtomicBoolean(false)).set(true);
        harness.cancel();
    }

    private List<PositionAngleRange> barRanges(ResidualCube cube) {
        return config.isBarMask(cube.getMask()) ? config.getBarRanges() : null;
    }

    /**
     * Peak of the unocculted PSF as seen in the combined image.
     */
    double referencePeak(Dataset dataset) throws IOException {
        ResidualCube cube = dataset.getResiduals();
        double[][] psf = Psfs.recenterPeak(psfProvider.offsetPsf(cube.getFilter(), cube.getMask(), null));
        return Psfs.peak(Psfs.rollAverage(psf, dataset.getEntry().getExposures()));
    }

    double normalization(Dataset dataset) throws IOException {
        CatalogEntry entry = dataset.getEntry();
        return FluxCalibration.normalization(entry.getZeroPoint(), entry.getHostMagnitude(), referencePeak(dataset),
                dataset.getResiduals().getPixelScale());
    }
}
