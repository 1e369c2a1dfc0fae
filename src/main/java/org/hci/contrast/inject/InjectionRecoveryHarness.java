package org.hci.contrast.inject;

import java.awt.geom.Point2D;
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
import org.hci.contrast.ResidualCube;
import org.hci.contrast.RollImage;
import org.hci.contrast.ScenarioConfig;
import org.hci.contrast.ScenarioFailedException;
import org.hci.contrast.SkyGeometry;
import org.hci.contrast.engine.CombinationException;
import org.hci.contrast.engine.ImageCombinationEngine;
import org.hci.contrast.psf.PsfProvider;
import org.hci.contrast.store.ArtifactKey;
import org.hci.contrast.store.ArtifactStore;

/**
 * Measures how much of a companion's flux survives PSF subtraction by
 * injecting synthetic companions into the science frames, re-running the
 * image combination and measuring them again.
 * <p>
 * Trials are independent and run concurrently on the supplied executor. A
 * trial whose combination fails is dropped and logged; if the dropped sites
 * exceed the allowed fraction of the planned sites the whole scenario fails.
 * The table is cached in the artifact store, so a second run with
 * <code>overwrite == false</code> does no work.
 *
 * @author hci
 */
public class InjectionRecoveryHarness {

    private static final Logger LOG = Logger.getLogger(InjectionRecoveryHarness.class.getName());

    /**
     * Name of the stored injection table.
     */
    public static final String ARTIFACT_NAME = "flux_all";

    private final PsfProvider psfProvider;
    private final ImageCombinationEngine engine;
    private final ArtifactStore store;
    private final Executor executor;
    private final double maxFailureFraction;
    private final AtomicReference<AtomicBoolean> cancellation = new AtomicReference<>(new AtomicBoolean(false));

    /**
     * @param psfProvider Source of offset PSFs
     * @param engine The image combination engine
     * @param store Where injection tables are stored
     * @param executor Runs the trials
     * @param maxFailureFraction Largest tolerated fraction of sites lost to
     * failed trials
     */
    public InjectionRecoveryHarness(PsfProvider psfProvider, ImageCombinationEngine engine, ArtifactStore store,
            Executor executor, double maxFailureFraction) {
        if (!(maxFailureFraction >= 0 && maxFailureFraction <= 1)) {
            throw new IllegalArgumentException("Failure fraction must be in [0,1]: " + maxFailureFraction);
        }
        this.psfProvider = psfProvider;
        this.engine = engine;
        this.store = store;
        this.executor = executor;
        this.maxFailureFraction = maxFailureFraction;
    }

    /**
     * Inject and recover companions for one scenario and KL mode.
     *
     * @param scenario The scenario
     * @param dataset The data of the scenario
     * @param klIndex Index of the KL mode frame in the residual cube
     * @param planner Chooses the sites and their brightness
     * @param rawCurve The raw contrast curve of the same KL mode
     * @param request The separations and position angles to try
     * @param referencePeak Peak of the unocculted PSF
     * @param overwrite If <code>true</code> ignore any stored table
     * @return The table of trials
     * @throws IOException If PSFs or the stored table cannot be read or
     * written
     * @throws ScenarioFailedException If nothing can be injected or too many
     * trials fail
     * @throws ContrastException For other processing failures
     */
    public InjectionTable run(ScenarioConfig scenario, Dataset dataset, int klIndex, InjectionPlanner planner,
            ContrastCurve rawCurve, InjectionRequest request, double referencePeak, boolean overwrite) throws IOException, ContrastException {
        ResidualCube residuals = dataset.getResiduals();
        if (klIndex < 0 || klIndex >= residuals.getNFrames()) {
            throw new IllegalArgumentException("KL index " + klIndex + " out of range for " + residuals);
        }
        ArtifactKey key = new ArtifactKey(scenario, ARTIFACT_NAME, klIndex);
        AtomicBoolean cancelled = cancellation.get();
        return store.getOrCompute(key, overwrite, InjectionTable.CODEC, () -> {
            List<List<InjectionSite>> trials = planner.plan(rawCurve, request);
            if (trials.isEmpty()) {
                throw new ScenarioFailedException("No injection site survived planning for " + scenario);
            }
            int klMode = residuals.getKlModes()[klIndex];
            CompanionInjector injector = new CompanionInjector(psfProvider, residuals.getFilter(), residuals.getMask(), referencePeak);
            return runTrials(scenario, dataset, klMode, injector, trials, cancelled);
        });
    }

    private InjectionTable runTrials(ScenarioConfig scenario, Dataset dataset, int klMode, CompanionInjector injector,
            List<List<InjectionSite>> trials, AtomicBoolean cancelled) throws IOException, ContrastException {
        long start = System.nanoTime();
        List<CompletableFuture<List<InjectionTrial>>> futures = new ArrayList<>(trials.size());
        for (List<InjectionSite> sites : trials) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                if (cancelled.get()) {
                    return null;
                }
                try {
                    return runTrial(scenario, dataset, klMode, injector, sites);
                } catch (IOException | ContrastException x) {
                    throw new CompletionException(x);
                }
            }, executor));
        }
        LOG.log(Level.INFO, "Waiting for {0} injection trials of {1}", new Object[]{futures.size(), scenario});
        // wait for every trial, failures are examined one by one below
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[futures.size()])).exceptionally((x) -> null).join();

        List<InjectionTrial> rows = new ArrayList<>();
        int planned = 0;
        int failed = 0;
        boolean complete = true;
        for (int i = 0; i < futures.size(); i++) {
            int nSites = trials.get(i).size();
            planned += nSites;
            try {
                List<InjectionTrial> result = futures.get(i).join();
                if (result == null) {
                    complete = false;
                } else {
                    rows.addAll(result);
                }
            } catch (CompletionException x) {
                Throwable cause = x.getCause();
                if (cause instanceof CombinationException) {
                    LOG.log(Level.WARNING, "Injection trial " + i + " of " + scenario + " failed, dropping " + nSites + " sites", cause);
                    failed += nSites;
                } else if (cause instanceof IOException) {
                    throw (IOException) cause;
                } else if (cause instanceof ContrastException) {
                    throw (ContrastException) cause;
                } else {
                    throw new IOException("Unexpected exception during injection trial", cause);
                }
            }
        }
        if (failed > maxFailureFraction * planned) {
            throw new ScenarioFailedException(String.format("%d of %d injected sites failed for %s", failed, planned, scenario));
        }
        if (!complete) {
            LOG.log(Level.WARNING, "Injection for {0} was cancelled, result is incomplete", scenario);
        }
        LOG.log(Level.INFO, "Injection for {0}: {1} trials, {2} sites recovered, {3} failed in {4}ms",
                new Object[]{scenario, trials.size(), rows.size(), failed, (System.nanoTime() - start) / 1_000_000});
        return new InjectionTable(rows, complete);
    }

    private List<InjectionTrial> runTrial(ScenarioConfig scenario, Dataset dataset, int klMode, CompanionInjector injector,
            List<InjectionSite> sites) throws IOException, CombinationException {
        List<RollImage> frames = dataset.getScienceFrames();
        List<RollImage> injected = injector.inject(frames, sites);
        ResidualCube combined = engine.combine(scenario, injected, new int[]{klMode});
        if (combined.getNFrames() != 1) {
            throw new CombinationException("Expected one frame for KL mode " + klMode + ", got " + combined.getNFrames());
        }
        double[] frame = combined.getFrame(0);
        Point2D.Double center = combined.getCenter();
        List<InjectionTrial> result = new ArrayList<>(sites.size());
        for (InjectionSite site : sites) {
            double[][] template = injector.template(frames, site);
            Point2D.Double position = SkyGeometry.position(center, site.getSeparation(), site.getPositionAngle());
            double recovered = FluxMeasurement.amplitude(frame, combined.getNAxis1(), combined.getNAxis2(), position, template);
            if (Double.isNaN(recovered)) {
                LOG.log(Level.FINE, "No valid pixels at {0}", site);
            }
            result.add(new InjectionTrial(site.getSeparation(), site.getPositionAngle(), site.getFlux(), recovered));
        }
        return result;
    }

    /**
     * Stop starting new trials in every run in progress. Trials already
     * running complete, and the tables of those runs are stored as
     * incomplete. Runs started after this call are not affected.
     */
    public void cancel() {
        cancellation.getAndSet(new AtomicBoolean(false)).set(true);
        LOG.info("Injection runs in progress cancelled");
    }
}
