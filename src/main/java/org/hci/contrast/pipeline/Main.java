package org.hci.contrast.pipeline;

import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.hci.contrast.ScenarioConfig;
import org.hci.contrast.catalog.ObservationCatalog;
import org.hci.contrast.catalog.PropertiesObservationCatalog;
import org.hci.contrast.engine.ImageCombinationEngine;
import org.hci.contrast.psf.CachingPsfProvider;
import org.hci.contrast.psf.PsfProvider;
import org.hci.contrast.store.FitsArtifactStore;

/**
 * Runs the configured batch. The only argument is a properties file
 * overriding <code>contrast.properties</code>. The PSF provider and the image
 * combination engine are found with {@link ServiceLoader}.
 *
 * @author hci
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws IOException {
        if (args.length != 1) {
            System.err.println("Usage: Main <config.properties>");
            System.exit(2);
        }
        ContrastConfig config = ContrastConfig.load(new File(args[0]));
        ObservationCatalog catalog = new PropertiesObservationCatalog(config.getCatalogFile());
        List<String> datasets = config.getDatasets().isEmpty() ? catalog.getDatasetKeys() : config.getDatasets();
        List<ScenarioConfig> scenarios = ScenarioConfig.expand(config.getModes(), config.getAnnuli(), config.getSubsections(), datasets);

        CachingPsfProvider psfProvider = new CachingPsfProvider(service(PsfProvider.class));
        ImageCombinationEngine engine = service(ImageCombinationEngine.class);
        ExecutorService trialExecutor = Executors.newFixedThreadPool(config.getWorkers());
        ExecutorService scenarioExecutor = Executors.newFixedThreadPool(config.getScenarioWorkers());
        try {
            ContrastPipeline pipeline = new ContrastPipeline(config, new FitsDatasetLoader(config.getInputDir(), catalog),
                    psfProvider, engine, new FitsArtifactStore(config.getOutputDir()), trialExecutor);
            LOG.log(Level.INFO, "Processing {0} scenarios", scenarios.size());
            BatchReport report = pipeline.runAll(scenarios, scenarioExecutor);
            psfProvider.report();
            System.out.println(report);
            if (!report.isSuccessful()) {
                System.exit(1);
            }
        } finally {
            scenarioExecutor.shutdown();
            trialExecutor.shutdown();
        }
    }

    private static <T> T service(Class<T> type) {
        Iterator<T> iterator = ServiceLoader.load(type).iterator();
        if (!iterator.hasNext()) {
            throw new IllegalStateException("No " + type.getSimpleName() + " found on the class path");
        }
        return iterator.next();
    }
}
