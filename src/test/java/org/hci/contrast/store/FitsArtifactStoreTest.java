package org.hci.contrast.store;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.hci.contrast.ContrastException;
import org.hci.contrast.ScenarioConfig;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 *
 * @author hci
 */
public class FitsArtifactStoreTest {

    private static final ScenarioConfig SCENARIO = new ScenarioConfig("RDI", 2, 3, "OBS_7");

    private static final ArtifactCodec<double[]> ROW = new ArtifactCodec<double[]>() {
        @Override
        public Artifact encode(double[] value) {
            return new Artifact(new double[][]{value});
        }

        @Override
        public Optional<double[]> decode(Artifact artifact) {
            return Optional.of(artifact.getRow(0));
        }
    };

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testSaveAndLoad() throws IOException {
        FitsArtifactStore store = new FitsArtifactStore(folder.getRoot());
        ArtifactKey key = new ArtifactKey(SCENARIO, "pp", 2);
        assertFalse(store.load(key).isPresent());

        Map<String, Object> keywords = new LinkedHashMap<>();
        keywords.put("COMPLETE", false);
        keywords.put("NROWS", 3);
        keywords.put("PIXSCALE", 63.5);
        keywords.put("NOTE", "hello");
        store.save(key, new Artifact(new double[][]{{1, 2, 3}, {4, 5, Double.NaN}}, keywords));

        File file = store.getFile(key);
        assertEquals(new File(new File(new File(folder.getRoot(), "RDI_annu2_subs3"), "CONS"), "OBS_7-pp-KL2.fits"), file);
        assertTrue(file.exists());

        Artifact artifact = store.load(key).get();
        assertEquals(2, artifact.getRows());
        assertEquals(3, artifact.getColumns());
        assertArrayEquals(new double[]{1, 2, 3}, artifact.getRow(0), 0);
        assertTrue(Double.isNaN(artifact.getRow(1)[2]));
        assertFalse(artifact.getBoolean("COMPLETE", true));
        assertEquals(3., artifact.getDouble("NROWS", 0), 0);
        assertEquals(63.5, artifact.getDouble("PIXSCALE", 0), 0);
        assertEquals("hello", artifact.getString("NOTE"));
        assertFalse(artifact.hasKeyword("QUANTITY"));
    }

    @Test
    public void testReplace() throws IOException {
        FitsArtifactStore store = new FitsArtifactStore(folder.getRoot());
        ArtifactKey key = new ArtifactKey(SCENARIO, "cons");
        store.save(key, new Artifact(new double[][]{{1, 2}}));
        store.save(key, new Artifact(new double[][]{{3, 4, 5}}));
        assertArrayEquals(new double[]{3, 4, 5}, store.load(key).get().getRow(0), 0);
        assertEquals("OBS_7-cons.fits", store.getFile(key).getName());
        // no temporary files left behind
        assertEquals(1, store.getFile(key).getParentFile().list().length);
    }

    @Test
    public void testEmptyArtifact() {
        FitsArtifactStore store = new FitsArtifactStore(folder.getRoot());
        try {
            store.save(new ArtifactKey(SCENARIO, "cons"), new Artifact(new double[][]{{}}));
            fail("Empty artifact stored");
        } catch (IOException x) {
            // expected
        }
    }

    @Test
    public void testUnreadableArtifactIsRecomputed() throws IOException, ContrastException {
        FitsArtifactStore store = new FitsArtifactStore(folder.getRoot());
        ArtifactKey key = new ArtifactKey(SCENARIO, "cons");
        File file = store.getFile(key);
        file.getParentFile().mkdirs();
        StringBuilder junk = new StringBuilder();
        while (junk.length() < 2880) {
            junk.append("not a FITS file ");
        }
        Files.write(file.toPath(), junk.toString().getBytes(StandardCharsets.US_ASCII));

        AtomicInteger computed = new AtomicInteger();
        double[] value = store.getOrCompute(key, false, ROW, () -> {
            computed.incrementAndGet();
            return new double[]{7, 8};
        });
        assertArrayEquals(new double[]{7, 8}, value, 0);
        assertEquals(1, computed.get());
        assertArrayEquals(new double[]{7, 8}, store.load(key).get().getRow(0), 0);

        value = store.getOrCompute(key, false, ROW, () -> {
            computed.incrementAndGet();
            return new double[]{9};
        });
        assertArrayEquals(new double[]{7, 8}, value, 0);
        assertEquals(1, computed.get());
    }

    @Test
    public void testMemoryStore() throws IOException, ContrastException {
        MemoryArtifactStore store = new MemoryArtifactStore();
        ArtifactKey key = new ArtifactKey(SCENARIO, "cons");
        store.getOrCompute(key, false, ROW, () -> new double[]{1});
        double[] value = store.getOrCompute(key, true, ROW, () -> new double[]{2});
        assertArrayEquals(new double[]{2}, value, 0);
        assertEquals(1, store.size());
    }

    @Test
    public void testConcurrentSaves() throws Exception {
        FitsArtifactStore store = new FitsArtifactStore(folder.getRoot());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                double value = i;
                ArtifactKey key = new ArtifactKey(SCENARIO, "pp", i % 10);
                futures.add(executor.submit(() -> {
                    store.save(key, ROW.encode(new double[]{value, value}));
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }
        for (int k = 0; k < 10; k++) {
            double[] row = ROW.decode(store.load(new ArtifactKey(SCENARIO, "pp", k)).get()).get();
            assertEquals(k, row[0] % 10, 0);
            assertEquals(row[0], row[1], 0);
        }
        File dir = store.getFile(new ArtifactKey(SCENARIO, "pp", 0)).getParentFile();
        assertEquals(10, dir.list().length);
    }

    @Test
    public void testDerivedArtifactFollowsInputs() throws IOException, ContrastException {
        FitsArtifactStore store = new FitsArtifactStore(folder.getRoot());
        ArtifactKey key = new ArtifactKey(SCENARIO, "cons_cal", 0);
        Artifact input = new Artifact(new double[][]{{1, 2, Double.NaN}, {4, 5, 6}});
        AtomicInteger computations = new AtomicInteger();
        ArtifactComputation<double[]> computation = () -> {
            computations.incrementAndGet();
            return new double[]{7, 8};
        };
        store.getOrCompute(key, false, new DerivedArtifactCodec<>(ROW, input), computation);
        store.getOrCompute(key, false, new DerivedArtifactCodec<>(ROW, new Artifact(input.getData())), computation);
        assertEquals(1, computations.get());
        assertEquals(input.fingerprint(), store.load(key).get().getString(DerivedArtifactCodec.INPUTS));

        Artifact changed = new Artifact(new double[][]{{1, 2, Double.NaN}, {4, 5, 6.5}});
        assertFalse(input.fingerprint().equals(changed.fingerprint()));
        store.getOrCompute(key, false, new DerivedArtifactCodec<>(ROW, changed), computation);
        assertEquals(2, computations.get());
    }
}
