package org.hci.contrast.store;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.ArrayFuncs;
import nom.tam.util.BufferedFile;
import nom.tam.util.Cursor;
import org.hci.contrast.ScenarioConfig;

/**
 * Stores each artifact as a single image FITS file under
 * <code>&lt;root&gt;/&lt;mode&gt;_annu&lt;A&gt;_subs&lt;S&gt;/CONS/</code>.
 * Files are written to a temporary file first and then moved into place, so a
 * reader sees either the old or the new version.
 *
 * @author hci
 */
public class FitsArtifactStore extends ArtifactStore {

    private static final Logger LOG = Logger.getLogger(FitsArtifactStore.class.getName());
    private static final String SUBDIRECTORY = "CONS";
    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "SIMPLE", "BITPIX", "NAXIS", "NAXIS1", "NAXIS2", "EXTEND", "END",
            "MODE", "ANNULI", "SUBSECTS", "DATASET", "KLINDEX", "QUANTITY"));

    private static final int LOCK_STRIPES = 64;

    private final File root;
    // writers of the same file share a stripe, the number of locks is fixed
    private final Object[] locks = new Object[LOCK_STRIPES];

    public FitsArtifactStore(File root) {
        this.root = root;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    public File getFile(ArtifactKey key) {
        ScenarioConfig scenario = key.getScenario();
        File dir = new File(new File(root, scenario.getDirectoryName()), SUBDIRECTORY);
        return new File(dir, key.getFileName());
    }

    @Override
    public Optional<Artifact> load(ArtifactKey key) throws IOException {
        File file = getFile(key);
        if (!file.exists()) {
            return Optional.empty();
        }
        try (Fits fits = new Fits(file)) {
            BasicHDU<?> hdu = fits.readHDU();
            if (hdu == null) {
                throw new IOException("No HDU in " + file);
            }
            Object kernel = hdu.getKernel();
            int[] shape = ArrayFuncs.getDimensions(kernel);
            if (shape.length != 2) {
                throw new IOException("Expected a 2 dimensional image in " + file + ", got " + Arrays.toString(shape));
            }
            double[][] data = (double[][]) ArrayFuncs.convertArray(kernel, double.class);
            return Optional.of(new Artifact(data, readKeywords(hdu.getHeader())));
        } catch (FitsException x) {
            throw new IOException("Error reading " + file, x);
        }
    }

    private static Map<String, Object> readKeywords(Header header) {
        Map<String, Object> keywords = new LinkedHashMap<>();
        Cursor<String, HeaderCard> cursor = header.iterator();
        while (cursor.hasNext()) {
            HeaderCard card = cursor.next();
            String key = card.getKey();
            if (key == null || RESERVED.contains(key) || card.getValue() == null) {
                continue;
            }
            keywords.put(key, card.getValue());
        }
        return keywords;
    }

    @Override
    public void save(ArtifactKey key, Artifact artifact) throws IOException {
        if (artifact.getColumns() == 0) {
            throw new IOException("Cannot store empty artifact " + key);
        }
        File file = getFile(key);
        Path target = file.toPath();
        synchronized (locks[Math.floorMod(target.hashCode(), LOCK_STRIPES)]) {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), file.getName(), ".tmp");
            try {
                write(key, artifact, temp.toFile());
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                LOG.log(Level.FINE, "Wrote {0}", file);
            } finally {
                Files.deleteIfExists(temp);
            }
        }
    }

    private static void write(ArtifactKey key, Artifact artifact, File file) throws IOException {
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(artifact.getData());
            Header header = hdu.getHeader();
            ScenarioConfig scenario = key.getScenario();
            header.addValue("QUANTITY", key.getName(), "Stored quantity");
            header.addValue("MODE", scenario.getMode(), "KLIP mode");
            header.addValue("ANNULI", scenario.getAnnuli(), "Number of annuli");
            header.addValue("SUBSECTS", scenario.getSubsections(), "Number of subsections");
            header.addValue("DATASET", scenario.getDatasetKey(), "Dataset key");
            header.addValue("KLINDEX", key.getKlIndex(), "KL mode index, -1 for all");
            for (Map.Entry<String, Object> entry : artifact.getKeywords().entrySet()) {
                addKeyword(header, entry.getKey(), entry.getValue());
            }
            fits.addHDU(hdu);
            try (BufferedFile bf = new BufferedFile(file, "rw")) {
                fits.write(bf);
            }
        } catch (FitsException x) {
            throw new IOException("Error writing " + key, x);
        }
    }

    private static void addKeyword(Header header, String key, Object value) throws FitsException {
        if (RESERVED.contains(key)) {
            throw new IllegalArgumentException("Reserved keyword: " + key);
        }
        if (value instanceof Boolean) {
            header.addValue(key, (Boolean) value, null);
        } else if (value instanceof Integer || value instanceof Long) {
            header.addValue(key, ((Number) value).longValue(), null);
        } else if (value instanceof Number) {
            header.addValue(key, ((Number) value).doubleValue(), null);
        } else {
            header.addValue(key, String.valueOf(value), null);
        }
    }
}
