package org.hci.contrast.pipeline;

import java.awt.geom.Point2D;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;
import nom.tam.util.ArrayFuncs;
import org.hci.contrast.Dataset;
import org.hci.contrast.ExposureInfo;
import org.hci.contrast.ResidualCube;
import org.hci.contrast.RollImage;
import org.hci.contrast.ScenarioConfig;
import org.hci.contrast.ShapeException;
import org.hci.contrast.catalog.CatalogEntry;
import org.hci.contrast.catalog.ObservationCatalog;

/**
 * Reads scenario inputs from the KLIP output directory tree. The residuals of
 * a scenario are in
 * <code>&lt;inputDir&gt;/&lt;mode&gt;_annu&lt;A&gt;_subs&lt;S&gt;/FITS/&lt;key&gt;-KLmodes-all.fits</code>
 * with the star position in PSFCENTX/PSFCENTY and the KL modes in
 * KLMODE0, KLMODE1, ... The science frames are the files listed in the
 * catalog, relative to the input directory, one per roll.
 *
 * @author hci
 */
public class FitsDatasetLoader implements DatasetLoader {

    private static final Logger LOG = Logger.getLogger(FitsDatasetLoader.class.getName());

    private final File inputDir;
    private final ObservationCatalog catalog;

    public FitsDatasetLoader(File inputDir, ObservationCatalog catalog) {
        this.inputDir = inputDir;
        this.catalog = catalog;
    }

    public File getResidualFile(ScenarioConfig scenario) {
        File dir = new File(new File(inputDir, scenario.getDirectoryName()), "FITS");
        return new File(dir, scenario.getDatasetKey() + "-KLmodes-all.fits");
    }

    @Override
    public Dataset load(ScenarioConfig scenario) throws IOException {
        CatalogEntry entry = catalog.entry(scenario.getDatasetKey());
        ResidualCube residuals = readResiduals(getResidualFile(scenario), entry);
        List<String> files = entry.getScienceFiles();
        List<RollImage> frames = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            ExposureInfo fallback = i < entry.getExposures().size() ? entry.getExposures().get(i) : null;
            frames.add(readScienceFrame(new File(inputDir, files.get(i)), entry.getCenter(), fallback));
        }
        LOG.log(Level.FINE, "Loaded {0}: {1} with {2} science frames", new Object[]{scenario, residuals, frames.size()});
        return new Dataset(entry, residuals, frames);
    }

    static ResidualCube readResiduals(File file, CatalogEntry entry) throws IOException {
        try (Fits fits = new Fits(file)) {
            ImageHDU hdu = firstImage(fits, file);
            Header header = hdu.getHeader();
            Object kernel = hdu.getKernel();
            int[] shape = ArrayFuncs.getDimensions(kernel);
            if (shape.length != 3) {
                throw new ShapeException("Residual file " + file + " must hold a 3 dimensional cube", shape);
            }
            Point2D center = new Point2D.Double(
                    header.getDoubleValue("PSFCENTX", entry.getCenter().getX()),
                    header.getDoubleValue("PSFCENTY", entry.getCenter().getY()));
            int[] klModes = new int[shape[0]];
            for (int i = 0; i < klModes.length; i++) {
                klModes[i] = header.getIntValue("KLMODE" + i, i + 1);
            }
            return ResidualCube.fromArray(kernel, entry.getPixelScale(), center, entry.getFilter(), entry.getMask(),
                    entry.getExposures(), klModes);
        } catch (FitsException x) {
            throw new IOException("Error reading " + file, x);
        }
    }

    /**
     * Read one science frame. A cube of integrations is averaged, ignoring
     * NaN pixels. The roll angle and integration time come from the
     * ROLL_REF, NINTS and EFFINTTM keywords of any HDU, falling back to the
     * catalog.
     */
    static RollImage readScienceFrame(File file, Point2D center, ExposureInfo fallback) throws IOException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?>[] hdus = fits.read();
            double roll = Double.NaN;
            double nInts = Double.NaN;
            double effIntTime = Double.NaN;
            ImageHDU image = null;
            for (BasicHDU<?> hdu : hdus) {
                Header header = hdu.getHeader();
                if (Double.isNaN(roll) && header.containsKey("ROLL_REF")) {
                    roll = header.getDoubleValue("ROLL_REF");
                }
                if (Double.isNaN(nInts) && header.containsKey("NINTS")) {
                    nInts = header.getDoubleValue("NINTS");
                }
                if (Double.isNaN(effIntTime) && header.containsKey("EFFINTTM")) {
                    effIntTime = header.getDoubleValue("EFFINTTM");
                }
                if (image == null && hdu instanceof ImageHDU && hdu.getAxes() != null && hdu.getAxes().length >= 2) {
                    image = (ImageHDU) hdu;
                }
            }
            if (image == null) {
                throw new IOException("No image in " + file);
            }
            ExposureInfo exposure;
            if (!Double.isNaN(roll) && !Double.isNaN(nInts) && !Double.isNaN(effIntTime)) {
                exposure = new ExposureInfo(roll, nInts * effIntTime);
            } else if (fallback != null) {
                exposure = fallback;
            } else {
                throw new IOException("No roll angle or integration time for " + file);
            }
            return toRollImage(image.getKernel(), center, exposure, file);
        } catch (FitsException x) {
            throw new IOException("Error reading " + file, x);
        }
    }

    private static RollImage toRollImage(Object kernel, Point2D center, ExposureInfo exposure, File file) {
        int[] shape = ArrayFuncs.getDimensions(kernel);
        if (shape.length == 2) {
            double[][] image = (double[][]) ArrayFuncs.convertArray(kernel, double.class);
            double[] data = new double[shape[0] * shape[1]];
            for (int y = 0; y < shape[0]; y++) {
                System.arraycopy(image[y], 0, data, y * shape[1], shape[1]);
            }
            return new RollImage(shape[0], shape[1], data, center, exposure);
        } else if (shape.length == 3) {
            double[][][] cube = (double[][][]) ArrayFuncs.convertArray(kernel, double.class);
            int nAxis2 = shape[1];
            int nAxis1 = shape[2];
            double[] sum = new double[nAxis2 * nAxis1];
            int[] count = new int[sum.length];
            for (double[][] frame : cube) {
                for (int y = 0; y < nAxis2; y++) {
                    for (int x = 0; x < nAxis1; x++) {
                        double v = frame[y][x];
                        if (!Double.isNaN(v)) {
                            sum[y * nAxis1 + x] += v;
                            count[y * nAxis1 + x]++;
                        }
                    }
                }
            }
            for (int i = 0; i < sum.length; i++) {
                sum[i] = count[i] == 0 ? Double.NaN : sum[i] / count[i];
            }
            return new RollImage(nAxis2, nAxis1, sum, center, exposure);
        } else {
            throw new ShapeException("Science frame " + file + " has unsupported shape " + Arrays.toString(shape), shape);
        }
    }

    private static ImageHDU firstImage(Fits fits, File file) throws IOException, FitsException {
        for (BasicHDU<?> hdu = fits.readHDU(); hdu != null; hdu = fits.readHDU()) {
            if (hdu instanceof ImageHDU && hdu.getAxes() != null && hdu.getAxes().length > 0) {
                return (ImageHDU) hdu;
            }
        }
        throw new IOException("No image in " + file);
    }
}
