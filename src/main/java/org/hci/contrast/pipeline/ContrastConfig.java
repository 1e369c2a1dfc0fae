package org.hci.contrast.pipeline;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import org.hci.contrast.KnownSource;
import org.hci.contrast.PositionAngleRange;
import org.hci.contrast.fit.ThroughputModelFitter;
import org.hci.contrast.inject.InjectionRequest;

/**
 * Tuning constants and batch settings, read from properties. Defaults come
 * from the <code>contrast.properties</code> resource and may be overridden by
 * a user file or programmatically.
 *
 * @author hci
 */
public class ContrastConfig {

    private static final String DEFAULTS = "/contrast.properties";

    private final Properties properties;

    public ContrastConfig(Properties overrides) throws IOException {
        properties = new Properties();
        try (InputStream in = ContrastConfig.class.getResourceAsStream(DEFAULTS)) {
            if (in == null) {
                throw new IOException("Missing resource " + DEFAULTS);
            }
            properties.load(in);
        }
        properties.putAll(overrides);
    }

    public ContrastConfig() throws IOException {
        this(new Properties());
    }

    public static ContrastConfig load(File file) throws IOException {
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(file)) {
            props.load(in);
        }
        return new ContrastConfig(props);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing configuration property " + key);
        }
        return value.trim();
    }

    public double getDouble(String key) {
        try {
            return Double.parseDouble(getString(key));
        } catch (NumberFormatException x) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + getString(key), x);
        }
    }

    public int getInt(String key) {
        try {
            return Integer.parseInt(getString(key));
        } catch (NumberFormatException x) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + getString(key), x);
        }
    }

    public boolean getBoolean(String key) {
        return Boolean.parseBoolean(getString(key));
    }

    /**
     * A comma separated list, empty if the property is blank.
     */
    public List<String> getList(String key) {
        String value = properties.getProperty(key, "").trim();
        if (value.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(value.split("\\s*,\\s*"));
    }

    public double[] getDoubles(String key) {
        List<String> items = getList(key);
        double[] result = new double[items.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = Double.parseDouble(items.get(i));
        }
        return result;
    }

    public List<Integer> getInts(String key) {
        List<Integer> result = new ArrayList<>();
        for (String item : getList(key)) {
            result.add(Integer.parseInt(item));
        }
        return result;
    }

    public File getInputDir() {
        return new File(getString("inputDir"));
    }

    public File getOutputDir() {
        return new File(getString("outputDir"));
    }

    public File getCatalogFile() {
        return new File(getString("catalog"));
    }

    public double getTelescopeDiameter() {
        return getDouble("telescopeDiameter");
    }

    public double getCompanionMaskFwhm() {
        return getDouble("companionMaskFwhm");
    }

    public double getInjectionExclusionFwhm() {
        return getDouble("injectionExclusionFwhm");
    }

    public double getInjectionContrastFactor() {
        return getDouble("injectionContrastFactor");
    }

    public double getResolutionFwhm() {
        return getDouble("resolutionFwhm");
    }

    public double getSigma() {
        return getDouble("sigma");
    }

    public int getSmallSampleLimit() {
        return getInt("smallSampleLimit");
    }

    /**
     * @return Inner working angle in pixels
     */
    public double getInnerWorkingAngle() {
        return getDouble("innerWorkingAngle");
    }

    /**
     * @return Outer working angle in pixels
     */
    public double getOuterWorkingAngle() {
        return getDouble("outerWorkingAngle");
    }

    public ThroughputModelFitter getFitter() {
        return new ThroughputModelFitter(getDoubles("fit.initialGuess"), getInt("fit.maxIterations"), getInt("fit.minSeparations"));
    }

    public int getWorkers() {
        return getInt("workers");
    }

    public int getScenarioWorkers() {
        return getInt("scenarioWorkers");
    }

    public double getMaxTrialFailureFraction() {
        return getDouble("maxTrialFailureFraction");
    }

    public boolean isBarMask(String mask) {
        return getList("barMasks").contains(mask);
    }

    /**
     * @return Unobstructed position angle ranges for bar occulters, written
     * as <code>low:high</code> items
     */
    public List<PositionAngleRange> getBarRanges() {
        List<PositionAngleRange> result = new ArrayList<>();
        for (String item : getList("barRanges")) {
            result.add(PositionAngleRange.parse(item));
        }
        return result;
    }

    /**
     * @param bar <code>true</code> for the bar occulter grid
     * @return The injection grid
     */
    public InjectionRequest getInjectionRequest(boolean bar) {
        String prefix = bar ? "injection.bar." : "injection.round.";
        return new InjectionRequest(getDoubles(prefix + "separations"), getDoubles(prefix + "positionAngles"));
    }

    /**
     * @return Known companions, written as <code>ra:dec</code> items in mas
     */
    public List<KnownSource> getKnownSources() {
        List<KnownSource> result = new ArrayList<>();
        for (String item : getList("knownSources")) {
            String[] parts = item.split("\\s*:\\s*");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Invalid known source: " + item);
            }
            result.add(new KnownSource(Double.parseDouble(parts[0]), Double.parseDouble(parts[1])));
        }
        return result;
    }

    /**
     * @return KL mode index to calibrate, negative values count from the end
     */
    public int getKlIndex() {
        return getInt("klIndex");
    }

    public boolean isOverwrite() {
        return getBoolean("overwrite");
    }

    public List<String> getModes() {
        return getList("modes");
    }

    public List<Integer> getAnnuli() {
        return getInts("annuli");
    }

    public List<Integer> getSubsections() {
        return getInts("subsections");
    }

    /**
     * @return Datasets to process, empty meaning every dataset in the catalog
     */
    public List<String> getDatasets() {
        return getList("datasets");
    }
}
