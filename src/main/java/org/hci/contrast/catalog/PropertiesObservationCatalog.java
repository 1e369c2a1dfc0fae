package org.hci.contrast.catalog;

import java.awt.geom.Point2D;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.hci.contrast.ExposureInfo;

/**
 * Reads the observation catalog from a properties file. The
 * <code>legend</code> property names the columns, every other property is a
 * dataset key whose value is the comma separated list of column values.
 * List valued columns are written in brackets with blank separated items,
 * e.g.
 * <pre>
 * legend = PIXSCALE, CENTX, CENTY, FILTER, MASK, MSTAR, F0, WAVE, ROLLS, INTTIMES, FITSFILES
 * OBS_1 = 63.0, 160.0, 160.0, F356W, MASKA335R, 6.77, 261.0, 3.56e-6, [0 10], [1000 1000], [r1.fits r2.fits]
 * </pre>
 *
 * @author hci
 */
public class PropertiesObservationCatalog implements ObservationCatalog {

    private static final Logger LOG = Logger.getLogger(PropertiesObservationCatalog.class.getName());
    private static final List<String> REQUIRED = Arrays.asList(
            "PIXSCALE", "CENTX", "CENTY", "FILTER", "MASK", "MSTAR", "F0", "WAVE", "ROLLS", "INTTIMES");

    private final Map<String, Map<String, Object>> data = new TreeMap<>();

    public PropertiesObservationCatalog(File file) throws IOException {
        this(new FileInputStream(file));
    }

    public PropertiesObservationCatalog(InputStream input) throws IOException {
        Properties props = new Properties();
        try (InputStream in = input) {
            props.load(in);
        }
        Object legend = props.get("legend");
        if (legend == null) {
            throw new IOException("Missing legend in observation catalog");
        }
        String[] keyList = legend.toString().trim().split("\\s*,\\s*");
        List<String> columns = Arrays.asList(keyList);
        if (!columns.containsAll(REQUIRED)) {
            throw new IOException("Observation catalog legend must contain " + REQUIRED + ", got " + columns);
        }
        for (Map.Entry<Object, Object> e : props.entrySet()) {
            String key = e.getKey().toString();
            if ("legend".equals(key)) {
                continue;
            }
            String[] values = e.getValue().toString().trim().split("\\s*,\\s*");
            if (values.length != keyList.length) {
                throw new IOException("Dataset " + key + " has " + values.length + " values, expected " + keyList.length);
            }
            Map<String, Object> result = new HashMap<>();
            for (int i = 0; i < keyList.length; i++) {
                result.put(keyList[i], parse(values[i]));
            }
            data.put(key, result);
        }
        LOG.log(Level.FINE, "Read {0} datasets", data.size());
    }

    private static Object parse(String value) {
        if (value.startsWith("[")) {
            if (!value.endsWith("]")) {
                throw new IllegalArgumentException("Unterminated list: " + value);
            }
            String inner = value.substring(1, value.length() - 1).trim();
            return inner.isEmpty() ? Collections.emptyList() : Arrays.asList(inner.split("\\s+"));
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException x) {
            return value;
        }
    }

    @Override
    public List<String> getDatasetKeys() {
        return new ArrayList<>(data.keySet());
    }

    @Override
    public CatalogEntry entry(String datasetKey) throws IOException {
        Map<String, Object> row = data.get(datasetKey);
        if (row == null) {
            throw new IOException("Unknown dataset: " + datasetKey);
        }
        try {
            List<String> rolls = list(row, "ROLLS");
            List<String> times = list(row, "INTTIMES");
            if (rolls.size() != times.size()) {
                throw new IOException("Dataset " + datasetKey + " has " + rolls.size() + " rolls but " + times.size() + " integration times");
            }
            List<ExposureInfo> exposures = new ArrayList<>();
            for (int i = 0; i < rolls.size(); i++) {
                exposures.add(new ExposureInfo(Double.parseDouble(rolls.get(i)), Double.parseDouble(times.get(i))));
            }
            List<String> files = row.containsKey("FITSFILES") ? list(row, "FITSFILES") : Collections.<String>emptyList();
            return new CatalogEntry(datasetKey, number(row, "PIXSCALE"),
                    new Point2D.Double(number(row, "CENTX"), number(row, "CENTY")),
                    row.get("FILTER").toString(), row.get("MASK").toString(), exposures,
                    number(row, "MSTAR"), number(row, "F0"), number(row, "WAVE"), files);
        } catch (RuntimeException x) {
            throw new IOException("Invalid catalog entry for " + datasetKey, x);
        }
    }

    private static double number(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (!(value instanceof Double)) {
            throw new IllegalArgumentException("Column " + column + " is not a number: " + value);
        }
        return (Double) value;
    }

    @SuppressWarnings("unchecked")
    private static List<String> list(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof List) {
            return (List<String>) value;
        }
        // a single unbracketed value
        return Collections.singletonList(String.valueOf(value));
    }
}
