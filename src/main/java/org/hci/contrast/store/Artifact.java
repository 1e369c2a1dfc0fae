package org.hci.contrast.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.hci.contrast.ShapeException;

/**
 * A persisted quantity: a rectangular table of doubles (rows of equal length)
 * plus a few keywords. Keyword values are Boolean, Number or String; when read
 * back from storage they may come back as their textual form, which the typed
 * getters accept.
 *
 * @author hci
 */
public class Artifact {

    private final double[][] data;
    private final Map<String, Object> keywords;

    public Artifact(double[][] data, Map<String, ?> keywords) {
        if (data.length == 0) {
            throw new ShapeException("Artifact data must have at least one row");
        }
        int width = data[0].length;
        double[][] copy = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            if (data[i].length != width) {
                throw new ShapeException("Artifact rows must all have length " + width, new int[]{data.length, data[i].length});
            }
            copy[i] = data[i].clone();
        }
        this.data = copy;
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public Artifact(double[][] data) {
        this(data, Collections.<String, Object>emptyMap());
    }

    public int getRows() {
        return data.length;
    }

    public int getColumns() {
        return data[0].length;
    }

    public double[] getRow(int row) {
        return data[row].clone();
    }

    public double[][] getData() {
        double[][] copy = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            copy[i] = data[i].clone();
        }
        return copy;
    }

    /**
     * A hash of the shape and the exact bit patterns of the data, used to
     * recognise products derived from this artifact. Keywords are not
     * included.
     *
     * @return 16 hexadecimal digits
     */
    public String fingerprint() {
        long hash = 1125899906842597L;
        hash = 31 * hash + data.length;
        hash = 31 * hash + data[0].length;
        for (double[] row : data) {
            for (double value : row) {
                hash = 31 * hash + Double.doubleToLongBits(value);
            }
        }
        return String.format("%016x", hash);
    }

    public Map<String, Object> getKeywords() {
        return keywords;
    }

    public boolean hasKeyword(String key) {
        return keywords.containsKey(key);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = keywords.get(key);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Boolean) {
            return (Boolean) value;
        } else {
            String text = value.toString().trim();
            return "T".equalsIgnoreCase(text) || "true".equalsIgnoreCase(text);
        }
    }

    public double getDouble(String key, double defaultValue) {
        Object value = keywords.get(key);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number) {
            return ((Number) value).doubleValue();
        } else {
            return Double.parseDouble(value.toString().trim().replace('D', 'E'));
        }
    }

    public String getString(String key) {
        Object value = keywords.get(key);
        return value == null ? null : value.toString();
    }
}
