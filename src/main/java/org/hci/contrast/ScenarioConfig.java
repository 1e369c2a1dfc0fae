package org.hci.contrast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One processing scenario: a KLIP mode, number of annuli and subsections
 * applied to one dataset. Scenarios share no mutable state and can be
 * processed independently.
 *
 * @author hci
 */
public class ScenarioConfig {

    private final String mode;
    private final int annuli;
    private final int subsections;
    private final String datasetKey;

    public ScenarioConfig(String mode, int annuli, int subsections, String datasetKey) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.datasetKey = Objects.requireNonNull(datasetKey, "datasetKey");
        if (annuli <= 0 || subsections <= 0) {
            throw new IllegalArgumentException("annuli and subsections must be positive: " + annuli + ", " + subsections);
        }
        this.annuli = annuli;
        this.subsections = subsections;
    }

    /**
     * Every combination of the given modes, annuli, subsections and datasets,
     * in that nesting order.
     */
    public static List<ScenarioConfig> expand(List<String> modes, List<Integer> annuli, List<Integer> subsections, List<String> datasetKeys) {
        List<ScenarioConfig> result = new ArrayList<>();
        for (String mode : modes) {
            for (int a : annuli) {
                for (int s : subsections) {
                    for (String key : datasetKeys) {
                        result.add(new ScenarioConfig(mode, a, s, key));
                    }
                }
            }
        }
        return result;
    }

    public String getMode() {
        return mode;
    }

    public int getAnnuli() {
        return annuli;
    }

    public int getSubsections() {
        return subsections;
    }

    public String getDatasetKey() {
        return datasetKey;
    }

    /**
     * @return The directory name used for this KLIP configuration, e.g.
     * <code>ADI+RDI_annu1_subs1</code>
     */
    public String getDirectoryName() {
        return String.format("%s_annu%d_subs%d", mode, annuli, subsections);
    }

    @Override
    public String toString() {
        return getDirectoryName() + "/" + datasetKey;
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 67 * hash + Objects.hashCode(this.mode);
        hash = 67 * hash + this.annuli;
        hash = 67 * hash + this.subsections;
        hash = 67 * hash + Objects.hashCode(this.datasetKey);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ScenarioConfig other = (ScenarioConfig) obj;
        return this.annuli == other.annuli
                && this.subsections == other.subsections
                && Objects.equals(this.mode, other.mode)
                && Objects.equals(this.datasetKey, other.datasetKey);
    }
}
