package org.hci.contrast.store;

import java.util.Objects;
import org.hci.contrast.ScenarioConfig;

/**
 * Identifies one persisted quantity of one scenario, optionally for a single
 * KL mode.
 *
 * @author hci
 */
public class ArtifactKey {

    /**
     * KL index used for quantities covering all KL modes
     */
    public static final int ALL_KL_MODES = -1;

    private final ScenarioConfig scenario;
    private final String name;
    private final int klIndex;

    public ArtifactKey(ScenarioConfig scenario, String name, int klIndex) {
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.name = Objects.requireNonNull(name, "name");
        if (klIndex < ALL_KL_MODES) {
            throw new IllegalArgumentException("Invalid KL index: " + klIndex);
        }
        this.klIndex = klIndex;
    }

    public ArtifactKey(ScenarioConfig scenario, String name) {
        this(scenario, name, ALL_KL_MODES);
    }

    public ScenarioConfig getScenario() {
        return scenario;
    }

    public String getName() {
        return name;
    }

    public int getKlIndex() {
        return klIndex;
    }

    /**
     * @return The file name for this artifact, e.g.
     * <code>KEY-flux_all-KL0.fits</code>
     */
    public String getFileName() {
        if (klIndex == ALL_KL_MODES) {
            return String.format("%s-%s.fits", scenario.getDatasetKey(), name);
        } else {
            return String.format("%s-%s-KL%d.fits", scenario.getDatasetKey(), name, klIndex);
        }
    }

    @Override
    public String toString() {
        return scenario.getDirectoryName() + "/" + getFileName();
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 29 * hash + Objects.hashCode(this.scenario);
        hash = 29 * hash + Objects.hashCode(this.name);
        hash = 29 * hash + this.klIndex;
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
        final ArtifactKey other = (ArtifactKey) obj;
        return this.klIndex == other.klIndex
                && Objects.equals(this.name, other.name)
                && Objects.equals(this.scenario, other.scenario);
    }
}
