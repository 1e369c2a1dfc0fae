package org.hci.contrast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.hci.contrast.catalog.CatalogEntry;

/**
 * The inputs of one scenario: catalog metadata, the KLIP residuals produced
 * for the scenario and the science frames they were produced from.
 *
 * @author hci
 */
public class Dataset {

    private final CatalogEntry entry;
    private final ResidualCube residuals;
    private final List<RollImage> scienceFrames;

    public Dataset(CatalogEntry entry, ResidualCube residuals, List<RollImage> scienceFrames) {
        this.entry = entry;
        this.residuals = residuals;
        this.scienceFrames = Collections.unmodifiableList(new ArrayList<>(scienceFrames));
    }

    public CatalogEntry getEntry() {
        return entry;
    }

    public ResidualCube getResiduals() {
        return residuals;
    }

    public List<RollImage> getScienceFrames() {
        return scienceFrames;
    }

    public String getKey() {
        return entry.getDatasetKey();
    }
}
