package org.hci.contrast.catalog;

import java.io.IOException;
import java.util.List;

/**
 * Observation metadata, per dataset key.
 *
 * @author hci
 */
public interface ObservationCatalog {

    List<String> getDatasetKeys();

    /**
     * @param datasetKey The dataset
     * @return The catalog entry
     * @throws IOException If the dataset is unknown or its entry is invalid
     */
    CatalogEntry entry(String datasetKey) throws IOException;
}
