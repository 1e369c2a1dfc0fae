package org.hci.contrast.pipeline;

import java.io.IOException;
import org.hci.contrast.Dataset;
import org.hci.contrast.ScenarioConfig;

/**
 * Provides the residuals and science frames of a scenario.
 *
 * @author hci
 */
public interface DatasetLoader {

    Dataset load(ScenarioConfig scenario) throws IOException;
}
