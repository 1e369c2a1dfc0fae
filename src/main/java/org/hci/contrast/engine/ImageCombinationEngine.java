package org.hci.contrast.engine;

import java.util.List;
import org.hci.contrast.ResidualCube;
import org.hci.contrast.RollImage;
import org.hci.contrast.ScenarioConfig;

/**
 * The PSF subtraction and image combination step (KLIP). It is used both to
 * produce the original residuals and to reprocess data containing synthetic
 * companions. Implementations must be deterministic for identical inputs and
 * safe to call from several threads.
 *
 * @author hci
 */
public interface ImageCombinationEngine {

    /**
     * @param scenario The KLIP mode, annuli and subsections to use
     * @param frames The science frames, one per roll, in detector orientation
     * @param klModes The KL mode truncations to produce
     * @return A derotated (North up) residual cube with one frame per
     * requested KL mode
     * @throws CombinationException If the combination fails
     */
    ResidualCube combine(ScenarioConfig scenario, List<RollImage> frames, int[] klModes) throws CombinationException;
}
