package org.hci.contrast.mask;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.hci.contrast.KnownSource;
import org.hci.contrast.PositionAngleRange;
import org.hci.contrast.ResidualCube;

/**
 * Composition of masks, applied in order.
 *
 * @author hci
 */
public class PixelMasks implements PixelMask {

    private final List<PixelMask> masks;

    public PixelMasks(List<PixelMask> masks) {
        this.masks = Collections.unmodifiableList(new ArrayList<>(masks));
    }

    /**
     * Build the masks used before measuring noise: known companions first,
     * then, for bar occulters only, the bar. The bar goes last since it may
     * legitimately overlap a companion in one roll.
     *
     * @param pixelScale Pixel scale in mas/pixel
     * @param center Host star position in pixels
     * @param companionRadius Radius masked around each companion, in pixels
     * @param sources The known companions, may be empty
     * @param barRanges The unobstructed slices for a bar occulter, or
     * <code>null</code> for round occulters
     * @return The composed mask
     */
    public static PixelMasks forObservation(double pixelScale, Point2D center, double companionRadius,
            List<KnownSource> sources, List<PositionAngleRange> barRanges) {
        List<PixelMask> masks = new ArrayList<>();
        if (!sources.isEmpty()) {
            masks.add(new KnownSourceMask(pixelScale, center, companionRadius, sources));
        }
        if (barRanges != null) {
            masks.add(new BarOcculterMask(center, barRanges));
        }
        return new PixelMasks(masks);
    }

    @Override
    public ResidualCube apply(ResidualCube cube) {
        ResidualCube result = cube;
        for (PixelMask mask : masks) {
            result = mask.apply(result);
        }
        return result;
    }

    public List<PixelMask> getMasks() {
        return masks;
    }
}
