package org.hci.contrast.inject;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.hci.contrast.ContrastCurve;
import org.hci.contrast.KnownSource;
import org.hci.contrast.PositionAngleRange;
import org.hci.contrast.mask.BarOcculterMask;
import org.hci.contrast.raw.FluxCalibration;

/**
 * Decides where synthetic companions go and how bright they are, and groups
 * them into trials which can be injected together.
 * <p>
 * Each site is injected at a fixed multiple of the raw contrast at its
 * separation. Sites whose separation falls outside the raw curve, sites too
 * close to a known companion and (for bar occulters) sites behind the bar are
 * left out. The remaining sites are packed into trials so that no two
 * companions of one trial are closer than the minimum separation; a site
 * which does not fit an existing trial starts a new one.
 *
 * @author hci
 */
public class InjectionPlanner {

    private static final Logger LOG = Logger.getLogger(InjectionPlanner.class.getName());

    private final double normalization;
    private final double contrastFactor;
    private final double minSeparation;
    private final double pixelScale;
    private final List<Point2D.Double> knownOffsets;
    private final BarOcculterMask bar;

    /**
     * @param normalization Host star peak in the units of the residuals
     * @param contrastFactor Multiple of the raw contrast injected
     * @param minSeparation Minimum distance in pixels between two injected
     * companions, and between a companion and a known source
     * @param pixelScale Pixel scale in mas/pixel
     * @param knownSources Known companions
     * @param barRanges Unobstructed position angles for a bar occulter, or
     * <code>null</code> for round occulters
     */
    public InjectionPlanner(double normalization, double contrastFactor, double minSeparation, double pixelScale,
            List<KnownSource> knownSources, List<PositionAngleRange> barRanges) {
        if (!(contrastFactor > 0) || !(minSeparation >= 0)) {
            throw new IllegalArgumentException("Invalid planner settings: factor=" + contrastFactor + " minSeparation=" + minSeparation);
        }
        this.normalization = normalization;
        this.contrastFactor = contrastFactor;
        this.minSeparation = minSeparation;
        this.pixelScale = pixelScale;
        List<Point2D.Double> offsets = new ArrayList<>(knownSources.size());
        for (KnownSource source : knownSources) {
            offsets.add(source.pixelPosition(pixelScale, new Point2D.Double(0, 0)));
        }
        this.knownOffsets = Collections.unmodifiableList(offsets);
        this.bar = barRanges == null ? null : new BarOcculterMask(new Point2D.Double(0, 0), barRanges);
    }

    /**
     * @param rawCurve The raw contrast curve for the KL mode being calibrated
     * @param request The separations and position angles to try
     * @return The trials, each a list of sites; empty if every site was
     * excluded
     */
    public List<List<InjectionSite>> plan(ContrastCurve rawCurve, InjectionRequest request) {
        List<InjectionSite> sites = new ArrayList<>();
        for (double sep : request.getSeparations()) {
            double contrast = rawCurve.interpolate(sep);
            double flux = FluxCalibration.contrastToSurfaceBrightness(contrastFactor * contrast, normalization);
            if (!Double.isFinite(flux)) {
                LOG.log(Level.INFO, "No raw contrast at separation {0} px, not injecting there", sep);
                continue;
            }
            for (double pa : request.getPositionAngles()) {
                InjectionSite site = new InjectionSite(sep, pa, flux);
                if (bar != null && !bar.isUnobstructed(pa)) {
                    LOG.log(Level.FINE, "{0} is behind the bar", site);
                } else if (nearKnownSource(site)) {
                    LOG.log(Level.FINE, "{0} is too close to a known source", site);
                } else {
                    sites.add(site);
                }
            }
        }
        return pack(sites);
    }

    private boolean nearKnownSource(InjectionSite site) {
        Point2D.Double offset = site.offset();
        for (Point2D.Double known : knownOffsets) {
            if (offset.distance(known) < minSeparation) {
                return true;
            }
        }
        return false;
    }

    List<List<InjectionSite>> pack(List<InjectionSite> sites) {
        List<List<InjectionSite>> trials = new ArrayList<>();
        for (InjectionSite site : sites) {
            List<InjectionSite> home = null;
            for (List<InjectionSite> trial : trials) {
                if (fits(trial, site)) {
                    home = trial;
                    break;
                }
            }
            if (home == null) {
                home = new ArrayList<>();
                trials.add(home);
            }
            home.add(site);
        }
        LOG.log(Level.FINE, "Packed {0} sites into {1} trials", new Object[]{sites.size(), trials.size()});
        return trials;
    }

    private boolean fits(List<InjectionSite> trial, InjectionSite site) {
        for (InjectionSite other : trial) {
            if (other.distance(site) < minSeparation) {
                return false;
            }
        }
        return true;
    }

    public double getMinSeparation() {
        return minSeparation;
    }

    public double getPixelScale() {
        return pixelScale;
    }
}
