package org.hci.contrast.inject;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.hci.contrast.ExposureInfo;
import org.hci.contrast.RollImage;
import org.hci.contrast.SkyGeometry;
import org.hci.contrast.psf.PsfProvider;
import org.hci.contrast.psf.Psfs;

/**
 * Adds synthetic companions to the science frames of each roll. A companion
 * at position angle PA on the sky appears at PA - roll on the detector, and
 * is modelled by the offset PSF at that detector position so that the
 * coronagraph attenuation near the mask is included.
 *
 * @author hci
 */
public class CompanionInjector {

    private final PsfProvider psfProvider;
    private final String filter;
    private final String mask;
    private final double referencePeak;

    /**
     * @param psfProvider Source of offset PSFs
     * @param filter The filter name
     * @param mask The coronagraphic mask name
     * @param referencePeak Peak of the unocculted PSF, used to convert the
     * PSF to a companion of unit peak brightness
     */
    public CompanionInjector(PsfProvider psfProvider, String filter, String mask, double referencePeak) {
        if (!(referencePeak > 0) || Double.isInfinite(referencePeak)) {
            throw new IllegalArgumentException("Reference PSF peak must be positive: " + referencePeak);
        }
        this.psfProvider = psfProvider;
        this.filter = filter;
        this.mask = mask;
        this.referencePeak = referencePeak;
    }

    /**
     * @param frames The original frames, which are not modified
     * @param sites The companions to add
     * @return New frames containing the companions
     * @throws IOException If a PSF cannot be obtained
     */
    public List<RollImage> inject(List<RollImage> frames, List<InjectionSite> sites) throws IOException {
        List<RollImage> result = new ArrayList<>(frames.size());
        for (RollImage frame : frames) {
            double[] data = frame.copyData();
            double roll = frame.getExposure().getRollAngle();
            for (InjectionSite site : sites) {
                Point2D.Double offset = SkyGeometry.offset(site.getSeparation(), site.getPositionAngle() - roll);
                double[][] psf = psfProvider.offsetPsf(filter, mask, offset);
                Psfs.checkStamp(psf);
                add(data, frame, psf, site.getFlux() / referencePeak, offset);
            }
            result.add(frame.withData(data));
        }
        return result;
    }

    /**
     * The PSF seen in the combined, North up image for a companion at the
     * given site: the derotated offset PSFs of every roll averaged by
     * integration time, scaled to the peak of the unocculted PSF.
     *
     * @param frames The frames of each roll
     * @param site The companion
     * @return The template, indexed [y][x]
     * @throws IOException If a PSF cannot be obtained
     */
    public double[][] template(List<RollImage> frames, InjectionSite site) throws IOException {
        List<double[][]> psfs = new ArrayList<>(frames.size());
        List<ExposureInfo> exposures = new ArrayList<>(frames.size());
        for (RollImage frame : frames) {
            double roll = frame.getExposure().getRollAngle();
            Point2D.Double offset = SkyGeometry.offset(site.getSeparation(), site.getPositionAngle() - roll);
            double[][] psf = psfProvider.offsetPsf(filter, mask, offset);
            Psfs.checkStamp(psf);
            psfs.add(psf);
            exposures.add(frame.getExposure());
        }
        double[][] average = Psfs.rollAverage(psfs, exposures);
        for (double[] row : average) {
            for (int x = 0; x < row.length; x++) {
                row[x] /= referencePeak;
            }
        }
        return average;
    }

    private static void add(double[] data, RollImage frame, double[][] psf, double scale, Point2D.Double offset) {
        int n = psf.length;
        double c = (n - 1) / 2.;
        Point2D.Double center = frame.getCenter();
        double px = center.x + offset.x;
        double py = center.y + offset.y;
        int nAxis1 = frame.getNAxis1();
        int nAxis2 = frame.getNAxis2();
        int x0 = Math.max(0, (int) Math.floor(px - c - 1));
        int x1 = Math.min(nAxis1 - 1, (int) Math.ceil(px + c + 1));
        int y0 = Math.max(0, (int) Math.floor(py - c - 1));
        int y1 = Math.min(nAxis2 - 1, (int) Math.ceil(py + c + 1));
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                double v = Psfs.sample(psf, x - px + c, y - py + c);
                if (v != 0) {
                    data[y * nAxis1 + x] += scale * v;
                }
            }
        }
    }

    public double getReferencePeak() {
        return referencePeak;
    }
}
