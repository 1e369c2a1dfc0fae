package org.hci.contrast.catalog;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.hci.contrast.ExposureInfo;
import org.hci.contrast.SkyGeometry;

/**
 * Everything the contrast computation needs to know about one dataset.
 *
 * @author hci
 */
public class CatalogEntry {

    private final String datasetKey;
    private final double pixelScale;
    private final Point2D.Double center;
    private final String filter;
    private final String mask;
    private final List<ExposureInfo> exposures;
    private final double hostMagnitude;
    private final double zeroPoint;
    private final double wavelength;
    private final List<String> scienceFiles;

    /**
     * @param datasetKey The dataset key
     * @param pixelScale Pixel scale in mas/pixel
     * @param center Star position in the combined images, in pixels
     * @param filter Filter name
     * @param mask Coronagraphic mask name
     * @param exposures The science rolls
     * @param hostMagnitude Host star magnitude (vegamag) in the filter
     * @param zeroPoint Filter zero point in Jy
     * @param wavelength Filter central wavelength in meters
     * @param scienceFiles The science frame files, one per roll, may be empty
     */
    public CatalogEntry(String datasetKey, double pixelScale, Point2D center, String filter, String mask,
            List<ExposureInfo> exposures, double hostMagnitude, double zeroPoint, double wavelength, List<String> scienceFiles) {
        this.datasetKey = datasetKey;
        this.pixelScale = pixelScale;
        this.center = new Point2D.Double(center.getX(), center.getY());
        this.filter = filter;
        this.mask = mask;
        this.exposures = Collections.unmodifiableList(new ArrayList<>(exposures));
        this.hostMagnitude = hostMagnitude;
        this.zeroPoint = zeroPoint;
        this.wavelength = wavelength;
        this.scienceFiles = Collections.unmodifiableList(new ArrayList<>(scienceFiles));
    }

    public String getDatasetKey() {
        return datasetKey;
    }

    public double getPixelScale() {
        return pixelScale;
    }

    public Point2D.Double getCenter() {
        return new Point2D.Double(center.x, center.y);
    }

    public String getFilter() {
        return filter;
    }

    public String getMask() {
        return mask;
    }

    public List<ExposureInfo> getExposures() {
        return exposures;
    }

    public double getHostMagnitude() {
        return hostMagnitude;
    }

    public double getZeroPoint() {
        return zeroPoint;
    }

    public double getWavelength() {
        return wavelength;
    }

    public List<String> getScienceFiles() {
        return scienceFiles;
    }

    /**
     * @param telescopeDiameter Telescope diameter in meters
     * @return The lambda/D FWHM in pixels
     */
    public double fwhm(double telescopeDiameter) {
        return SkyGeometry.fwhm(wavelength, telescopeDiameter, pixelScale);
    }

    @Override
    public String toString() {
        return "CatalogEntry{" + "datasetKey=" + datasetKey + ", pixelScale=" + pixelScale + ", filter=" + filter + ", mask=" + mask + '}';
    }
}
