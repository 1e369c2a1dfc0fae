package org.hci.contrast.raw;

import org.hci.contrast.SkyGeometry;

/**
 * Unit conversions between the KLIP residuals, which are a surface
 * brightness (MJy/sr), and the host star, which is a point source (MJy).
 * All contrast computations go through this class so the chain is defined in
 * one place.
 * <p>
 * The vegamag to MJy to MJy/sr chain has been seen to disagree with
 * independent estimates by up to a factor of ~5 for some configurations and
 * should be validated against an external reference before the absolute
 * contrast values are trusted.
 *
 * @author hci
 */
public final class FluxCalibration {

    private FluxCalibration() {
    }

    /**
     * Solid angle of one pixel.
     *
     * @param pixelScale Pixel scale in mas/pixel
     * @return The solid angle in steradians
     */
    public static double pixelSolidAngle(double pixelScale) {
        double radians = pixelScale / SkyGeometry.RAD2MAS;
        return radians * radians;
    }

    /**
     * Peak flux of the host star PSF.
     *
     * @param zeroPoint Filter zero point in Jy
     * @param magnitude Host star magnitude (vegamag) in the filter
     * @param psfPeak Peak of the total-intensity normalised reference PSF
     * @return The peak pixel flux of the star in MJy
     */
    public static double hostStarPeakFlux(double zeroPoint, double magnitude, double psfPeak) {
        return zeroPoint / Math.pow(10., magnitude / 2.5) / 1e6 * psfPeak;
    }

    /**
     * @param surfaceBrightness A value in MJy/sr
     * @param pixelScale Pixel scale in mas/pixel
     * @return The flux in one pixel, in MJy
     */
    public static double toPixelFlux(double surfaceBrightness, double pixelScale) {
        return surfaceBrightness * pixelSolidAngle(pixelScale);
    }

    /**
     * The host star peak expressed as a surface brightness, i.e. the value a
     * residual pixel must have to reach a contrast of 1.
     *
     * @param zeroPoint Filter zero point in Jy
     * @param magnitude Host star magnitude (vegamag)
     * @param psfPeak Peak of the normalised reference PSF
     * @param pixelScale Pixel scale in mas/pixel
     * @return The normalization in MJy/sr
     */
    public static double normalization(double zeroPoint, double magnitude, double psfPeak, double pixelScale) {
        return hostStarPeakFlux(zeroPoint, magnitude, psfPeak) / pixelSolidAngle(pixelScale);
    }

    public static double contrastToSurfaceBrightness(double contrast, double normalization) {
        return contrast * normalization;
    }

    public static double surfaceBrightnessToContrast(double surfaceBrightness, double normalization) {
        return surfaceBrightness / normalization;
    }
}
