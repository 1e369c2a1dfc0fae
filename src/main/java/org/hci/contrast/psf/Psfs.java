package org.hci.contrast.psf;

import java.util.Collections;
import java.util.List;
import org.hci.contrast.ExposureInfo;
import org.hci.contrast.ShapeException;

/**
 * Operations on PSF stamps. A stamp is a square [y][x] array with an odd
 * size whose nominal center is pixel <code>(n-1)/2</code>.
 *
 * @author hci
 */
public final class Psfs {

    private Psfs() {
    }

    public static void checkStamp(double[][] psf) {
        int n = psf.length;
        if (n == 0 || n % 2 == 0) {
            throw new ShapeException("PSF must be square with an odd size", new int[]{n});
        }
        for (double[] row : psf) {
            if (row.length != n) {
                throw new ShapeException("PSF must be square with an odd size", new int[]{n, row.length});
            }
        }
    }

    public static double[][] copy(double[][] psf) {
        double[][] result = new double[psf.length][];
        for (int i = 0; i < psf.length; i++) {
            result[i] = psf[i].clone();
        }
        return result;
    }

    public static double peak(double[][] psf) {
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : psf) {
            for (double v : row) {
                if (v > max) {
                    max = v;
                }
            }
        }
        return max;
    }

    /**
     * Bilinear interpolation of the stamp, zero outside.
     *
     * @param psf The stamp
     * @param u Column coordinate
     * @param v Row coordinate
     * @return The interpolated value
     */
    public static double sample(double[][] psf, double u, double v) {
        int n = psf.length;
        int x0 = (int) Math.floor(u);
        int y0 = (int) Math.floor(v);
        double fx = u - x0;
        double fy = v - y0;
        return (1 - fx) * (1 - fy) * value(psf, n, x0, y0)
                + fx * (1 - fy) * value(psf, n, x0 + 1, y0)
                + (1 - fx) * fy * value(psf, n, x0, y0 + 1)
                + fx * fy * value(psf, n, x0 + 1, y0 + 1);
    }

    private static double value(double[][] psf, int n, int x, int y) {
        if (x < 0 || y < 0 || x >= n || y >= n) {
            return 0;
        }
        return psf[y][x];
    }

    /**
     * Rotate a stamp counter-clockwise about its center, filling with zero.
     *
     * @param psf The stamp
     * @param angle The angle in degrees
     * @return The rotated stamp
     */
    public static double[][] rotate(double[][] psf, double angle) {
        int n = psf.length;
        double c = (n - 1) / 2.;
        double theta = Math.toRadians(angle);
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        double[][] result = new double[n][n];
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                // inverse mapping: where did this output pixel come from
                double dx = x - c;
                double dy = y - c;
                double u = c + cos * dx + sin * dy;
                double v = c - sin * dx + cos * dy;
                result[y][x] = sample(psf, u, v);
            }
        }
        return result;
    }

    /**
     * Rotate the PSF of each roll to North up and average the results
     * weighted by integration time, giving the effective PSF of the combined
     * image.
     *
     * @param psf The PSF in detector orientation
     * @param exposures The rolls making up the observation
     * @return The weighted average
     */
    public static double[][] rollAverage(double[][] psf, List<ExposureInfo> exposures) {
        return rollAverage(Collections.nCopies(exposures.size(), psf), exposures);
    }

    /**
     * @param psfs One PSF per roll, in detector orientation
     * @param exposures The rolls, in the same order
     * @return The integration time weighted average of the derotated PSFs
     */
    public static double[][] rollAverage(List<double[][]> psfs, List<ExposureInfo> exposures) {
        if (psfs.size() != exposures.size() || psfs.isEmpty()) {
            throw new ShapeException("Need one PSF per roll, got " + psfs.size() + " for " + exposures.size() + " rolls");
        }
        int n = psfs.get(0).length;
        double totalTime = 0;
        double[][] result = new double[n][n];
        for (int i = 0; i < psfs.size(); i++) {
            double t = exposures.get(i).getIntegrationTime();
            double[][] rotated = rotate(psfs.get(i), exposures.get(i).getRollAngle());
            for (int y = 0; y < n; y++) {
                for (int x = 0; x < n; x++) {
                    result[y][x] += t * rotated[y][x];
                }
            }
            totalTime += t;
        }
        if (!(totalTime > 0)) {
            throw new IllegalArgumentException("Total integration time must be positive");
        }
        for (double[] row : result) {
            for (int x = 0; x < n; x++) {
                row[x] /= totalTime;
            }
        }
        return result;
    }

    /**
     * Shift the stamp by whole pixels so that its brightest pixel is at the
     * center. Pixels rolled off one edge re-enter on the other.
     */
    public static double[][] recenterPeak(double[][] psf) {
        int n = psf.length;
        int px = 0;
        int py = 0;
        double max = Double.NEGATIVE_INFINITY;
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                if (psf[y][x] > max) {
                    max = psf[y][x];
                    px = x;
                    py = y;
                }
            }
        }
        int c = (n - 1) / 2;
        int dx = c - px;
        int dy = c - py;
        if (dx == 0 && dy == 0) {
            return copy(psf);
        }
        double[][] result = new double[n][n];
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                result[Math.floorMod(y + dy, n)][Math.floorMod(x + dx, n)] = psf[y][x];
            }
        }
        return result;
    }
}
