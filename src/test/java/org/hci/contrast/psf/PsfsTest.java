package org.hci.contrast.psf;

import java.util.Arrays;
import org.hci.contrast.ExposureInfo;
import org.hci.contrast.ShapeException;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import org.junit.Test;

/**
 *
 * @author hci
 */
public class PsfsTest {

    private static double[][] point(int n, int x, int y) {
        double[][] psf = new double[n][n];
        psf[y][x] = 1;
        return psf;
    }

    @Test
    public void testRotateQuarterTurn() {
        // counter-clockwise: a point to the right of center goes to the top
        double[][] rotated = Psfs.rotate(point(5, 3, 2), 90);
        assertEquals(1., rotated[3][2], 1e-12);
        assertEquals(1., Psfs.rotate(point(5, 3, 2), 0)[2][3], 1e-12);
    }

    @Test
    public void testSample() {
        double[][] psf = point(3, 1, 1);
        assertEquals(1., Psfs.sample(psf, 1, 1), 0);
        assertEquals(0.5, Psfs.sample(psf, 1.5, 1), 1e-12);
        assertEquals(0.25, Psfs.sample(psf, 0.5, 0.5), 1e-12);
        assertEquals(0., Psfs.sample(psf, -3, 1), 0);
    }

    @Test
    public void testRollAverageWeightsByIntegrationTime() {
        double[][] psf = point(5, 3, 2);
        double[][] average = Psfs.rollAverage(psf, Arrays.asList(new ExposureInfo(0, 3), new ExposureInfo(90, 1)));
        assertEquals(0.75, average[2][3], 1e-12);
        assertEquals(0.25, average[3][2], 1e-12);
        try {
            Psfs.rollAverage(psf, Arrays.asList(new ExposureInfo(0, 0)));
            fail("Zero integration time accepted");
        } catch (IllegalArgumentException x) {
            // expected
        }
    }

    @Test
    public void testRecenterPeak() {
        double[][] psf = point(5, 0, 1);
        psf[1][4] = 0.5;
        double[][] recentered = Psfs.recenterPeak(psf);
        assertEquals(1., recentered[2][2], 0);
        // wraps around
        assertEquals(0.5, recentered[2][1], 0);
        assertEquals(1., Psfs.peak(recentered), 0);
    }

    @Test
    public void testCheckStamp() {
        Psfs.checkStamp(new double[3][3]);
        try {
            Psfs.checkStamp(new double[4][4]);
            fail("Even sized stamp accepted");
        } catch (ShapeException x) {
            // expected
        }
    }
}
