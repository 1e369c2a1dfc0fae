package org.hci.contrast;

import java.awt.geom.Point2D;
import java.util.Arrays;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

/**
 *
 * @author hci
 */
public class SkyGeometryTest {

    @Test
    public void testPositionAngle() {
        assertEquals(0., SkyGeometry.positionAngle(0, 1), 1e-12);
        assertEquals(90., SkyGeometry.positionAngle(-1, 0), 1e-12);
        assertEquals(180., SkyGeometry.positionAngle(0, -1), 1e-12);
        assertEquals(270., SkyGeometry.positionAngle(1, 0), 1e-12);
    }

    @Test
    public void testOffsetMatchesPositionAngle() {
        for (double pa = 0; pa < 360; pa += 30) {
            Point2D.Double offset = SkyGeometry.offset(7.5, pa);
            assertEquals(7.5, offset.distance(0, 0), 1e-9);
            assertEquals(pa, SkyGeometry.positionAngle(offset.x, offset.y), 1e-9);
        }
    }

    @Test
    public void testFwhm() {
        // 3.56 microns on a 6.5 m mirror at 63 mas/pixel
        assertEquals(1.793, SkyGeometry.fwhm(3.56e-6, 6.5, 63.), 1e-3);
    }

    @Test
    public void testInterpolate() {
        ContrastCurve curve = new ContrastCurve(new double[]{1, 2, 4}, new double[]{1e-3, 1e-4, Double.NaN}, 63);
        assertEquals(1e-3, curve.interpolate(1), 0);
        assertEquals(5.5e-4, curve.interpolate(1.5), 1e-15);
        assertTrue(Double.isNaN(curve.interpolate(3)));
        assertTrue(Double.isNaN(curve.interpolate(0.5)));
        assertTrue(Double.isNaN(curve.interpolate(5)));
    }

    @Test
    public void testExpandScenarios() {
        List<ScenarioConfig> scenarios = ScenarioConfig.expand(Arrays.asList("ADI", "RDI"), Arrays.asList(1, 2), Arrays.asList(1), Arrays.asList("OBS_1", "OBS_2"));
        assertEquals(8, scenarios.size());
        assertEquals(new ScenarioConfig("ADI", 1, 1, "OBS_1"), scenarios.get(0));
        assertEquals(new ScenarioConfig("RDI", 2, 1, "OBS_2"), scenarios.get(7));
        assertEquals("RDI_annu2_subs1", scenarios.get(7).getDirectoryName());
    }
}
