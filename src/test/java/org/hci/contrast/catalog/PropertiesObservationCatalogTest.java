package org.hci.contrast.catalog;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.hci.contrast.ExposureInfo;
import org.hci.contrast.SkyGeometry;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

/**
 *
 * @author hci
 */
public class PropertiesObservationCatalogTest {

    private static PropertiesObservationCatalog read() throws IOException {
        InputStream in = PropertiesObservationCatalogTest.class.getResourceAsStream("catalog.properties");
        assertNotNull(in);
        return new PropertiesObservationCatalog(in);
    }

    @Test
    public void testRead() throws IOException {
        PropertiesObservationCatalog catalog = read();
        assertEquals(Arrays.asList("OBS_1", "OBS_2"), catalog.getDatasetKeys());
        CatalogEntry entry = catalog.entry("OBS_1");
        assertEquals(63., entry.getPixelScale(), 0);
        assertEquals(160., entry.getCenter().getX(), 0);
        assertEquals(161.5, entry.getCenter().getY(), 0);
        assertEquals("F356W", entry.getFilter());
        assertEquals("MASK335R", entry.getMask());
        assertEquals(Arrays.asList(new ExposureInfo(0, 1000), new ExposureInfo(10, 1000)), entry.getExposures());
        assertEquals(Arrays.asList("roll1.fits", "roll2.fits"), entry.getScienceFiles());
        assertEquals(6.77, entry.getHostMagnitude(), 0);
        assertEquals(261., entry.getZeroPoint(), 0);
        assertEquals(SkyGeometry.fwhm(3.56e-6, 6.5, 63.), entry.fwhm(6.5), 1e-12);

        CatalogEntry bar = catalog.entry("OBS_2");
        assertEquals("MASKASWB", bar.getMask());
        assertTrue(bar.getScienceFiles().isEmpty());
        assertEquals(-5., bar.getExposures().get(0).getRollAngle(), 0);
        assertEquals(700., bar.getExposures().get(1).getIntegrationTime(), 0);
    }

    @Test
    public void testUnknownDataset() throws IOException {
        try {
            read().entry("OBS_3");
            fail("Unknown dataset accepted");
        } catch (IOException x) {
            assertTrue(x.getMessage().contains("OBS_3"));
        }
    }

    @Test
    public void testInvalidCatalogs() {
        String[] bad = {
            "OBS_1 = 1, 2\n",
            "legend = PIXSCALE, CENTX\nOBS_1 = 1, 2\n",
            "legend = PIXSCALE, CENTX, CENTY, FILTER, MASK, MSTAR, F0, WAVE, ROLLS, INTTIMES\nOBS_1 = 1, 2\n"
        };
        for (String text : bad) {
            try {
                new PropertiesObservationCatalog(new ByteArrayInputStream(text.getBytes(StandardCharsets.ISO_8859_1)));
                fail("Accepted " + text);
            } catch (IOException x) {
                // expected
            }
        }
    }

    @Test
    public void testMismatchedRolls() throws IOException {
        String text = "legend = PIXSCALE, CENTX, CENTY, FILTER, MASK, MSTAR, F0, WAVE, ROLLS, INTTIMES\n"
                + "OBS_1 = 63, 10, 10, F356W, MASK335R, 6.7, 261, 3.56e-6, [0 10], [1000]\n";
        PropertiesObservationCatalog catalog = new PropertiesObservationCatalog(new ByteArrayInputStream(text.getBytes(StandardCharsets.ISO_8859_1)));
        try {
            catalog.entry("OBS_1");
            fail("Mismatched rolls accepted");
        } catch (IOException x) {
            // expected
        }
    }
}
