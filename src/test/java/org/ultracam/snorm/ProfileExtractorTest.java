package org.ultracam.snorm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.ultracam.snorm.fit.NonFiniteValueException;

public class ProfileExtractorTest {

    /**
     * Window whose pixel at (column, row) is (column + 1) * (row + 1).
     */
    private static Window ramp(int llx, int lly, int nx, int ny, int xbin) {
        float[][] data = new float[ny][nx];
        for (int row = 0; row < ny; row++) {
            for (int column = 0; column < nx; column++) {
                data[row][column] = (column + 1) * (row + 1);
            }
        }
        return new Window(data, llx, lly, xbin, 1);
    }

    @Test
    public void testFindCoveringWindow() {
        Window low = ramp(1, 1, 5, 10, 1);
        Window high = ramp(1, 20, 5, 10, 1);
        List<Window> windows = Arrays.asList(low, high);
        assertSame(high, ProfileExtractor.findCoveringWindow(windows, 22, 25).get());
        assertSame(low, ProfileExtractor.findCoveringWindow(windows, 1, 10).get());
        assertFalse(ProfileExtractor.findCoveringWindow(windows, 5, 15).isPresent());
        assertFalse(ProfileExtractor.findCoveringWindow(Collections.<Window>emptyList(), 1, 1).isPresent());
    }

    @Test
    public void testFirstOfOverlappingWindows() {
        Window first = ramp(1, 1, 5, 10, 1);
        Window second = ramp(10, 1, 5, 10, 1);
        assertSame(first, ProfileExtractor.findCoveringWindow(Arrays.asList(first, second), 2, 3).get());
    }

    @Test
    public void testColumnMeans() throws Exception {
        // rows 1..4 give means (column + 1) * 2.5
        Profile profile = new ProfileExtractor(3, 7, 1, 4).extract(Collections.singletonList(ramp(1, 1, 10, 4, 1)));
        assertEquals(10, profile.size());
        assertEquals(1, profile.getX(0));
        assertEquals(10, profile.getX(9));
        // outside the OK range the mean is kept linear
        assertFalse(profile.isInOkDomain(1));
        assertEquals(5.0, profile.getValue(1), 1e-12);
        assertTrue(profile.isInOkDomain(2));
        assertEquals(Math.log(7.5), profile.getValue(2), 1e-12);
        assertEquals(Math.log(17.5), profile.getValue(6), 1e-12);
        assertEquals(5, profile.getOkX().length);
        assertEquals(3, profile.getOkX()[0]);
        assertEquals(7, profile.getOkX()[4]);
        FitDomain domain = new FitDomain(4, 6);
        assertEquals(3, profile.getFitX(domain).length);
        assertEquals(4.0, profile.getFitX(domain)[0], 0);
        assertEquals(Math.log(12.5), profile.getFitValues(domain)[1], 1e-12);
    }

    @Test
    public void testBinnedColumns() throws Exception {
        Profile profile = new ProfileExtractor(1, 20, 1, 1).extract(Collections.singletonList(ramp(1, 1, 10, 1, 2)));
        assertEquals(1, profile.getX(0));
        assertEquals(3, profile.getX(1));
        assertEquals(19, profile.getX(9));
        assertEquals(Math.log(10), profile.getValue(9), 1e-12);
    }

    @Test
    public void testNoCoveringWindow() throws Exception {
        try {
            new ProfileExtractor(1, 5, 8, 12).extract(Collections.singletonList(ramp(1, 1, 5, 10, 1)));
            fail("Rows 8 to 12 are not all in the window");
        } catch (ConfigurationException x) {
            assertTrue(x.getMessage().contains("[8,12]"));
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testNoColumnInOkRange() throws Exception {
        new ProfileExtractor(50, 60, 1, 2).extract(Collections.singletonList(ramp(1, 1, 5, 10, 1)));
    }

    @Test(expected = NonFiniteValueException.class)
    public void testNonPositiveMean() throws Exception {
        Window window = ramp(1, 1, 5, 3, 1);
        window.getData()[0][2] = -100;
        new ProfileExtractor(1, 5, 1, 3).extract(Collections.singletonList(window));
    }

    @Test
    public void testNonPositiveMeanOutsideOkRange() throws Exception {
        Window window = ramp(1, 1, 5, 3, 1);
        window.getData()[0][4] = -100;
        Profile profile = new ProfileExtractor(1, 4, 1, 3).extract(Collections.singletonList(window));
        assertEquals((-100 + 10 + 15) / 3.0, profile.getValue(4), 1e-12);
    }
}
