/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.tinemuz.rtforward.atmosphere;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.rtforward.backend.BackendException;
import com.github.tinemuz.rtforward.model.AtmosphericProfile;
import com.github.tinemuz.rtforward.model.Cloud;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AtmosphereExtenderTest {

    private static final double TOA = 0.005;
    private static final double TOLERANCE = 1.0e-12;
    private static final int[] IDS = {AtmosphericProfile.H2O, AtmosphericProfile.CO2, AtmosphericProfile.O3};

    private final ReferenceAtmosphere reference = ReferenceAtmosphere.standard();
    private final AtmosphereExtender extender = new AtmosphereExtender(reference, TOA);

    @Nested
    @DisplayName("Added Layers")
    class AddedLayerTests {

        @Test
        @DisplayName("Profile reaching the top of the atmosphere is returned unchanged")
        void alreadyAtTop() throws BackendException {
            AtmosphericProfile profile = profile(0.005, 1.0, 100.0);

            ExtendedAtmosphere ext = extender.extend(profile);

            assertSame(profile, ext.atmosphere());
            assertTrue(ext.extension().isEmpty());
            assertEquals(0.005, ext.extension().originalTopPressure(), 0.0);
        }

        @Test
        @DisplayName("Reference levels too close to the profile top are skipped")
        void gapRule() throws BackendException {
            // the 0.011 hPa reference level lies within 10% of a 0.012 hPa top
            ExtendedAtmosphere close = extender.extend(profile(0.012, 1.0, 100.0));
            ExtendedAtmosphere far = extender.extend(profile(0.02, 1.0, 100.0));

            assertEquals(1, close.extension().nAddedLayers());
            assertEquals(2, far.extension().nAddedLayers());
            assertEquals(0.011, far.atmosphere().levelPressure(1), 0.0);
        }

        @Test
        @DisplayName("Added layer state follows the reference atmosphere")
        void addedLayerState() throws BackendException {
            AtmosphericProfile profile = profile(0.012, 1.0, 100.0);

            AtmosphericProfile ext = extender.extend(profile).atmosphere();

            assertEquals(TOA, ext.topPressure(), 0.0);
            assertEquals((0.012 - TOA) / Math.log(0.012 / TOA), ext.pressure(0), TOLERANCE);
            assertEquals(0.5 * (reference.temperatureAt(TOA) + reference.temperatureAt(0.012)),
                    ext.temperature(0), TOLERANCE);

            double scale = profile.absorber(0, 2) / reference.absorberAt(AtmosphericProfile.O3, profile.pressure(0));
            double o3 = scale * 0.5 * (reference.absorberAt(AtmosphericProfile.O3, TOA)
                    + reference.absorberAt(AtmosphericProfile.O3, 0.012));
            assertEquals(o3, ext.absorber(0, 2), TOLERANCE);
            assertEquals(profile.absorber(0, 1), ext.absorber(0, 1), 0.0, "CO2 is not in the reference table");
        }

        @Test
        @DisplayName("Caller layers are kept below the added ones")
        void originalLayersKept() throws BackendException {
            AtmosphericProfile profile = profile(100.0, 500.0, 1000.0);

            ExtendedAtmosphere ext = extender.extend(profile);
            AtmosphericProfile atm = ext.atmosphere();
            int added = ext.extension().nAddedLayers();

            assertTrue(added > 1);
            assertEquals(profile.nLayers() + added, atm.nLayers());
            assertNull(atm.findDefect());
            for (int k = 0; k < profile.nLayers(); k++) {
                assertEquals(profile.pressure(k), atm.pressure(added + k), 0.0);
                assertEquals(profile.temperature(k), atm.temperature(added + k), 0.0);
                for (int j = 0; j < IDS.length; j++) assertEquals(profile.absorber(k, j), atm.absorber(added + k, j), 0.0);
            }
            for (int i = 1; i < added; i++) {
                assertTrue(atm.levelPressure(i) < 90.0, "No sliver layer below the first added level");
            }
        }

        @Test
        @DisplayName("Clouds are empty in added layers")
        void cloudsPadded() throws BackendException {
            Cloud ice = new Cloud(Cloud.Type.ICE, new double[] {30.0, 0.0}, new double[] {0.05, 0.0});
            AtmosphericProfile base = profile(100.0, 500.0, 1000.0);
            AtmosphericProfile cloudy = new AtmosphericProfile(
                    new double[] {100.0, 500.0, 1000.0},
                    new double[] {base.pressure(0), base.pressure(1)},
                    new double[] {base.temperature(0), base.temperature(1)},
                    IDS, new double[][] {{0.01, 400.0, 0.3}, {5.0, 400.0, 0.05}}, List.of(ice), List.of());

            ExtendedAtmosphere ext = extender.extend(cloudy);
            int added = ext.extension().nAddedLayers();
            Cloud padded = ext.atmosphere().clouds().get(0);

            assertEquals(Cloud.Type.ICE, padded.type());
            assertEquals(ext.atmosphere().nLayers(), padded.nLayers());
            for (int k = 0; k < added; k++) assertEquals(0.0, padded.loading(k));
            assertEquals(0.05, padded.loading(added), 0.0);
            assertEquals(30.0, padded.maxEffectiveRadius(), 0.0);
        }
    }

    @Nested
    @DisplayName("Extension Bookkeeping")
    class BookkeepingTests {

        @Test
        @DisplayName("Added layers can be stripped from per-layer arrays")
        void strip() throws BackendException {
            AtmosphericProfile profile = profile(100.0, 500.0, 1000.0);
            ExtendedAtmosphere ext = extender.extend(profile);
            double[] temperatures = new double[ext.nLayers()];
            for (int k = 0; k < temperatures.length; k++) temperatures[k] = ext.atmosphere().temperature(k);

            double[] stripped = ext.extension().strip(temperatures);

            assertArrayEquals(new double[] {profile.temperature(0), profile.temperature(1)}, stripped, 0.0);
            assertThrows(IllegalArgumentException.class, () -> ext.extension().strip(new double[0]));
        }

        @Test
        @DisplayName("Workspaces refuse a second release")
        void doubleRelease() throws BackendException {
            ExtendedAtmosphere ext = extender.extend(profile(100.0, 500.0, 1000.0));

            ext.release();
            ext.extension().release();

            assertTrue(ext.isReleased());
            assertTrue(ext.extension().isReleased());
            assertThrows(BackendException.class, ext::release);
            assertThrows(BackendException.class, () -> ext.extension().release());
        }

        @Test
        @DisplayName("Malformed profiles are rejected")
        void malformed() {
            AtmosphericProfile upsideDown = AtmosphericProfile.clearSky(
                    new double[] {1000.0, 500.0}, new double[] {700.0}, new double[] {280.0},
                    IDS, new double[][] {{1.0, 400.0, 0.05}});

            BackendException e = assertThrows(BackendException.class, () -> extender.extend(upsideDown));
            assertTrue(e.getMessage().startsWith("Malformed profile"));
        }

        @Test
        @DisplayName("Top-of-atmosphere pressure must be positive")
        void invalidToa() {
            assertThrows(IllegalArgumentException.class, () -> new AtmosphereExtender(reference, 0.0));
            assertThrows(IllegalArgumentException.class, () -> new AtmosphereExtender(null, TOA));
        }
    }

    /** Clear-sky profile on the given levels with H2O, CO2 and O3 columns. */
    private static AtmosphericProfile profile(double... levels) {
        int n = levels.length - 1;
        double[] p = new double[n];
        double[] t = new double[n];
        double[][] abs = new double[n][];
        for (int k = 0; k < n; k++) {
            p[k] = (levels[k + 1] - levels[k]) / Math.log(levels[k + 1] / levels[k]);
            t[k] = 200.0 + 10.0 * k;
            abs[k] = new double[] {0.003 * (k + 1), 400.0, 0.4};
        }
        return AtmosphericProfile.clearSky(levels, p, t, IDS, abs);
    }
}
