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

package com.github.tinemuz.rtforward.optics;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.rtforward.backend.BackendException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CombinedOpticalStateTest {

    @Nested
    @DisplayName("Combined Optics")
    class CombinedTests {

        @Test
        @DisplayName("Reset returns to the zero-scattering baseline")
        void reset() {
            CombinedOpticalState optics = new CombinedOpticalState(3, 8, 2);
            optics.setLegendreTerms(6);
            optics.setPhaseElements(2);
            optics.opticalDepth()[1] = 0.7;
            optics.singleScatterAlbedo()[1] = 0.3;
            optics.deltaTruncation()[1] = 0.1;
            optics.phaseCoefficient()[5][1][2] = 0.4;

            optics.resetScattering();

            assertEquals(0, optics.nLegendreTerms());
            assertEquals(1, optics.nPhaseElements());
            assertEquals(0.0, optics.opticalDepth()[1]);
            assertEquals(0.0, optics.deltaTruncation()[1]);
            assertEquals(0.0, optics.phaseCoefficient()[5][1][2]);
            assertFalse(optics.isScattering());
        }

        @Test
        @DisplayName("Required Legendre terms only ever widen the count")
        void requireWidensOnly() {
            CombinedOpticalState optics = new CombinedOpticalState(1, 16, 1);
            optics.setLegendreTerms(8);

            assertFalse(optics.requireLegendreTerms(4));
            assertEquals(8, optics.nLegendreTerms());
            assertTrue(optics.requireLegendreTerms(12));
            assertEquals(12, optics.nLegendreTerms());
        }

        @Test
        @DisplayName("Counts outside the allocated capacity are rejected")
        void capacityEnforced() {
            CombinedOpticalState optics = new CombinedOpticalState(1, 4, 1);

            assertThrows(IllegalArgumentException.class, () -> optics.setLegendreTerms(5));
            assertThrows(IllegalArgumentException.class, () -> optics.requireLegendreTerms(-1));
            assertThrows(IllegalArgumentException.class, () -> optics.setPhaseElements(2));
            assertThrows(IllegalArgumentException.class, () -> new CombinedOpticalState(0, 4, 1));
        }

        @Test
        @DisplayName("A second release is an error")
        void doubleRelease() throws BackendException {
            CombinedOpticalState optics = new CombinedOpticalState(1, 4, 1);
            optics.release();
            assertTrue(optics.isReleased());
            assertThrows(BackendException.class, optics::release);
        }
    }

    @Nested
    @DisplayName("Surface Optics")
    class SurfaceTests {

        @Test
        @DisplayName("Channel reset clears overrides but keeps the surface temperature")
        void resetForChannel() {
            SurfaceOpticalState sfc = new SurfaceOpticalState(4, 2);
            sfc.setSurfaceTemperature(288.0);
            sfc.setComputeFromModel(false);
            sfc.setFourierOrder(3);
            sfc.emissivity()[0][0] = 0.9;
            sfc.reflectivity()[0][0][0][0] = 0.1;
            sfc.directReflectivity()[0][0] = 0.1;

            sfc.resetForChannel();

            assertTrue(sfc.computeFromModel());
            assertEquals(0, sfc.fourierOrder());
            assertEquals(0.0, sfc.emissivity()[0][0]);
            assertEquals(0.0, sfc.reflectivity()[0][0][0][0]);
            assertEquals(0.0, sfc.directReflectivity()[0][0]);
            assertEquals(288.0, sfc.surfaceTemperature());
        }

        @Test
        @DisplayName("A second release is an error")
        void doubleRelease() throws BackendException {
            SurfaceOpticalState sfc = new SurfaceOpticalState(1, 1);
            sfc.release();
            assertThrows(BackendException.class, sfc::release);
        }
    }
}
