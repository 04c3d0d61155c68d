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

package com.github.tinemuz.rtforward.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SpectralChannelTest {

    @Test
    @DisplayName("Planck coefficients derive from the wavenumber")
    void planckCoefficients() {
        SpectralChannel ch = SpectralChannel.of(5, 900.0, 0.1, 0.999, 0.0);

        assertEquals(SpectralChannel.C1 * 900.0 * 900.0 * 900.0, ch.planckC1(), 1.0e-9);
        assertEquals(SpectralChannel.C2 * 900.0, ch.planckC2(), 1.0e-12);
    }

    @Test
    @DisplayName("Brightness temperature inverts the band-corrected Planck radiance")
    void roundTrip() {
        SpectralChannel ch = SpectralChannel.of(5, 900.0, 0.1, 0.999, 0.0);
        for (double t : new double[] {180.0, 250.0, 320.0}) {
            assertEquals(t, ch.brightnessTemperature(ch.radiance(t)), 1.0e-9, "T = " + t);
        }
    }

    @Test
    @DisplayName("Non-positive inputs give zero")
    void nonPositive() {
        SpectralChannel ch = SpectralChannel.of(5, 900.0, 0.0, 1.0, 0.0);

        assertEquals(0.0, ch.brightnessTemperature(0.0));
        assertEquals(0.0, ch.brightnessTemperature(-1.0));
        assertEquals(0.0, ch.radiance(0.0));
    }

    @Test
    @DisplayName("Invalid channel constants are rejected")
    void invalid() {
        assertThrows(IllegalArgumentException.class, () -> SpectralChannel.of(1, 0.0, 0.0, 1.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> SpectralChannel.of(1, 900.0, 0.0, 0.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> SpectralChannel.of(1, 900.0, 0.0, 1.0, -1.0));
    }
}
