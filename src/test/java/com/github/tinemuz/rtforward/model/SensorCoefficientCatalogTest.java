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

class SensorCoefficientCatalogTest {

    private static final SensorCoefficients AMSUA = SensorCoefficients.builder("amsua_n19", SensorType.MICROWAVE)
            .channel(SpectralChannel.of(1, 0.794, 0.0, 1.0, 0.0))
            .channel(SpectralChannel.of(2, 1.051, 0.0, 1.0, 0.0))
            .channel(SpectralChannel.of(15, 2.964, 0.0, 1.0, 0.0))
            .build();
    private static final SensorCoefficients ABI = SensorCoefficients.builder("abi_g16", SensorType.VISIBLE)
            .channel(SpectralChannel.of(2, 15797.0, 0.0, 1.0, 1580.0))
            .build();

    @Test
    @DisplayName("Channels are selected by published number")
    void selectByNumber() {
        SensorCoefficientCatalog catalog = SensorCoefficientCatalog.of(AMSUA, ABI);

        ChannelCatalog selected = catalog.select("amsua_n19", 15, 1);

        assertEquals(2, selected.nChannels());
        assertEquals(2, selected.channelIndex(0));
        assertEquals(15, selected.sensorChannel(0));
        assertEquals(0, selected.channelIndex(1));
        assertEquals(3, catalog.selectAll("amsua_n19").nChannels());
        assertTrue(catalog.contains("abi_g16"));
        assertTrue(catalog.sensor("abi_g16").type().isVisible());
    }

    @Test
    @DisplayName("Unknown sensors, channels and duplicates are rejected")
    void rejections() {
        SensorCoefficientCatalog catalog = SensorCoefficientCatalog.of(AMSUA);

        assertThrows(IllegalArgumentException.class, () -> catalog.sensor("mhs_n19"));
        assertThrows(IllegalArgumentException.class, () -> catalog.select("amsua_n19", 16));
        assertThrows(IllegalArgumentException.class, () -> SensorCoefficientCatalog.of(AMSUA, AMSUA));
        assertThrows(IllegalArgumentException.class, () -> ChannelCatalog.of(AMSUA, 3));
    }

    @Test
    @DisplayName("Only visible sensors count as visible")
    void visibleType() {
        assertTrue(SensorType.VISIBLE.isVisible());
        assertFalse(SensorType.ULTRAVIOLET.isVisible());
        assertFalse(SensorType.INFRARED.isVisible());
        assertFalse(AMSUA.hasAntennaPattern());
    }
}
